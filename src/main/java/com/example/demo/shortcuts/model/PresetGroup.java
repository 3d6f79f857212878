package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional preset selection. Children are evaluated in document order and
 * the first matching child that yields values wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetGroup {
    private String name;

    @Builder.Default
    private List<PresetGroupChild> children = new ArrayList<>();
}
