package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookup table returning a set of attribute values; the first matching row wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Preset {
    private String name;

    @Builder.Default
    private List<PresetRow> rows = new ArrayList<>();
}
