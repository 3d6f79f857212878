package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Group of variable references built together. Nested group references are
 * built first and inherit the suffix the enclosing group is built with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableGroup {
    private String name;

    @Builder.Default
    private List<VariableReference> references = new ArrayList<>();

    @Builder.Default
    private List<VariableGroupReference> groupRefs = new ArrayList<>();
}
