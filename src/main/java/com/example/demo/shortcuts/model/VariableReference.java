package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of a variable group pointing at a global variable definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableReference {
    private String name;

    @Builder.Default
    private String condition = "";
}
