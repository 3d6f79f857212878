package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Named reusable condition fragment, referenced as $EXP[name].
 * When nosuffix is set the expanded text is protected from suffix rewriting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Expression {
    @Builder.Default
    private String value = "";

    private boolean nosuffix;
}
