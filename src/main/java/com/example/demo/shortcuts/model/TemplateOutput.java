package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One include produced by a template. A template with several outputs is
 * built once per output, each time with that output's id prefix and suffix
 * (e.g., widget slot 1 and widget slot 2 from a single definition).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateOutput {
    private String include;

    @Builder.Default
    private String idPrefix = "";

    @Builder.Default
    private String suffix = "";
}
