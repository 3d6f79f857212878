package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FallbackRule {
    @Builder.Default
    private String condition = "";

    @Builder.Default
    private String value = "";
}
