package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The part of the skin's property schema the builder consumes: fallbacks
 * keyed by unsuffixed property name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertySchema {
    @Builder.Default
    private Map<String, PropertyFallback> fallbacks = new LinkedHashMap<>();
}
