package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Value used for a property an item does not set. Rules are tried in order;
 * a rule without condition always applies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyFallback {
    private String property;

    @Builder.Default
    private List<FallbackRule> rules = new ArrayList<>();
}
