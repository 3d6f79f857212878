package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

/**
 * Definition of an output &lt;variable&gt; node, either inline in a template or
 * global (reused through variable groups).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableDefinition {
    /**
     * Definition name (e.g., "PosterVar")
     */
    private String name;

    /**
     * Only built when the item context matches
     */
    @Builder.Default
    private String condition = "";

    /**
     * Output name pattern overriding the variable's own name attribute.
     * May contain $PROPERTY[...] placeholders.
     */
    @Builder.Default
    private String output = "";

    /**
     * The &lt;variable&gt; element itself; never mutated, copied per build
     */
    private Element content;
}
