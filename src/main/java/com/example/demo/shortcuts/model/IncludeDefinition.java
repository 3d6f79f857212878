package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

/**
 * Reusable controls fragment inserted with &lt;skinshortcuts include="name"/&gt;.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncludeDefinition {
    private String name;

    /**
     * Wrapper element whose children are the fragment content
     */
    private Element controls;
}
