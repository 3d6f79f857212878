package com.example.demo.shortcuts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-branch property: the first value whose condition matches (or that
 * has no condition) is used.
 *
 * <pre>
 * &lt;var name="aspect"&gt;
 *     &lt;value condition="widgetArt=Poster"&gt;stretch&lt;/value&gt;
 *     &lt;value&gt;scale&lt;/value&gt;
 * &lt;/var&gt;
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateVar {
    private String name;

    @Builder.Default
    private List<TemplateProperty> values = new ArrayList<>();
}
