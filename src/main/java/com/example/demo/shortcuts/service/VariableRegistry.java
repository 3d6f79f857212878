package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.util.MarkupSupport;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the &lt;variable&gt; elements of one build run, keyed by their
 * final name. A later variable with a name already registered contributes
 * its children to the first one instead of producing a second element.
 */
class VariableRegistry {

    private final Map<String, Element> variables = new LinkedHashMap<>();

    void add(Element variable) {
        String name = variable.attr("name");
        if (name.isEmpty()) {
            return;
        }

        Element existing = variables.get(name);
        if (existing == null) {
            variables.put(name, variable);
            return;
        }

        List<Node> nodes = new ArrayList<>(MarkupSupport.fragmentNodes(variable));
        for (Node node : nodes) {
            existing.appendChild(node);
        }
    }

    Collection<Element> values() {
        return Collections.unmodifiableCollection(variables.values());
    }

    int size() {
        return variables.size();
    }
}
