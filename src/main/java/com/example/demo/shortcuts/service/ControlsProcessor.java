package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.model.IncludeDefinition;
import com.example.demo.shortcuts.model.ItemsDefinition;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.TemplateSchema;
import com.example.demo.shortcuts.util.MarkupSupport;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a template's control markup for one menu item.
 *
 * Besides placeholder substitution in text and attributes, three kinds of
 * &lt;skinshortcuts&gt; marker are resolved here:
 * - {@code <skinshortcuts>visibility</skinshortcuts>} becomes a visible
 *   condition matching the item in the menu container
 * - {@code <skinshortcuts include="name" condition=".." wrap="true"/>} is
 *   replaced by the named include's expanded controls
 * - {@code <skinshortcuts insert="name"/>} is replaced by one copy of the
 *   items definition's controls per submenu item
 */
@Slf4j
class ControlsProcessor {

    static final String MARKER_TAG = "skinshortcuts";

    private static final Pattern INCLUDE_PATTERN = Pattern.compile("\\$INCLUDE\\[([^\\]]+)\\]");

    private final TemplateSchema schema;
    private final String containerId;
    private final Map<String, Menu> menuMap;
    private final TemplateConditions conditions;
    private final ContextResolver resolver;
    private final TextSubstitutor substitutor;

    ControlsProcessor(TemplateSchema schema, String containerId, Map<String, Menu> menuMap,
                      TemplateConditions conditions, ContextResolver resolver, TextSubstitutor substitutor) {
        this.schema = schema;
        this.containerId = containerId;
        this.menuMap = menuMap;
        this.conditions = conditions;
        this.resolver = resolver;
        this.substitutor = substitutor;
    }

    /**
     * Deep copy the controls wrapper and expand it for the item. The schema's
     * own markup is never modified.
     */
    Element processControls(Element controls, Map<String, String> context, MenuItem item) {
        Element result = controls.clone();
        processElement(result, context, item);
        return result;
    }

    private void processElement(Element element, Map<String, String> context, MenuItem item) {
        UnaryOperator<String> substitution = text -> substitutor.substitute(text, context, item);
        substituteOwnText(element, substitution);
        handleIncludeSubstitution(element);

        for (Element child : new ArrayList<>(element.children())) {
            if (!MARKER_TAG.equals(child.tagName())) {
                processElement(child, context, item);
                continue;
            }

            if (child.text().trim().equals("visibility")) {
                child.tagName("visible");
                child.text("String.IsEqual(Container(" + containerId + ").ListItem.Property(name)," + item.getName() + ")");
            }

            if (child.hasAttr("include") && !child.attr("include").isEmpty()) {
                expandInclude(child, context, item);
            } else if (child.hasAttr("insert") && !child.attr("insert").isEmpty()) {
                expandItems(child, context, item);
            } else {
                processElement(child, context, item);
            }
        }
    }

    /**
     * {@code $INCLUDE[name]} in an element's leading text becomes an
     * {@code <include>name</include>} child, followed by the remaining text.
     */
    private void handleIncludeSubstitution(Element element) {
        if (element.childNodeSize() == 0 || !(element.childNode(0) instanceof TextNode)) {
            return;
        }
        TextNode leading = (TextNode) element.childNode(0);
        String text = leading.getWholeText();
        Matcher m = INCLUDE_PATTERN.matcher(text);
        if (!m.find()) {
            return;
        }

        Element include = new Element("include").text(m.group(1));
        String rest = text.substring(m.end());
        leading.after(include);
        if (!rest.isEmpty()) {
            include.after(new TextNode(rest));
        }

        String before = text.substring(0, m.start());
        if (before.isEmpty()) {
            leading.remove();
        } else {
            leading.text(before);
        }
    }

    private void expandInclude(Element marker, Map<String, String> context, MenuItem item) {
        String includeName = marker.attr("include");

        if (!conditions.matches(marker.attr("condition"), item, context)) {
            marker.remove();
            return;
        }

        IncludeDefinition definition = schema.getInclude(includeName);
        if (definition == null || definition.getControls() == null) {
            log.debug("Include '{}' not found", includeName);
            marker.remove();
            return;
        }

        Element expanded = processControls(definition.getControls(), context, item);
        List<Node> fragment = new ArrayList<>(MarkupSupport.fragmentNodes(expanded));

        if ("true".equalsIgnoreCase(marker.attr("wrap"))) {
            Element wrapper = new Element("include").attr("name", includeName);
            for (Node node : fragment) {
                wrapper.appendChild(node);
            }
            marker.before(wrapper);
        } else {
            for (Node node : fragment) {
                marker.before(node);
            }
        }
        marker.remove();
    }

    private void expandItems(Element marker, Map<String, String> parentContext, MenuItem parentItem) {
        String insertName = marker.attr("insert");

        ItemsDefinition definition = schema.getItemsDefinition(insertName);
        if (definition == null) {
            log.debug("Items definition '{}' not found", insertName);
            marker.remove();
            return;
        }

        if (!conditions.matches(definition.getCondition(), parentItem, parentContext)) {
            marker.remove();
            return;
        }

        String submenuName = parentItem.getName() + "." + definition.getEffectiveSource();
        Menu submenu = menuMap.get(submenuName);
        if (submenu == null || submenu.getItems().isEmpty()) {
            log.debug("Submenu '{}' not found or empty for items iteration", submenuName);
            marker.remove();
            return;
        }

        if (definition.getControls() == null) {
            marker.remove();
            return;
        }

        List<Node> template = MarkupSupport.fragmentNodes(definition.getControls());
        int index = 0;
        for (MenuItem subItem : submenu.getItems()) {
            index++;
            if (subItem.isDisabled()) {
                continue;
            }
            if (!conditions.matches(definition.getFilter(), subItem, Collections.emptyMap())) {
                continue;
            }

            Map<String, String> subContext = resolver.buildItemsContext(subItem, index, submenu);
            resolver.applyItemsTransformations(definition, subItem, subContext);

            UnaryOperator<String> substitution = text ->
                    substitutor.substitute(text, subContext, subItem, parentContext, parentItem);
            for (Node node : template) {
                Node copy = node.clone();
                if (copy instanceof Element) {
                    substituteTree((Element) copy, substitution);
                } else if (copy instanceof TextNode) {
                    substituteText((TextNode) copy, substitution);
                }
                marker.before(copy);
            }
        }
        marker.remove();
    }

    private static void substituteTree(Element element, UnaryOperator<String> substitution) {
        substituteOwnText(element, substitution);
        for (Element child : element.children()) {
            substituteTree(child, substitution);
        }
    }

    /**
     * Attributes and direct text children of one element.
     */
    static void substituteOwnText(Element element, UnaryOperator<String> substitution) {
        for (Attribute attribute : element.attributes()) {
            attribute.setValue(substitution.apply(attribute.getValue()));
        }
        for (Node node : element.childNodes()) {
            if (node instanceof TextNode) {
                substituteText((TextNode) node, substitution);
            }
        }
    }

    private static void substituteText(TextNode node, UnaryOperator<String> substitution) {
        String text = node.getWholeText();
        if (!text.isEmpty()) {
            node.text(substitution.apply(text));
        }
    }
}
