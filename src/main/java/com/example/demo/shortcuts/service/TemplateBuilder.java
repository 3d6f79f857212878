package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.expression.SuffixTransformer;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.PropertySchema;
import com.example.demo.shortcuts.model.Template;
import com.example.demo.shortcuts.model.TemplateOnly;
import com.example.demo.shortcuts.model.TemplateOutput;
import com.example.demo.shortcuts.model.TemplateSchema;
import com.example.demo.shortcuts.model.VariableDefinition;
import com.example.demo.shortcuts.model.VariableGroup;
import com.example.demo.shortcuts.model.VariableGroupReference;
import com.example.demo.shortcuts.model.VariableReference;
import com.example.demo.shortcuts.util.MarkupSupport;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the generated includes file from a template schema and the menu
 * records. One instance serves one build run.
 *
 * The result is an {@code <includes>} root holding every generated
 * {@code <variable>} first, then one {@code <include>} per distinct output
 * include name. Templates writing to the same include name share a single
 * include element.
 */
@Slf4j
public class TemplateBuilder {

    public static final String INCLUDE_PREFIX = "skinshortcuts-template-";
    public static final String DEFAULT_EMPTY_DESCRIPTION =
            "Automatically generated - no menu items matched this template";

    private static final Pattern ASSIGNED_INCLUDE_PATTERN =
            Pattern.compile("\\$INCLUDE\\[" + INCLUDE_PREFIX + "([^\\]]+)\\]");

    private final TemplateSchema schema;
    private final List<Menu> menus;
    private final String emptyDescription;
    private final Set<String> assignedIncludes;

    private final TemplateConditions conditions;
    private final TextSubstitutor substitutor;
    private final ContextResolver resolver;
    private final ControlsProcessor controlsProcessor;

    public TemplateBuilder(TemplateSchema schema, List<Menu> menus, String containerId,
                           PropertySchema propertySchema) {
        this(schema, menus, containerId, propertySchema, DEFAULT_EMPTY_DESCRIPTION);
    }

    public TemplateBuilder(TemplateSchema schema, List<Menu> menus, String containerId,
                           PropertySchema propertySchema, String emptyDescription) {
        this.schema = schema;
        this.menus = menus;
        this.emptyDescription = emptyDescription;

        // duplicate menu names: the last one wins
        Map<String, Menu> menuMap = new HashMap<>();
        for (Menu menu : menus) {
            menuMap.put(menu.getName(), menu);
        }

        this.conditions = new TemplateConditions(schema);
        this.substitutor = new TextSubstitutor(schema);
        this.resolver = new ContextResolver(schema, propertySchema, conditions, substitutor);
        this.controlsProcessor = new ControlsProcessor(schema, containerId, menuMap, conditions, resolver, substitutor);
        this.assignedIncludes = collectAssignedIncludes(menus);
    }

    /**
     * Include names referenced from any menu item property value, e.g. a
     * widgetPath of {@code $INCLUDE[skinshortcuts-template-widget]}.
     */
    private static Set<String> collectAssignedIncludes(List<Menu> menus) {
        Set<String> assigned = new HashSet<>();
        for (Menu menu : menus) {
            for (MenuItem item : menu.getItems()) {
                for (String value : item.getProperties().values()) {
                    if (value == null || value.isEmpty()) {
                        continue;
                    }
                    Matcher m = ASSIGNED_INCLUDE_PATTERN.matcher(value);
                    while (m.find()) {
                        assigned.add(INCLUDE_PREFIX + m.group(1));
                    }
                }
            }
        }
        return assigned;
    }

    Set<String> getAssignedIncludes() {
        return assignedIncludes;
    }

    /**
     * Run the build.
     *
     * @return the {@code <includes>} root element
     */
    public Element build() {
        Element root = new Element("includes");

        Map<String, Element> includes = new LinkedHashMap<>();
        Map<String, TemplateOnly> templateOnly = new HashMap<>();
        VariableRegistry variables = new VariableRegistry();

        for (Template template : schema.getTemplates()) {
            for (TemplateOutput output : template.getEffectiveOutputs()) {
                String includeName = INCLUDE_PREFIX + output.getInclude();

                if (template.getTemplateOnly() != null && template.getTemplateOnly() != TemplateOnly.NONE) {
                    templateOnly.put(includeName, template.getTemplateOnly());
                }

                Element include = includes.computeIfAbsent(includeName,
                        name -> new Element("include").attr("name", name));
                buildTemplateInto(template, output, include, variables);
            }
        }

        for (Element variable : variables.values()) {
            root.appendChild(variable);
        }

        for (Map.Entry<String, Element> entry : includes.entrySet()) {
            String includeName = entry.getKey();
            TemplateOnly setting = templateOnly.getOrDefault(includeName, TemplateOnly.NONE);
            if (setting == TemplateOnly.ALWAYS) {
                log.debug("Skipping template-only include '{}'", includeName);
                continue;
            }
            if (setting == TemplateOnly.AUTO && !assignedIncludes.contains(includeName)) {
                log.debug("Skipping unassigned include '{}'", includeName);
                continue;
            }

            Element include = entry.getValue();
            if (include.children().isEmpty()) {
                include.appendElement("description").text(emptyDescription);
            }
            root.appendChild(include);
        }

        log.info("Built {} variables and {} includes", variables.size(), root.children().size() - variables.size());
        return root;
    }

    private void buildTemplateInto(Template template, TemplateOutput output, Element include,
                                   VariableRegistry variables) {
        String suffix = output.getSuffix() != null ? output.getSuffix() : "";

        for (Menu menu : menus) {
            if (template.getMenu() != null && !template.getMenu().isEmpty()
                    && !template.getMenu().equals(menu.getName())) {
                continue;
            }

            int index = 0;
            for (MenuItem item : menu.getItems()) {
                index++;
                if (item.isDisabled()) {
                    continue;
                }
                if (!conditions.matchesAll(template.getConditions(), item, suffix)) {
                    continue;
                }

                Map<String, String> context = resolver.buildItemContext(template, output, item, index, menu);

                if (template.getControls() != null) {
                    Element controls = controlsProcessor.processControls(template.getControls(), context, item);
                    for (Node node : MarkupSupport.fragmentNodes(controls)) {
                        include.appendChild(node);
                    }
                }

                for (VariableDefinition definition : template.getVariables()) {
                    Element variable = buildVariable(definition, context, item);
                    if (variable != null) {
                        variables.add(variable);
                    }
                }

                for (VariableGroupReference ref : template.getVariableGroups()) {
                    buildVariableGroup(ref, context, item, variables, ref.effectiveSuffix(suffix));
                }
            }
        }
    }

    /**
     * @return the substituted variable element, or null when its condition
     *         fails or it has no content
     */
    Element buildVariable(VariableDefinition definition, Map<String, String> context, MenuItem item) {
        if (!conditions.matches(definition.getCondition(), item, context)) {
            return null;
        }
        if (definition.getContent() == null) {
            return null;
        }

        Element variable = definition.getContent().clone();
        String name;
        if (definition.getOutput() != null && !definition.getOutput().isEmpty()) {
            name = definition.getOutput();
        } else {
            name = variable.hasAttr("name") && !variable.attr("name").isEmpty()
                    ? variable.attr("name") : definition.getName();
        }
        variable.attr("name", substitutor.substitutePropertyRefs(name, item, context));

        for (Element element : variable.getAllElements()) {
            ControlsProcessor.substituteOwnText(element, text -> substitutor.substitutePropertyRefs(text, item, context));
        }
        return variable;
    }

    /**
     * Build the variables a group references. The group's own condition is
     * evaluated as written; reference conditions get the suffix, which is
     * applied before $EXP references are expanded. Nested groups
     * are built first with the same suffix.
     */
    void buildVariableGroup(VariableGroupReference ref, Map<String, String> context, MenuItem item,
                            VariableRegistry variables, String suffix) {
        if (!conditions.matches(ref.getCondition(), item, context)) {
            return;
        }

        VariableGroup group = schema.getVariableGroup(ref.getName());
        if (group == null) {
            log.debug("Variable group '{}' not found", ref.getName());
            return;
        }

        for (VariableGroupReference nested : group.getGroupRefs()) {
            VariableGroupReference inherited = VariableGroupReference.builder()
                    .name(nested.getName())
                    .suffix(suffix)
                    .build();
            buildVariableGroup(inherited, context, item, variables, suffix);
        }

        for (VariableReference reference : group.getReferences()) {
            String condition = reference.getCondition();
            // suffixed before expansion, so $EXP content keeps its own names
            if (condition != null && !condition.isEmpty()
                    && !conditions.matches(SuffixTransformer.applySuffixToCondition(condition, suffix), item, context)) {
                continue;
            }

            VariableDefinition definition = schema.getVariableDefinition(reference.getName());
            if (definition == null) {
                log.debug("Variable definition '{}' not found", reference.getName());
                continue;
            }

            Element variable = buildVariable(definition, context, item);
            if (variable != null) {
                variables.add(variable);
            }
        }
    }
}
