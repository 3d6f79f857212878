package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.aspect.LogExecutionTime;
import com.example.demo.shortcuts.config.TemplateBuilderProperties;
import com.example.demo.shortcuts.exception.TemplateBuildException;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.PropertySchema;
import com.example.demo.shortcuts.model.TemplateSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for generating the template includes.
 *
 * Each call runs a fresh {@link TemplateBuilder}, so the service holds no
 * state between builds. Loading the schema and menus, and writing the result
 * to disk, belong to the callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateBuildService {
    private final TemplateBuilderProperties properties;

    /**
     * Build with the configured container id.
     *
     * @param schema parsed template schema
     * @param menus menu records, submenus included
     * @param propertySchema fallbacks; may be null
     * @return the {@code <includes>} root element
     */
    @LogExecutionTime("Template Include Build")
    public Element build(TemplateSchema schema, List<Menu> menus, PropertySchema propertySchema) {
        return build(schema, menus, propertySchema, properties.getContainerId());
    }

    @LogExecutionTime("Template Include Build")
    public Element build(TemplateSchema schema, List<Menu> menus, PropertySchema propertySchema, String containerId) {
        if (schema == null) {
            throw new TemplateBuildException(TemplateBuildException.MISSING_SCHEMA, "Template schema is required");
        }
        if (menus == null) {
            throw new TemplateBuildException(TemplateBuildException.MISSING_MENUS, "Menu list is required");
        }

        try {
            log.info("Building {} templates for {} menus (container {})",
                    schema.getTemplates().size(), menus.size(), containerId);
            TemplateBuilder builder = new TemplateBuilder(schema, menus, containerId, propertySchema,
                    properties.getEmptyIncludeDescription());
            return builder.build();
        } catch (TemplateBuildException e) {
            log.error("Template build aborted [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Template build failed", e);
            throw new TemplateBuildException(TemplateBuildException.BUILD_FAILED,
                    "Template build failed: " + e.getMessage(), e);
        }
    }
}
