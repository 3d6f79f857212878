package com.example.demo.shortcuts.config;

import com.example.demo.shortcuts.service.TemplateBuilder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Builder settings.
 *
 * Example application.yml:
 *
 * shortcuts:
 *   builder:
 *     container-id: "9000"
 *     empty-include-description: "Automatically generated - no menu items matched this template"
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "shortcuts.builder")
public class TemplateBuilderProperties {

    /**
     * Id of the list container whose focused item the visibility shorthand tests
     */
    private String containerId = "9000";

    /**
     * Text of the description added to includes no menu item contributed to
     */
    private String emptyIncludeDescription = TemplateBuilder.DEFAULT_EMPTY_DESCRIPTION;
}
