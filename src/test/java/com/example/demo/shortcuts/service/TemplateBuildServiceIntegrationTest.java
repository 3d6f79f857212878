package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.config.TemplateBuilderProperties;
import com.example.demo.shortcuts.model.ItemsDefinition;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.Template;
import com.example.demo.shortcuts.model.TemplateOnly;
import com.example.demo.shortcuts.model.TemplateSchema;
import com.example.demo.shortcuts.util.MarkupSupport;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end build through the Spring context, with menus loaded from YAML
 * fixtures and settings from application-test.yml
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Template Build Service Integration Tests")
public class TemplateBuildServiceIntegrationTest {

    @Autowired
    private TemplateBuildService templateBuildService;

    @Autowired
    private TemplateBuilderProperties properties;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private List<Menu> menus;

    @BeforeEach
    public void setup() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/menus/mainmenu.yaml")) {
            assertNotNull(in, "menu fixture missing");
            menus = yamlMapper.readValue(in, new TypeReference<List<Menu>>() {});
        }
    }

    private TemplateSchema schema() {
        TemplateSchema schema = new TemplateSchema();
        schema.getItemsDefinitions().put("widgets", ItemsDefinition.builder()
                .name("widgets")
                .controls(MarkupSupport.parse("<items><item><label>$PROPERTY[label]</label>"
                        + "<onclick>ActivateWindow(Videos,$PROPERTY[widgetPath],return)</onclick></item></items>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("mainmenu")
                .idPrefix("90")
                .menu("mainmenu")
                .controls(MarkupSupport.parse("<controls><control type=\"group\" id=\"$PROPERTY[id]\">"
                        + "<skinshortcuts>visibility</skinshortcuts>"
                        + "<content><skinshortcuts insert=\"widgets\"/></content>"
                        + "</control></controls>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("recent")
                .templateOnly(TemplateOnly.AUTO)
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><control type=\"list\"/></controls>"))
                .build());
        return schema;
    }

    @Test
    public void testConfigurationBinding() {
        assertEquals("9100", properties.getContainerId());
        assertEquals("Automatically generated - no menu items matched this template",
                properties.getEmptyIncludeDescription());
    }

    @Test
    public void testMenuFixtureLoaded() {
        assertEquals(2, menus.size());
        Menu mainmenu = menus.get(0);
        assertEquals("Wide", mainmenu.getDefaults().get("widgetStyle"));
        assertTrue(mainmenu.getItem("music").isDisabled());
        assertEquals("Poster", mainmenu.getItem("movies").getProperty("widgetArt"));
    }

    @Test
    @DisplayName("Configured container id drives the visibility shorthand")
    public void testBuildWithConfiguredContainer() {
        Element root = templateBuildService.build(schema(), menus, null);

        assertEquals(2, root.children().size());
        Element mainmenu = root.child(0);
        assertEquals("skinshortcuts-template-mainmenu", mainmenu.attr("name"));
        assertEquals(2, mainmenu.children().size());

        Element movies = mainmenu.child(0);
        assertEquals("901", movies.attr("id"));
        assertEquals("String.IsEqual(Container(9100).ListItem.Property(name),movies)", movies.selectFirst("visible").text());

        Element content = movies.selectFirst("content");
        assertEquals(2, content.children().size());
        assertEquals("Recently added", content.child(0).selectFirst("label").text());
        assertEquals("ActivateWindow(Videos,videodb://randommovies/,return)",
                content.child(1).selectFirst("onclick").text());

        Element tvshows = mainmenu.child(1);
        assertTrue(tvshows.selectFirst("content").children().isEmpty());

        assertEquals("skinshortcuts-template-recent", root.child(1).attr("name"));
    }

    @Test
    public void testExplicitContainerOverride() {
        Element root = templateBuildService.build(schema(), menus, null, "50");
        assertEquals("String.IsEqual(Container(50).ListItem.Property(name),movies)",
                root.child(0).child(0).selectFirst("visible").text());
    }

    @Test
    public void testRepeatedBuildsMatch() {
        TemplateSchema schema = schema();
        String first = MarkupSupport.toXml(templateBuildService.build(schema, menus, null));
        String second = MarkupSupport.toXml(templateBuildService.build(schema, menus, null));
        assertEquals(first, second);
    }
}
