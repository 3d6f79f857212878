package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.exception.TemplateBuildException;
import com.example.demo.shortcuts.model.Expression;
import com.example.demo.shortcuts.model.IncludeDefinition;
import com.example.demo.shortcuts.model.ItemsDefinition;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.MenuItem;
import com.example.demo.shortcuts.model.PropertySchema;
import com.example.demo.shortcuts.model.Template;
import com.example.demo.shortcuts.model.TemplateOnly;
import com.example.demo.shortcuts.model.TemplateOutput;
import com.example.demo.shortcuts.model.TemplateProperty;
import com.example.demo.shortcuts.model.TemplateSchema;
import com.example.demo.shortcuts.model.VariableDefinition;
import com.example.demo.shortcuts.model.VariableGroup;
import com.example.demo.shortcuts.model.VariableGroupReference;
import com.example.demo.shortcuts.model.VariableReference;
import com.example.demo.shortcuts.util.MarkupSupport;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Builder tests over small in-memory schemas and menus
 */
@DisplayName("Template Builder Tests")
public class TemplateBuilderTest {

    private TemplateSchema schema;
    private List<Menu> menus;

    @BeforeEach
    public void setup() {
        schema = new TemplateSchema();
        menus = new ArrayList<>();
        menus.add(Menu.builder()
                .name("mainmenu")
                .items(new ArrayList<>(List.of(
                        item("movies", "Movies", "widgetType", "movies", "widgetArt", "Poster"),
                        item("tvshows", "TV Shows", "widgetType", "tvshows", "widgetArt", "Landscape"))))
                .build());
    }

    private static MenuItem item(String name, String label, String... properties) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < properties.length; i += 2) {
            map.put(properties[i], properties[i + 1]);
        }
        return MenuItem.builder().name(name).label(label).properties(map).build();
    }

    private Element build() {
        return new TemplateBuilder(schema, menus, "9000", null).build();
    }

    private static Element include(Element root, String name) {
        for (Element child : root.children()) {
            if (child.tagName().equals("include") && child.attr("name").equals("skinshortcuts-template-" + name)) {
                return child;
            }
        }
        return null;
    }

    @Test
    @DisplayName("Legacy include attribute builds one control per item")
    public void testSingleOutputTemplate() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .idPrefix("80")
                .controls(MarkupSupport.parse(
                        "<controls><control type=\"list\" id=\"$PROPERTY[id]\"><label>$PROPERTY[name]</label>"
                                + "<skinshortcuts>visibility</skinshortcuts></control></controls>"))
                .build());

        Element root = build();

        assertEquals("includes", root.tagName());
        Element widget = include(root, "widget");
        assertNotNull(widget);
        assertEquals(2, widget.children().size());

        Element first = widget.child(0);
        assertEquals("801", first.attr("id"));
        assertEquals("movies", first.selectFirst("label").text());
        assertEquals("String.IsEqual(Container(9000).ListItem.Property(name),movies)", first.selectFirst("visible").text());
        assertNull(first.selectFirst("skinshortcuts"));
        assertEquals("802", widget.child(1).attr("id"));
    }

    @Test
    public void testDisabledItemsKeepTheirIndex() {
        menus.get(0).getItems().get(0).setDisabled(true);
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .controls(MarkupSupport.parse("<controls><control id=\"$PROPERTY[index]\"/></controls>"))
                .build());

        Element widget = include(build(), "widget");
        assertEquals(1, widget.children().size());
        assertEquals("2", widget.child(0).attr("id"));
    }

    @Test
    public void testMenuFilterAndConditions() {
        menus.add(Menu.builder().name("othermenu").items(List.of(item("music", "Music", "widgetType", "movies"))).build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .menu("mainmenu")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><control id=\"$PROPERTY[name]\"/></controls>"))
                .build());

        Element widget = include(build(), "widget");
        assertEquals(1, widget.children().size());
        assertEquals("movies", widget.child(0).attr("id"));
    }

    @Test
    @DisplayName("Include without matching items gets a description")
    public void testEmptyIncludeDescription() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=music"))
                .controls(MarkupSupport.parse("<controls><control/></controls>"))
                .build());

        Element widget = include(build(), "widget");
        assertEquals(1, widget.children().size());
        assertEquals("description", widget.child(0).tagName());
        assertEquals(TemplateBuilder.DEFAULT_EMPTY_DESCRIPTION, widget.child(0).text());
    }

    @Test
    public void testTemplatesSharingAnIncludeAreMerged() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><first/></controls>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=tvshows"))
                .controls(MarkupSupport.parse("<controls><second/></controls>"))
                .build());

        Element root = build();
        assertEquals(1, root.children().size());
        Element widget = include(root, "widget");
        assertEquals("first", widget.child(0).tagName());
        assertEquals("second", widget.child(1).tagName());
    }

    @Test
    @DisplayName("templateonly=true never emits, auto emits only when assigned")
    public void testTemplateOnly() {
        schema.getTemplates().add(Template.builder()
                .include("never")
                .templateOnly(TemplateOnly.ALWAYS)
                .controls(MarkupSupport.parse("<controls><control/></controls>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("assigned")
                .templateOnly(TemplateOnly.AUTO)
                .controls(MarkupSupport.parse("<controls><control/></controls>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("unassigned")
                .templateOnly(TemplateOnly.AUTO)
                .controls(MarkupSupport.parse("<controls><control/></controls>"))
                .build());
        menus.get(0).getItems().get(0).getProperties()
                .put("widgetPath.2", "$INCLUDE[skinshortcuts-template-assigned]");

        TemplateBuilder builder = new TemplateBuilder(schema, menus, "9000", null);
        Element root = builder.build();

        assertTrue(builder.getAssignedIncludes().contains("skinshortcuts-template-assigned"));
        assertNull(include(root, "never"));
        assertNotNull(include(root, "assigned"));
        assertNull(include(root, "unassigned"));
    }

    @Test
    @DisplayName("Output suffix rewrites conditions except nosuffix expressions")
    public void testMultipleOutputsWithSuffix() {
        schema.getExpressions().put("isPanel", Expression.builder().value("widgetStyle=Panel").nosuffix(true).build());
        menus.get(0).setItems(new ArrayList<>(List.of(item("movies", "Movies",
                "widgetType", "movies", "widgetArt", "Landscape", "widgetStyle", "Panel",
                "widgetType.2", "movies", "widgetArt.2", "Poster"))));

        schema.getTemplates().add(Template.builder()
                .outputs(List.of(
                        TemplateOutput.builder().include("widget1").idPrefix("81").build(),
                        TemplateOutput.builder().include("widget2").idPrefix("82").suffix(".2").build()))
                .conditions(List.of("widgetType=movies"))
                .properties(List.of(TemplateProperty.builder()
                        .name("art").condition("$EXP[isPanel] + widgetArt=Poster").value("poster").build()))
                .controls(MarkupSupport.parse("<controls><control id=\"$PROPERTY[id]\"><art>$PROPERTY[art]</art></control></controls>"))
                .build());

        Element root = build();

        Element first = include(root, "widget1").child(0);
        assertEquals("811", first.attr("id"));
        assertEquals("", first.selectFirst("art").text());

        Element second = include(root, "widget2").child(0);
        assertEquals("821", second.attr("id"));
        assertEquals("poster", second.selectFirst("art").text());
    }

    @Test
    public void testMathAndIfInControls() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .controls(MarkupSupport.parse("<controls><control id=\"$MATH[index * 100 + 8000]\">"
                        + "<width>$MATH[$PROPERTY[index] * 2]</width>"
                        + "<aspect>$IF[widgetArt=Poster THEN stretch ELSE scale]</aspect></control></controls>"))
                .build());

        Element widget = include(build(), "widget");
        assertEquals("8100", widget.child(0).attr("id"));
        assertEquals("2", widget.child(0).selectFirst("width").text());
        assertEquals("stretch", widget.child(0).selectFirst("aspect").text());
        assertEquals("8200", widget.child(1).attr("id"));
        assertEquals("scale", widget.child(1).selectFirst("aspect").text());
    }

    @Test
    @DisplayName("Include markers expand inline, wrapped, or not at all")
    public void testIncludeMarkers() {
        schema.getIncludes().put("art", IncludeDefinition.builder()
                .name("art")
                .controls(MarkupSupport.parse("<include><texture>$PROPERTY[widgetArt].png</texture></include>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><control>"
                        + "<skinshortcuts include=\"art\"/>"
                        + "<skinshortcuts include=\"art\" wrap=\"true\"/>"
                        + "<skinshortcuts include=\"art\" condition=\"widgetArt=Landscape\"/>"
                        + "<skinshortcuts include=\"missing\"/>"
                        + "</control></controls>"))
                .build());

        Element control = include(build(), "widget").child(0);

        assertEquals(2, control.children().size());
        assertEquals("texture", control.child(0).tagName());
        assertEquals("Poster.png", control.child(0).text());

        Element wrapper = control.child(1);
        assertEquals("include", wrapper.tagName());
        assertEquals("art", wrapper.attr("name"));
        assertEquals("Poster.png", wrapper.child(0).text());
    }

    @Test
    public void testRemovedMarkerKeepsFollowingText() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><control>a<skinshortcuts include=\"missing\"/>b</control></controls>"))
                .build());

        Element control = include(build(), "widget").child(0);
        assertEquals("ab", control.text());
        assertTrue(control.children().isEmpty());
    }

    @Test
    public void testIncludeReferenceInText() {
        menus.get(0).getItems().get(0).getProperties().put("widgetPath", "$INCLUDE[skinshortcuts-template-recent]");
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><content>$PROPERTY[widgetPath]</content></controls>"))
                .build());

        Element content = include(build(), "widget").child(0);
        assertEquals(1, content.children().size());
        assertEquals("include", content.child(0).tagName());
        assertEquals("skinshortcuts-template-recent", content.child(0).text());
    }

    @Test
    @DisplayName("Items iteration repeats controls per submenu item with parent access")
    public void testItemsIteration() {
        menus.add(Menu.builder()
                .name("movies.widgets")
                .items(List.of(
                        item("recent", "Recent", "widgetPath", "videodb://recent"),
                        MenuItem.builder().name("hidden").label("Hidden").disabled(true).build(),
                        item("random", "Random", "widgetPath", "videodb://random", "widgetType", "random")))
                .build());
        schema.getItemsDefinitions().put("widgets", ItemsDefinition.builder()
                .name("widgets")
                .properties(List.of(TemplateProperty.builder().name("target").value("$PROPERTY[name]-target").build()))
                .controls(MarkupSupport.parse("<items><item id=\"$PROPERTY[index]\"><label>$PROPERTY[label]</label>"
                        + "<parent>$PARENT[label]/$PARENT[widgetArt]</parent><target>$PROPERTY[target]</target></item></items>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("widgetType=movies"))
                .controls(MarkupSupport.parse("<controls><list><skinshortcuts insert=\"widgets\"/></list></controls>"))
                .build());

        Element list = include(build(), "widget").child(0);

        assertEquals(2, list.children().size());
        Element recent = list.child(0);
        assertEquals("1", recent.attr("id"));
        assertEquals("Recent", recent.selectFirst("label").text());
        assertEquals("Movies/Poster", recent.selectFirst("parent").text());
        assertEquals("recent-target", recent.selectFirst("target").text());
        assertEquals("3", list.child(1).attr("id"));
    }

    @Test
    public void testItemsFilterAndMissingSubmenu() {
        menus.add(Menu.builder()
                .name("movies.widgets")
                .items(List.of(
                        item("recent", "Recent"),
                        item("random", "Random", "widgetType", "random")))
                .build());
        schema.getItemsDefinitions().put("widgets", ItemsDefinition.builder()
                .name("widgets")
                .filter("widgetType=random")
                .controls(MarkupSupport.parse("<items><item>$PROPERTY[name]</item></items>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .controls(MarkupSupport.parse("<controls><list><skinshortcuts insert=\"widgets\"/></list></controls>"))
                .build());

        Element widget = include(build(), "widget");

        Element moviesList = widget.child(0);
        assertEquals(1, moviesList.children().size());
        assertEquals("random", moviesList.child(0).text());

        Element tvList = widget.child(1);
        assertTrue(tvList.children().isEmpty());
    }

    @Test
    @DisplayName("Variables are merged by output name and emitted before includes")
    public void testVariableMerge() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .variables(List.of(VariableDefinition.builder()
                        .name("label")
                        .content(MarkupSupport.parse("<variable name=\"WidgetLabel\">"
                                + "<value condition=\"String.IsEqual(ListItem.Property(name),$PROPERTY[name])\">$PROPERTY[widgetArt]</value>"
                                + "</variable>"))
                        .build()))
                .build());

        Element root = build();

        assertEquals("variable", root.child(0).tagName());
        assertEquals("include", root.child(1).tagName());

        Element variable = root.child(0);
        assertEquals("WidgetLabel", variable.attr("name"));
        assertEquals(2, variable.children().size());
        assertEquals("String.IsEqual(ListItem.Property(name),movies)", variable.child(0).attr("condition"));
        assertEquals("Poster", variable.child(0).text());
        assertEquals("Landscape", variable.child(1).text());
    }

    @Test
    public void testVariableOutputNameAndCondition() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .idPrefix("80")
                .variables(List.of(VariableDefinition.builder()
                        .name("art")
                        .condition("widgetArt=Poster")
                        .output("WidgetArt_$PROPERTY[id]")
                        .content(MarkupSupport.parse("<variable name=\"ignored\"><value>$PROPERTY[widgetArt]</value></variable>"))
                        .build()))
                .build());

        Element root = build();
        assertEquals("variable", root.child(0).tagName());
        assertEquals("WidgetArt_801", root.child(0).attr("name"));
        assertEquals("include", root.child(1).tagName());
    }

    @Test
    @DisplayName("Variable groups apply the output suffix to reference conditions")
    public void testVariableGroupWithSuffix() {
        schema.getVariableDefinitions().put("pathVar", VariableDefinition.builder()
                .name("pathVar")
                .content(MarkupSupport.parse("<variable name=\"Path_$PROPERTY[name]$PROPERTY[suffix]\"><value>x</value></variable>"))
                .build());
        schema.getVariableDefinitions().put("nestedVar", VariableDefinition.builder()
                .name("nestedVar")
                .content(MarkupSupport.parse("<variable name=\"Nested_$PROPERTY[name]\"><value>y</value></variable>"))
                .build());
        schema.getVariableGroups().put("inner", VariableGroup.builder()
                .name("inner")
                .references(List.of(VariableReference.builder().name("nestedVar").condition("widgetPath~videodb").build()))
                .build());
        schema.getVariableGroups().put("paths", VariableGroup.builder()
                .name("paths")
                .references(List.of(
                        VariableReference.builder().name("pathVar").condition("widgetPath~videodb").build(),
                        VariableReference.builder().name("unknown").build()))
                .groupRefs(List.of(VariableGroupReference.builder().name("inner").build()))
                .build());

        menus.get(0).getItems().get(0).getProperties().put("widgetPath", "plugin://a");
        menus.get(0).getItems().get(0).getProperties().put("widgetPath.2", "videodb://b");
        menus.get(0).getItems().get(1).getProperties().put("widgetPath", "videodb://c");

        schema.getTemplates().add(Template.builder()
                .outputs(List.of(TemplateOutput.builder().include("widget2").suffix(".2").build()))
                .variableGroups(List.of(VariableGroupReference.builder().name("paths").build()))
                .build());

        Element root = build();

        List<String> names = new ArrayList<>();
        for (Element child : root.children()) {
            if (child.tagName().equals("variable")) {
                names.add(child.attr("name"));
            }
        }
        assertEquals(List.of("Nested_movies", "Path_movies.2"), names);
    }

    @Test
    @DisplayName("Variable reference conditions are suffixed before expressions expand")
    public void testVariableReferenceExpressionKeepsOwnNames() {
        schema.getExpressions().put("isVideo", Expression.builder().value("widgetPath~videodb").build());
        schema.getVariableDefinitions().put("pathVar", VariableDefinition.builder()
                .name("pathVar")
                .content(MarkupSupport.parse("<variable name=\"Path_$PROPERTY[name]\"><value>x</value></variable>"))
                .build());
        schema.getVariableGroups().put("paths", VariableGroup.builder()
                .name("paths")
                .references(List.of(VariableReference.builder().name("pathVar").condition("$EXP[isVideo]").build()))
                .build());

        menus.get(0).getItems().get(0).getProperties().put("widgetPath", "videodb://a");
        menus.get(0).getItems().get(0).getProperties().put("widgetPath.2", "plugin://b");
        menus.get(0).getItems().get(1).getProperties().put("widgetPath.2", "videodb://c");

        schema.getTemplates().add(Template.builder()
                .outputs(List.of(TemplateOutput.builder().include("widget2").suffix(".2").build()))
                .variableGroups(List.of(VariableGroupReference.builder().name("paths").build()))
                .build());

        Element root = build();

        List<String> names = new ArrayList<>();
        for (Element child : root.children()) {
            if (child.tagName().equals("variable")) {
                names.add(child.attr("name"));
            }
        }
        assertEquals(List.of("Path_movies"), names);
    }

    @Test
    @DisplayName("Circular expressions abort the build")
    public void testCircularExpressionAborts() {
        schema.getExpressions().put("loop", Expression.builder().value("$EXP[loop]").build());
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .conditions(List.of("$EXP[loop]"))
                .build());

        TemplateBuildException ex = assertThrows(TemplateBuildException.class, this::build);
        assertEquals(TemplateBuildException.CIRCULAR_EXPRESSION, ex.getCode());
    }

    @Test
    @DisplayName("Building twice gives identical output and leaves the schema untouched")
    public void testBuildIsRepeatable() {
        Element controls = MarkupSupport.parse("<controls><control id=\"$PROPERTY[id]\"><skinshortcuts>visibility</skinshortcuts></control></controls>");
        String before = MarkupSupport.toXml(controls);
        schema.getTemplates().add(Template.builder().include("widget").controls(controls).build());

        TemplateBuilder builder = new TemplateBuilder(schema, menus, "9000", new PropertySchema());
        String first = MarkupSupport.toXml(builder.build());
        String second = MarkupSupport.toXml(builder.build());

        assertEquals(first, second);
        assertEquals(before, MarkupSupport.toXml(controls));
    }

    @Test
    public void testCustomContainerAndDescription() {
        schema.getTemplates().add(Template.builder()
                .include("widget")
                .controls(MarkupSupport.parse("<controls><c><skinshortcuts>visibility</skinshortcuts></c></controls>"))
                .build());
        schema.getTemplates().add(Template.builder()
                .include("empty")
                .conditions(List.of("false"))
                .build());

        Element root = new TemplateBuilder(schema, menus, "300", null, "nothing here").build();

        assertEquals("String.IsEqual(Container(300).ListItem.Property(name),movies)",
                include(root, "widget").child(0).child(0).text());
        assertEquals("nothing here", include(root, "empty").child(0).text());
    }
}
