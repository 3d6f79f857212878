package com.example.demo.shortcuts.service;

import com.example.demo.shortcuts.config.TemplateBuilderProperties;
import com.example.demo.shortcuts.exception.TemplateBuildException;
import com.example.demo.shortcuts.model.Menu;
import com.example.demo.shortcuts.model.TemplateSchema;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TemplateBuildServiceTest {

    private TemplateBuildService service;

    @BeforeEach
    public void setup() {
        service = new TemplateBuildService(new TemplateBuilderProperties());
    }

    @Test
    public void testMissingSchema() {
        TemplateBuildException ex = assertThrows(TemplateBuildException.class,
                () -> service.build(null, Collections.<Menu>emptyList(), null));
        assertEquals(TemplateBuildException.MISSING_SCHEMA, ex.getCode());
    }

    @Test
    public void testMissingMenus() {
        TemplateBuildException ex = assertThrows(TemplateBuildException.class,
                () -> service.build(new TemplateSchema(), null, null));
        assertEquals(TemplateBuildException.MISSING_MENUS, ex.getCode());
    }

    @Test
    public void testEmptySchemaBuildsEmptyRoot() {
        Element root = service.build(new TemplateSchema(), Collections.<Menu>emptyList(), null);
        assertEquals("includes", root.tagName());
        assertTrue(root.children().isEmpty());
    }

    @Test
    public void testUnexpectedErrorsAreWrapped() {
        TemplateSchema schema = mock(TemplateSchema.class);
        when(schema.getTemplates()).thenThrow(new IllegalStateException("broken schema"));

        TemplateBuildException ex = assertThrows(TemplateBuildException.class,
                () -> service.build(schema, Collections.<Menu>emptyList(), null));
        assertEquals(TemplateBuildException.BUILD_FAILED, ex.getCode());
        assertTrue(ex.getCause() instanceof IllegalStateException);
        verify(schema, atLeastOnce()).getTemplates();
    }
}
