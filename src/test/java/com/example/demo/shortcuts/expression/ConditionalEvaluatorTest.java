package com.example.demo.shortcuts.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("$IF Evaluation Tests")
public class ConditionalEvaluatorTest {

    private final Map<String, String> props = new HashMap<>(Map.of("widgetArt", "Poster", "widgetType", "movies"));

    @Test
    public void testThenOnly() {
        assertEquals("yes", ConditionalEvaluator.evaluate("widgetArt=Poster THEN yes", props));
        assertEquals("", ConditionalEvaluator.evaluate("widgetArt=Landscape THEN yes", props));
    }

    @Test
    public void testElifChain() {
        assertEquals("landscape",
                ConditionalEvaluator.evaluate("widgetArt=Fanart THEN fanart ELIF widgetArt=Poster | Landscape THEN landscape ELSE other", props));
        assertEquals("other",
                ConditionalEvaluator.evaluate("widgetArt=Fanart THEN fanart ELIF widgetArt=Square THEN square ELSE other", props));
    }

    @Test
    public void testKeywordsAreCaseInsensitive() {
        assertEquals("b", ConditionalEvaluator.evaluate("widgetType=tvshows then a else b", props));
    }

    @Test
    public void testKeywordsMatchWholeWordsOnly() {
        props.put("mode", "ELSEWHERE");
        assertEquals("found", ConditionalEvaluator.evaluate("mode=ELSEWHERE THEN found ELSE missing", props));
    }

    @Test
    public void testTrailingRemainderAfterElifIsElseValue() {
        assertEquals("fallback",
                ConditionalEvaluator.evaluate("widgetArt=Fanart THEN a ELIF widgetArt=Square THEN b ELIF fallback", props));
    }

    @Test
    public void testProcessIf() {
        assertEquals("art=poster.png", ConditionalEvaluator.processIf("art=$IF[widgetArt=Poster THEN poster.png ELSE fanart.jpg]", props));
        assertEquals("no placeholders", ConditionalEvaluator.processIf("no placeholders", props));
    }
}
