package com.example.demo.shortcuts.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers around jsoup's XML mode, which is how control markup is held
 * in memory.
 *
 * Text following an element is a sibling text node, so an element's "tail"
 * travels with it whenever a node range starting at an element is moved.
 */
public final class MarkupSupport {

    private MarkupSupport() {
    }

    /**
     * Parse an XML fragment with a single root element and return that root.
     * Tag and attribute names keep their case.
     */
    public static Element parse(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        if (document.children().isEmpty()) {
            throw new IllegalArgumentException("Markup has no root element: " + xml);
        }
        return document.child(0);
    }

    /**
     * Render an element as XML without reformatting its text.
     */
    public static String toXml(Element element) {
        Document holder = new Document("");
        holder.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .prettyPrint(false);
        Element copy = element.clone();
        holder.appendChild(copy);
        return copy.outerHtml();
    }

    /**
     * Child nodes of a container starting at its first element: every child
     * element together with the text that follows it. Leading text before the
     * first element is not part of the fragment.
     */
    public static List<Node> fragmentNodes(Element container) {
        List<Node> nodes = new ArrayList<>();
        boolean started = false;
        for (Node node : container.childNodes()) {
            if (!started && node instanceof Element) {
                started = true;
            }
            if (started) {
                nodes.add(node);
            }
        }
        return nodes;
    }
}
