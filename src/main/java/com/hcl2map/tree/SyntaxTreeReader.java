package com.hcl2map.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a syntax tree that a parser dumped as JSON.
 * <p>
 * A node is written as {@code {"rule": "body", "children": [...], "line": 1, "end_line": 4}},
 * a token as a plain JSON string. {@code line} and {@code end_line} are optional; other
 * fields are skipped.
 */
public class SyntaxTreeReader {
    private final JsonFactory factory = new JsonFactory();

    public SyntaxElement.Node read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readRoot(parser);
        }
    }

    public SyntaxElement.Node read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readRoot(parser);
        }
    }

    private SyntaxElement.Node readRoot(JsonParser parser) throws IOException {
        SyntaxElement root = readElement(parser, parser.nextToken());
        if (!(root instanceof SyntaxElement.Node)) {
            throw new IOException("Syntax tree root must be a node, got token: " + root);
        }
        return (SyntaxElement.Node) root;
    }

    private SyntaxElement readElement(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of syntax tree input");
        }
        return switch (token) {
            case START_OBJECT -> readNode(parser);
            case VALUE_STRING -> new SyntaxElement.Token(parser.getText());
            default -> throw new IOException("Unexpected JSON token in syntax tree: " + token);
        };
    }

    private SyntaxElement.Node readNode(JsonParser parser) throws IOException {
        String ruleName = null;
        MutableList<SyntaxElement> children = Lists.mutable.empty();
        Integer line = null;
        Integer endLine = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "rule" -> ruleName = parser.getValueAsString();
                case "children" -> readChildren(parser, value, children);
                case "line" -> line = parser.getIntValue();
                case "end_line" -> endLine = parser.getIntValue();
                default -> parser.skipChildren();
            }
        }

        if (ruleName == null) {
            throw new IOException("Syntax tree node without a rule name");
        }
        Rule rule;
        try {
            rule = Rule.fromName(ruleName);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        SyntaxElement.LineSpan span = line != null && endLine != null
                ? new SyntaxElement.LineSpan(line, endLine)
                : null;
        return new SyntaxElement.Node(rule, children, span);
    }

    private void readChildren(JsonParser parser, JsonToken start, MutableList<SyntaxElement> children)
            throws IOException {
        if (start != JsonToken.START_ARRAY) {
            throw new IOException("Expected children array but got: " + start);
        }
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            children.add(readElement(parser, token));
        }
    }
}
