package com.hcl2map.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeReaderTest {

    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    @Test
    public void testReadsNodesTokensAndSpans() throws IOException {
        SyntaxElement.Node root = reader.read(
                "{\"rule\":\"block\",\"line\":3,\"end_line\":7,\"children\":["
                        + "{\"rule\":\"identifier\",\"children\":[\"locals\"]},"
                        + "{\"rule\":\"body\",\"children\":[\"\\n\"]}]}");

        assertEquals(Rule.BLOCK, root.rule());
        assertEquals(new SyntaxElement.LineSpan(3, 7), root.span());
        assertEquals(2, root.children().size());

        SyntaxElement.Node identifier = (SyntaxElement.Node) root.children().get(0);
        assertEquals(Rule.IDENTIFIER, identifier.rule());
        assertFalse(identifier.hasSpan());
        assertEquals(List.of(new SyntaxElement.Token("locals")), identifier.children());

        SyntaxElement.Node body = (SyntaxElement.Node) root.children().get(1);
        assertTrue(((SyntaxElement.Token) body.children().get(0)).isNewline());
    }

    @Test
    public void testNodeWithoutChildren() throws IOException {
        SyntaxElement.Node body = reader.read("{\"rule\":\"body\"}");
        assertEquals(Rule.BODY, body.rule());
        assertTrue(body.children().isEmpty());
    }

    @Test
    public void testHalfSpanIsIgnored() throws IOException {
        SyntaxElement.Node body = reader.read("{\"rule\":\"body\",\"line\":4}");
        assertFalse(body.hasSpan());
    }

    @Test
    public void testUnknownFieldsAreSkipped() throws IOException {
        SyntaxElement.Node body = reader.read(
                "{\"extra\":{\"nested\":[1,{\"rule\":\"nope\"}]},\"rule\":\"body\",\"children\":[],\"more\":[true]}");
        assertEquals(Rule.BODY, body.rule());
    }

    @Test
    public void testReadsFixtureFromStream() throws IOException {
        try (InputStream input = getClass().getResourceAsStream("/trees/main_tf.json")) {
            SyntaxElement.Node root = reader.read(input);
            assertEquals(Rule.START, root.rule());
            SyntaxElement.Node body = (SyntaxElement.Node) root.children().get(0);
            assertEquals(new SyntaxElement.LineSpan(1, 11), body.span());
            assertEquals(4, body.children().size());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"rule\":\"no_such_rule\"}",
            "{\"children\":[]}",
            "\"just a token\"",
            "[]",
            "{\"rule\":\"body\",\"children\":\"oops\"}",
            "{\"rule\":\"body\",\"children\":[1]}",
            "{\"rule\":\"body\",\"children\":[",
            "{\"rule\":\"body\",\"line\":\"one\",\"end_line\":2}",
            ""
    })
    public void testMalformedTreesAreRejected(String json) {
        assertThrows(IOException.class, () -> reader.read(json));
    }

    @Test
    public void testRuleNamesResolve() {
        for (Rule rule : Rule.values()) {
            assertEquals(rule, Rule.fromName(rule.grammarName()));
        }
        assertThrows(IllegalArgumentException.class, () -> Rule.fromName("Body"));
    }
}
