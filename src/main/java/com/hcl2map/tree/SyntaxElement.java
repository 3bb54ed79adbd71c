package com.hcl2map.tree;

import java.util.List;

/**
 * A child of a syntax tree node, as handed over by the parser: either raw token text
 * or another node.
 */
public sealed interface SyntaxElement {

    record Token(String text) implements SyntaxElement {
        public boolean isNewline() {
            return "\n".equals(text);
        }
    }

    /**
     * A grammar production. {@code span} is null when the parser recorded no position.
     */
    record Node(Rule rule, List<SyntaxElement> children, LineSpan span) implements SyntaxElement {
        public Node {
            children = List.copyOf(children);
        }

        public boolean hasSpan() {
            return span != null;
        }
    }

    /** 1-based first and last source line of a node. */
    record LineSpan(int startLine, int endLine) {}

    static Token token(String text) {
        return new Token(text);
    }

    static Node node(Rule rule, SyntaxElement... children) {
        return new Node(rule, List.of(children), null);
    }

    static Node node(Rule rule, LineSpan span, SyntaxElement... children) {
        return new Node(rule, List.of(children), span);
    }
}
