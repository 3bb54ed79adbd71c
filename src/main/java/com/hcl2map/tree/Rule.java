package com.hcl2map.tree;

import java.util.HashMap;
import java.util.Map;

/**
 * Grammar productions a syntax tree node can be tagged with.
 */
public enum Rule {
    START("start"),
    BODY("body"),
    BLOCK("block"),
    ATTRIBUTE("attribute"),
    IDENTIFIER("identifier"),

    INT_LIT("int_lit"),
    FLOAT_LIT("float_lit"),
    EXPR_TERM("expr_term"),
    TUPLE("tuple"),
    OBJECT("object"),
    OBJECT_ELEM("object_elem"),

    INDEX_EXPR_TERM("index_expr_term"),
    INDEX("index"),
    GET_ATTR_EXPR_TERM("get_attr_expr_term"),
    GET_ATTR("get_attr"),
    ATTR_SPLAT_EXPR_TERM("attr_splat_expr_term"),
    ATTR_SPLAT("attr_splat"),
    FULL_SPLAT_EXPR_TERM("full_splat_expr_term"),
    FULL_SPLAT("full_splat"),

    FUNCTION_CALL("function_call"),
    ARGUMENTS("arguments"),
    CONDITIONAL("conditional"),
    BINARY_OP("binary_op"),
    BINARY_TERM("binary_term"),
    BINARY_OPERATOR("binary_operator"),
    UNARY_OP("unary_op"),

    HEREDOC_TEMPLATE("heredoc_template"),
    HEREDOC_TEMPLATE_TRIM("heredoc_template_trim"),

    FOR_TUPLE_EXPR("for_tuple_expr"),
    FOR_OBJECT_EXPR("for_object_expr"),
    FOR_INTRO("for_intro"),
    FOR_COND("for_cond"),

    // punctuation only, always discarded
    NEW_LINE_OR_COMMENT("new_line_or_comment"),
    NEW_LINE_AND_OR_COMMA("new_line_and_or_comma");

    private static final Map<String, Rule> BY_NAME = new HashMap<>();

    static {
        for (Rule rule : values()) {
            BY_NAME.put(rule.grammarName, rule);
        }
    }

    private final String grammarName;

    Rule(String grammarName) {
        this.grammarName = grammarName;
    }

    public String grammarName() {
        return grammarName;
    }

    /**
     * Resolves a rule by the name the grammar gives it.
     *
     * @throws IllegalArgumentException if the grammar has no such rule
     */
    public static Rule fromName(String name) {
        Rule rule = BY_NAME.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown grammar rule: " + name);
        }
        return rule;
    }
}
