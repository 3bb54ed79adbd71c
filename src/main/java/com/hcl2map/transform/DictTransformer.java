package com.hcl2map.transform;

import com.hcl2map.tree.Rule;
import com.hcl2map.tree.SyntaxElement;
import com.hcl2map.value.HclValue;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;

import static com.hcl2map.transform.ExpressionText.join;
import static com.hcl2map.transform.ExpressionText.stripQuotes;
import static com.hcl2map.transform.ExpressionText.text;
import static com.hcl2map.transform.ExpressionText.toStringDollar;

/**
 * Walks a syntax tree bottom-up and builds the document it describes.
 * <p>
 * Literals become native values. Every other expression is rebuilt as text and stored
 * as {@code ${...}}. Bodies keep the first definition of an attribute and collect
 * repeated blocks into lists; object literals let the last key win.
 * <p>
 * The only state is the metadata flag, so one instance may be shared between threads.
 */
public class DictTransformer {
    private static final Logger log = LoggerFactory.getLogger(DictTransformer.class);

    public static final String START_LINE = "__start_line__";
    public static final String END_LINE = "__end_line__";

    private final boolean withMeta;

    public DictTransformer() {
        this(false);
    }

    /**
     * @param withMeta add {@value #START_LINE} and {@value #END_LINE} to every block
     */
    public DictTransformer(boolean withMeta) {
        this.withMeta = withMeta;
    }

    public HclValue.HclObject transform(SyntaxElement.Node root) {
        if (root.rule() != Rule.START) {
            throw new IllegalArgumentException("Expected a start node but got: " + root.rule().grammarName());
        }
        return asObject(valueOf(visit(root)), root.rule());
    }

    private Fragment visit(SyntaxElement element) {
        if (element instanceof SyntaxElement.Token) {
            return new Fragment.Value(new HclValue.HclString(((SyntaxElement.Token) element).text()));
        }
        SyntaxElement.Node node = (SyntaxElement.Node) element;
        if (node.rule() == Rule.NEW_LINE_OR_COMMENT || node.rule() == Rule.NEW_LINE_AND_OR_COMMA) {
            return Fragment.Discard.INSTANCE;
        }

        MutableList<Fragment> args = significant(node.children());
        if (node.rule() == Rule.BODY) {
            return body(args);
        }
        if (node.rule() == Rule.ATTRIBUTE) {
            return attribute(values(args, node.rule()));
        }
        return new Fragment.Value(apply(node, values(args, node.rule())));
    }

    private HclValue apply(SyntaxElement.Node node, MutableList<HclValue> args) {
        return switch (node.rule()) {
            case START -> args.get(0);
            case BLOCK -> block(node, args);
            case IDENTIFIER -> string(text(args.get(0)));

            case INT_LIT -> intLit(args);
            case FLOAT_LIT -> floatLit(args);
            case EXPR_TERM -> exprTerm(args);
            case TUPLE -> new HclValue.HclArray(args.collect(ExpressionText::toStringDollar));
            case OBJECT_ELEM -> HclValue.HclObject.of(stripQuotes(text(args.get(0))), toStringDollar(args.get(1)));
            case OBJECT -> object(args, node.rule());

            case INDEX_EXPR_TERM, GET_ATTR_EXPR_TERM, ATTR_SPLAT_EXPR_TERM, FULL_SPLAT_EXPR_TERM ->
                    string(text(args.get(0)) + text(args.get(1)));
            case INDEX -> string("[" + text(args.get(0)) + "]");
            case GET_ATTR -> string("." + text(args.get(0)));
            case ATTR_SPLAT -> string(".*" + join(args, ""));
            case FULL_SPLAT -> string("[*]" + join(args, ""));

            case FUNCTION_CALL -> functionCall(args);
            case ARGUMENTS -> new HclValue.HclArray(args);
            case CONDITIONAL -> string(text(args.get(0)) + " ? " + text(args.get(1)) + " : " + text(args.get(2)));
            case BINARY_OP, BINARY_TERM, FOR_INTRO, FOR_COND -> string(join(args, " "));
            case BINARY_OPERATOR -> string(text(args.get(0)));
            case UNARY_OP -> string(join(args, ""));

            case HEREDOC_TEMPLATE -> string(HeredocNormalizer.normalize(text(args.get(0))));
            case HEREDOC_TEMPLATE_TRIM -> string(HeredocNormalizer.normalizeTrimmed(text(args.get(0))));

            // the first and last children are the brackets themselves
            case FOR_TUPLE_EXPR -> string("[" + join(args.subList(1, args.size() - 1), " ") + "]");
            case FOR_OBJECT_EXPR -> string("{" + join(args.subList(1, args.size() - 1), " ") + "}");

            case BODY, ATTRIBUTE, NEW_LINE_OR_COMMENT, NEW_LINE_AND_OR_COMMA ->
                    throw new IllegalStateException("Rule handled before dispatch: " + node.rule().grammarName());
        };
    }

    /**
     * Transforms children in order and drops newline tokens and discarded punctuation.
     */
    private MutableList<Fragment> significant(List<SyntaxElement> children) {
        MutableList<Fragment> args = Lists.mutable.empty();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxElement.Token && ((SyntaxElement.Token) child).isNewline()) {
                continue;
            }
            Fragment fragment = visit(child);
            if (fragment != Fragment.Discard.INSTANCE) {
                args.add(fragment);
            }
        }
        return args;
    }

    private MutableList<HclValue> values(MutableList<Fragment> args, Rule rule) {
        return args.collect(fragment -> {
            if (!(fragment instanceof Fragment.Value)) {
                throw new IllegalStateException("Attribute outside of a body in rule: " + rule.grammarName());
            }
            return ((Fragment.Value) fragment).value();
        });
    }

    private HclValue valueOf(Fragment fragment) {
        return ((Fragment.Value) fragment).value();
    }

    private Fragment body(MutableList<Fragment> args) {
        HclValue.HclObject result = HclValue.HclObject.empty();
        MutableSet<String> attributes = Sets.mutable.empty();

        for (Fragment arg : args) {
            if (arg instanceof Fragment.Attribute) {
                Fragment.Attribute attribute = (Fragment.Attribute) arg;
                if (result.fields().containsKey(attribute.key())) {
                    log.warn("{} already defined, ignoring attribute", attribute.key());
                    continue;
                }
                result.with(attribute.key(), attribute.value());
                attributes.add(attribute.key());
                continue;
            }

            HclValue.HclObject block = asObject(valueOf(arg), Rule.BODY);
            block.fields().forEachKeyValue((key, value) -> {
                HclValue existing = result.get(key);
                if (existing == null) {
                    result.with(key, HclValue.HclArray.of(value));
                } else if (attributes.contains(key)) {
                    log.warn("{} already defined as an attribute, ignoring block", key);
                } else {
                    ((HclValue.HclArray) existing).with(value);
                }
            });
        }

        log.debug("Assembled body with {} keys", result.fields().size());
        return new Fragment.Value(result);
    }

    private Fragment attribute(MutableList<HclValue> args) {
        return new Fragment.Attribute(stripQuotes(text(args.get(0))), toStringDollar(args.get(1)));
    }

    /**
     * Leading children are labels, the last one is the body. Labels {@code [a, b]} nest
     * the body as {@code {a: {b: body}}}.
     */
    private HclValue block(SyntaxElement.Node node, MutableList<HclValue> args) {
        HclValue.HclObject body = asObject(args.getLast(), Rule.BLOCK);
        if (withMeta) {
            if (!node.hasSpan()) {
                throw new HclTransformException("Block has no line span to record");
            }
            body.with(START_LINE, HclValue.HclNumber.of(node.span().startLine()))
                    .with(END_LINE, HclValue.HclNumber.of(node.span().endLine()));
        }

        HclValue result = body;
        for (int i = args.size() - 2; i >= 0; i--) {
            result = HclValue.HclObject.of(stripQuotes(text(args.get(i))), result);
        }
        return result;
    }

    private HclValue intLit(MutableList<HclValue> args) {
        String numeral = join(args, "");
        try {
            return HclValue.HclNumber.of(Long.parseLong(numeral));
        } catch (NumberFormatException overflow) {
            // well-formed but wider than a long
            try {
                return HclValue.HclNumber.of(new BigInteger(numeral));
            } catch (NumberFormatException e) {
                throw new HclTransformException("Invalid integer literal: " + numeral, e);
            }
        }
    }

    private HclValue floatLit(MutableList<HclValue> args) {
        String numeral = join(args, "");
        try {
            return HclValue.HclNumber.of(Double.parseDouble(numeral));
        } catch (NumberFormatException e) {
            throw new HclTransformException("Invalid float literal: " + numeral, e);
        }
    }

    private HclValue exprTerm(MutableList<HclValue> args) {
        HclValue first = args.get(0);
        if (first instanceof HclValue.HclString) {
            switch (((HclValue.HclString) first).value()) {
                case "true":
                    return new HclValue.HclBoolean(true);
                case "false":
                    return new HclValue.HclBoolean(false);
                case "null":
                    return new HclValue.HclNull();
                case "(":
                    return args.get(1);
                default:
                    break;
            }
        }
        return first;
    }

    private HclValue object(MutableList<HclValue> args, Rule rule) {
        HclValue.HclObject result = HclValue.HclObject.empty();
        for (HclValue elem : args) {
            result.fields().putAll(asObject(elem, rule).fields());
        }
        return result;
    }

    private HclValue functionCall(MutableList<HclValue> args) {
        String arguments = "";
        if (args.size() > 1) {
            arguments = join(((HclValue.HclArray) args.get(1)).elements(), ", ");
        }
        return string(text(args.get(0)) + "(" + arguments + ")");
    }

    private static HclValue.HclObject asObject(HclValue value, Rule rule) {
        if (!(value instanceof HclValue.HclObject)) {
            throw new IllegalStateException("Expected a map inside " + rule.grammarName() + " but got: " + value);
        }
        return (HclValue.HclObject) value;
    }

    private static HclValue string(String text) {
        return new HclValue.HclString(text);
    }
}
