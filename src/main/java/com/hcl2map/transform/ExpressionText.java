package com.hcl2map.transform;

import com.hcl2map.value.HclValue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Text helpers for rebuilding expressions and deciding between literal and expression strings.
 */
public final class ExpressionText {

    private ExpressionText() {
    }

    /**
     * Text of a value as it reads inside a reconstructed expression.
     */
    public static String text(HclValue value) {
        if (value instanceof HclValue.HclString) {
            return ((HclValue.HclString) value).value();
        }
        if (value instanceof HclValue.HclNumber) {
            return ((HclValue.HclNumber) value).numberValue().toString();
        }
        if (value instanceof HclValue.HclBoolean) {
            return Boolean.toString(((HclValue.HclBoolean) value).value());
        }
        if (value instanceof HclValue.HclNull) {
            return "null";
        }
        if (value instanceof HclValue.HclArray) {
            return ((HclValue.HclArray) value).elements()
                    .collect(ExpressionText::text)
                    .makeString("[", ", ", "]");
        }
        HclValue.HclObject object = (HclValue.HclObject) value;
        return object.fields().keyValuesView()
                .collect(pair -> pair.getOne() + " = " + text(pair.getTwo()))
                .makeString("{", ", ", "}");
    }

    public static String join(List<HclValue> values, String separator) {
        return values.stream().map(ExpressionText::text).collect(Collectors.joining(separator));
    }

    public static boolean isQuoted(String text) {
        return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
    }

    /**
     * A quoted literal loses one layer of quotes; any other string is expression text and
     * gets wrapped as {@code ${...}}. Non-strings are returned as they are.
     */
    public static HclValue toStringDollar(HclValue value) {
        if (!(value instanceof HclValue.HclString)) {
            return value;
        }
        String text = ((HclValue.HclString) value).value();
        if (isQuoted(text)) {
            return new HclValue.HclString(text.substring(1, text.length() - 1));
        }
        return new HclValue.HclString("${" + text + "}");
    }

    /** Used for identifiers, labels and keys, never for general values. */
    public static String stripQuotes(String text) {
        return isQuoted(text) ? text.substring(1, text.length() - 1) : text;
    }
}
