package com.hcl2map.output;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.hcl2map.value.HclValue;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.tuple.Pair;

/**
 * Renders a document as JSON text.
 */
public class OutputFormatter {
    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    private final boolean prettyPrint;
    private final boolean sortKeys;

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(HclValue value) {
        StringBuilder sb = new StringBuilder(512);
        write(value, 0, sb);
        return sb.toString();
    }

    private void write(HclValue value, int indent, StringBuilder sb) {
        if (value instanceof HclValue.HclObject) {
            writeObject((HclValue.HclObject) value, indent, sb);
        } else if (value instanceof HclValue.HclArray) {
            writeArray((HclValue.HclArray) value, indent, sb);
        } else if (value instanceof HclValue.HclString) {
            sb.append('"').append(escapeString(((HclValue.HclString) value).value())).append('"');
        } else if (value instanceof HclValue.HclNumber) {
            sb.append(((HclValue.HclNumber) value).toJsonString());
        } else if (value instanceof HclValue.HclBoolean) {
            sb.append(((HclValue.HclBoolean) value).value());
        } else {
            sb.append("null");
        }
    }

    private void writeObject(HclValue.HclObject object, int indent, StringBuilder sb) {
        if (object.fields().isEmpty()) {
            sb.append("{}");
            return;
        }

        ListIterable<Pair<String, HclValue>> entries = sortKeys
                ? object.fields().keyValuesView().toSortedListBy(Pair::getOne)
                : object.fields().keyValuesView().toList();

        sb.append('{');
        boolean first = true;
        for (Pair<String, HclValue> entry : entries) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(indent + 2, sb);
            sb.append('"').append(escapeString(entry.getOne())).append("\":");
            if (prettyPrint) {
                sb.append(' ');
            }
            write(entry.getTwo(), indent + 2, sb);
        }
        newline(indent, sb);
        sb.append('}');
    }

    private void writeArray(HclValue.HclArray array, int indent, StringBuilder sb) {
        if (array.elements().isEmpty()) {
            sb.append("[]");
            return;
        }

        sb.append('[');
        boolean first = true;
        for (HclValue element : array.elements()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(indent + 2, sb);
            write(element, indent + 2, sb);
        }
        newline(indent, sb);
        sb.append(']');
    }

    private void newline(int indent, StringBuilder sb) {
        if (prettyPrint) {
            sb.append('\n').append(" ".repeat(indent));
        }
    }

    private String escapeString(String s) {
        return new String(ENCODER.quoteAsString(s));
    }
}
