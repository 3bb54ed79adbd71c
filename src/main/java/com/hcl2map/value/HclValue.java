package com.hcl2map.value;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The structured value a configuration document turns into.
 * <p>
 * Strings carry no separate expression flag: text of an unevaluated expression is stored
 * already wrapped as {@code ${...}}, literal text is stored bare.
 */
public sealed interface HclValue {

    /**
     * Converts to ordinary {@code java.util} maps and lists, {@code String}, {@code Long},
     * {@code BigInteger}, {@code Double}, {@code Boolean} and {@code null}.
     */
    Object toPlain();

    record HclObject(MutableMap<String, HclValue> fields) implements HclValue {
        // keys keep source order
        public static HclObject empty() {
            return new HclObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public static HclObject of(String key, HclValue value) {
            return empty().with(key, value);
        }

        public HclObject with(String key, HclValue value) {
            fields.put(key, value);
            return this;
        }

        public HclValue get(String key) {
            return fields.get(key);
        }

        @Override
        public Map<String, Object> toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            fields.forEachKeyValue((key, value) -> plain.put(key, value.toPlain()));
            return plain;
        }
    }

    record HclArray(MutableList<HclValue> elements) implements HclValue {
        public static HclArray empty() {
            return new HclArray(Lists.mutable.empty());
        }

        public static HclArray of(HclValue... elements) {
            return new HclArray(Lists.mutable.with(elements));
        }

        public HclArray with(HclValue element) {
            elements.add(element);
            return this;
        }

        @Override
        public List<Object> toPlain() {
            List<Object> plain = new ArrayList<>(elements.size());
            elements.forEach(element -> plain.add(element.toPlain()));
            return plain;
        }
    }

    record HclString(String value) implements HclValue {
        @Override
        public String toPlain() {
            return value;
        }
    }

    sealed interface HclNumber extends HclValue {
        String toJsonString();
        Number numberValue();

        @Override
        default Object toPlain() {
            return numberValue();
        }

        record HclLong(long value) implements HclNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record HclBigInteger(BigInteger value) implements HclNumber {
            @Override
            public String toJsonString() {
                return value.toString();
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record HclDouble(double value) implements HclNumber {
            @Override
            public String toJsonString() {
                if (Double.isInfinite(value) || Double.isNaN(value)) {
                    return "null";
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static HclNumber of(long value) {
            return new HclLong(value);
        }

        static HclNumber of(BigInteger value) {
            return new HclBigInteger(value);
        }

        static HclNumber of(double value) {
            return new HclDouble(value);
        }
    }

    record HclBoolean(boolean value) implements HclValue {
        @Override
        public Boolean toPlain() {
            return value;
        }
    }

    record HclNull() implements HclValue {
        @Override
        public Object toPlain() {
            return null;
        }
    }
}
