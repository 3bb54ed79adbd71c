package com.hcl2map;

import com.hcl2map.output.OutputFormatter;
import com.hcl2map.transform.DictTransformer;
import com.hcl2map.tree.SyntaxElement;
import com.hcl2map.tree.SyntaxTreeReader;
import com.hcl2map.value.HclValue;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Entry points for turning a parsed HCL2 document into nested maps and lists.
 */
public final class Hcl2Map {

    private Hcl2Map() {
    }

    public static HclValue.HclObject transform(SyntaxElement.Node root) {
        return transform(root, false);
    }

    public static HclValue.HclObject transform(SyntaxElement.Node root, boolean withMeta) {
        return new DictTransformer(withMeta).transform(root);
    }

    /**
     * Reads a syntax tree dumped as JSON by the parser and transforms it.
     */
    public static HclValue.HclObject load(InputStream syntaxTree, boolean withMeta) throws IOException {
        return transform(new SyntaxTreeReader().read(syntaxTree), withMeta);
    }

    public static Map<String, Object> toMap(SyntaxElement.Node root, boolean withMeta) {
        return transform(root, withMeta).toPlain();
    }

    public static String toJson(SyntaxElement.Node root, boolean pretty) {
        return toJson(root, false, pretty, false);
    }

    public static String toJson(SyntaxElement.Node root, boolean withMeta, boolean pretty, boolean sortKeys) {
        return new OutputFormatter(pretty, sortKeys).format(transform(root, withMeta));
    }
}
