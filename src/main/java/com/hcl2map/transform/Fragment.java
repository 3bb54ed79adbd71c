package com.hcl2map.transform;

import com.hcl2map.value.HclValue;

/**
 * What a single rule hands up to its parent during the walk.
 */
sealed interface Fragment {

    record Value(HclValue value) implements Fragment {}

    /** Only ever consumed by the enclosing body. */
    record Attribute(String key, HclValue value) implements Fragment {}

    enum Discard implements Fragment {
        INSTANCE
    }
}
