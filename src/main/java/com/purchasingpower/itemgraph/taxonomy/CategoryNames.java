package com.purchasingpower.itemgraph.taxonomy;

import com.google.common.base.CharMatcher;

import java.util.Locale;

/**
 * Category label normalization.
 *
 * <p>Display form: trimmed, inner whitespace runs collapsed to one space.
 * Comparison key: display form case-folded.
 */
public final class CategoryNames {

    private CategoryNames() {
    }

    public static String display(String raw) {
        if (raw == null) {
            return "";
        }
        return CharMatcher.whitespace().trimAndCollapseFrom(raw, ' ');
    }

    public static String key(String raw) {
        return display(raw).toLowerCase(Locale.ROOT);
    }
}
