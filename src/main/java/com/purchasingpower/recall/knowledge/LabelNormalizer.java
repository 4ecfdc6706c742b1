package com.purchasingpower.recall.knowledge;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of node labels used for write-time and maintenance dedup.
 *
 * @since 1.0.0
 */
public final class LabelNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LabelNormalizer() {
    }

    public static String normalize(String label) {
        if (label == null) {
            return "";
        }
        return WHITESPACE.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
