package com.civicintel.dumping.service;

import java.util.Locale;
import java.util.Set;

/**
 * Text standardisation shared by the cleaner and the modeler.
 *
 * Both functions are total: any input yields either a trimmed string or null.
 * The join-key components (category key, location key) must go through
 * {@link #normalizeKeyText(Object)} wherever they are built, or joins between
 * fact and dimension tables silently stop matching.
 */
public final class FieldNormalizer {

    /** Textual markers that mean "no value" in the extract. */
    private static final Set<String> NULL_TOKENS = Set.of("", "None", "nan", "NaN", "<NA>");

    private FieldNormalizer() {
    }

    public static String normalizeText(Object value) {
        if (value == null) return null;
        if (value instanceof Double d && d.isNaN()) return null;
        if (value instanceof Float f && f.isNaN()) return null;

        String text = value.toString().strip();
        return NULL_TOKENS.contains(text) ? null : text;
    }

    public static String normalizeKeyText(Object value) {
        String text = normalizeText(value);
        return text == null ? null : text.toUpperCase(Locale.ROOT);
    }
}
