package com.demo.loanmodel.features;

import java.util.Locale;
import java.util.Set;

/** Free-text values that count as a positive answer for a categorical column. */
public enum SynonymSet {

    GRADUATE("graduate", "grad", "g"),
    APPROVAL("approved", "yes", "y", "1", "true");

    private final Set<String> values;

    SynonymSet(String... values) {
        this.values = Set.of(values);
    }

    public Set<String> synonyms() {
        return values;
    }

    public boolean matches(String text) {
        return text != null && values.contains(normalize(text));
    }

    /** 1 when the text is one of the synonyms, else 0. */
    public int indicator(String text) {
        return matches(text) ? 1 : 0;
    }

    public static String normalize(String text) {
        return text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
    }
}
