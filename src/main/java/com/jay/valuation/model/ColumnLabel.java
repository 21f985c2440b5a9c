package com.jay.valuation.model;

import java.util.Locale;

/**
 * A statement column header. Providers expose either a flat label ("Net income")
 * or a two-level category/label pair ("Profitability|ROE (%)").
 */
public record ColumnLabel(String category, String name) {

    public static final String LEVEL_SEPARATOR = "|";

    public ColumnLabel {
        name = name == null ? "" : name.trim();
        category = category == null || category.isBlank() ? null : category.trim();
    }

    public static ColumnLabel of(String name) {
        return new ColumnLabel(null, name);
    }

    /** Parses a wire key; "Category|Label" becomes a two-level label. */
    public static ColumnLabel parse(String key) {
        if (key == null) return of("");
        int idx = key.indexOf(LEVEL_SEPARATOR);
        if (idx < 0) return of(key);
        return new ColumnLabel(key.substring(0, idx), key.substring(idx + 1));
    }

    /**
     * Case-insensitive match against a candidate label: exact equality, or substring
     * containment in either direction. Blank candidates never match.
     */
    public boolean matches(String candidate) {
        if (candidate == null || candidate.isBlank() || name.isEmpty()) return false;
        String c = candidate.trim().toLowerCase(Locale.ROOT);
        String n = name.toLowerCase(Locale.ROOT);
        return n.equals(c) || n.contains(c) || c.contains(n);
    }

    public boolean matchesExactly(String candidate) {
        return candidate != null && name.equalsIgnoreCase(candidate.trim());
    }

    @Override
    public String toString() {
        return category == null ? name : category + LEVEL_SEPARATOR + name;
    }
}
