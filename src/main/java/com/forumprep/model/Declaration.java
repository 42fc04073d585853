package com.forumprep.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single {@code property: value} pair. Property names are lower-cased,
 * values are opaque and only trimmed.
 */
public final class Declaration {

    private final String property;
    private final String value;
    private final boolean important;

    public Declaration(String property, String value, boolean important) {
        if (property == null || property.trim().isEmpty()) {
            throw new IllegalArgumentException("Declaration property cannot be null or empty");
        }
        this.property = property.trim().toLowerCase(Locale.ROOT);
        this.value = value == null ? "" : value.trim();
        this.important = important;
    }

    public String getProperty() { return property; }
    public String getValue() { return value; }
    public boolean isImportant() { return important; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Declaration)) return false;
        Declaration that = (Declaration) o;
        return important == that.important
                && property.equals(that.property)
                && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, value, important);
    }

    @Override
    public String toString() {
        return property + ": " + value + (important ? " !important" : "");
    }
}
