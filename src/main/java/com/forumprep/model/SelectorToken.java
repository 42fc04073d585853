package com.forumprep.model;

import java.util.Objects;

/**
 * One token of a selector. {@code value} is the bare name for
 * id/class/type/pseudo tokens (no leading {@code #}, {@code .} or colons),
 * the bracket content for attributes and the symbol for combinators.
 */
public final class SelectorToken {

    private final SelectorTokenType type;
    private final String value;

    public SelectorToken(SelectorTokenType type, String value) {
        this.type = type;
        this.value = value;
    }

    public SelectorTokenType getType() { return type; }
    public String getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorToken)) return false;
        SelectorToken that = (SelectorToken) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type.name() + "(" + value + ")";
    }
}
