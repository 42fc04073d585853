package com.forumprep.model;

import java.util.Objects;

/**
 * CSS selector specificity as the (a, b, c) triple:
 * a = id selectors, b = class/attribute/pseudo-class selectors,
 * c = type selectors and pseudo-elements.
 * Compared lexicographically, most significant component first.
 */
public final class Specificity implements Comparable<Specificity> {

    /** Specificity of inherited values; loses to everything. */
    public static final Specificity ZERO = new Specificity(0, 0, 0);

    /** Specificity given to declarations from an element's own style attribute. */
    public static final Specificity INLINE = new Specificity(1, 0, 0);

    private final int idCount;
    private final int classAttrPseudoCount;
    private final int typeCount;

    public Specificity(int idCount, int classAttrPseudoCount, int typeCount) {
        if (idCount < 0 || classAttrPseudoCount < 0 || typeCount < 0) {
            throw new IllegalArgumentException(
                    "Specificity components cannot be negative: (" + idCount + ","
                            + classAttrPseudoCount + "," + typeCount + ")");
        }
        this.idCount = idCount;
        this.classAttrPseudoCount = classAttrPseudoCount;
        this.typeCount = typeCount;
    }

    public int getIdCount() { return idCount; }
    public int getClassAttrPseudoCount() { return classAttrPseudoCount; }
    public int getTypeCount() { return typeCount; }

    @Override
    public int compareTo(Specificity other) {
        int cmp = Integer.compare(idCount, other.idCount);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(classAttrPseudoCount, other.classAttrPseudoCount);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(typeCount, other.typeCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Specificity)) return false;
        Specificity that = (Specificity) o;
        return idCount == that.idCount
                && classAttrPseudoCount == that.classAttrPseudoCount
                && typeCount == that.typeCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(idCount, classAttrPseudoCount, typeCount);
    }

    @Override
    public String toString() {
        return "(" + idCount + "," + classAttrPseudoCount + "," + typeCount + ")";
    }
}
