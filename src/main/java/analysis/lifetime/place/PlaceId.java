package analysis.lifetime.place;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical identity of a place within one function activation. Two places that are written the same way always
 * have equal ids; places that only alias at run time get different ids and are related by explicit binds.
 * <p>
 * A dereference is recorded either as a <i>prefix</i> dereference (first projection, or continuing a leading run of
 * dereferences, rendered <code>*x</code>) or as a <i>suffix</i> dereference (following a field access or downcast,
 * rendered <code>x.0@deref</code>), so <code>*p</code> and the dereference of <code>p.0</code> never collide.
 */
public final class PlaceId {

    /**
     * One encoded projection
     */
    public enum ElementKind {
        FIELD, DOWNCAST, PREFIX_DEREF, SUFFIX_DEREF
    }

    /**
     * Encoded projection: kind plus field or variant index (-1 for dereferences)
     */
    public static final class Element {
        private final ElementKind kind;
        private final int index;

        Element(ElementKind kind, int index) {
            this.kind = kind;
            this.index = index;
        }

        public ElementKind getKind() {
            return kind;
        }

        public int getIndex() {
            return index;
        }

        boolean isDeref() {
            return kind == ElementKind.PREFIX_DEREF || kind == ElementKind.SUFFIX_DEREF;
        }

        @Override
        public int hashCode() {
            return 31 * kind.hashCode() + index;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Element)) {
                return false;
            }
            Element other = (Element) obj;
            return kind == other.kind && index == other.index;
        }
    }

    private final String base;
    private final List<Element> elements;
    /**
     * Canonical rendering, also used for ordering in reports
     */
    private final String canonical;

    PlaceId(String base, List<Element> elements) {
        this.base = base;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.canonical = render(base, this.elements);
    }

    /**
     * Id for a bare variable
     *
     * @param base
     *            variable name
     * @return id of the variable itself
     */
    public static PlaceId of(String base) {
        return new PlaceId(base, Collections.<Element> emptyList());
    }

    private static String render(String base, List<Element> elements) {
        String s = base;
        // true if s must be parenthesized before a postfix projection is appended
        boolean compound = false;
        for (Element e : elements) {
            switch (e.kind) {
            case PREFIX_DEREF:
                s = "*" + s;
                compound = true;
                break;
            case FIELD:
                s = (compound ? "(" + s + ")" : s) + "." + e.index;
                compound = false;
                break;
            case DOWNCAST:
                s = (compound ? "(" + s + ")" : s) + " as " + e.index;
                compound = true;
                break;
            case SUFFIX_DEREF:
                s = (compound ? "(" + s + ")" : s) + "@deref";
                compound = false;
                break;
            default:
                throw new RuntimeException("Unhandled element " + e.kind);
            }
        }
        return s;
    }

    /**
     * Name of the base variable
     *
     * @return base variable name
     */
    public String getBaseName() {
        return base;
    }

    /**
     * Id of the base variable with all projections removed
     *
     * @return id of the base
     */
    public PlaceId getBase() {
        if (elements.isEmpty()) {
            return this;
        }
        return of(base);
    }

    public List<Element> getElements() {
        return elements;
    }

    public boolean isBase() {
        return elements.isEmpty();
    }

    /**
     * Whether this place starts with a dereference
     *
     * @return true if the first element is a prefix dereference
     */
    public boolean hasPrefixDeref() {
        return !elements.isEmpty() && elements.get(0).kind == ElementKind.PREFIX_DEREF;
    }

    /**
     * Place whose value is read by the outermost leading dereference, e.g. <code>*x</code> for <code>**x</code> and
     * <code>x</code> for <code>(*x).0</code>
     *
     * @return the dereferenced operand
     * @throws IllegalStateException
     *             if this place has no prefix dereference
     */
    public PlaceId getDerefOperand() {
        if (!hasPrefixDeref()) {
            throw new IllegalStateException(canonical + " has no prefix dereference");
        }
        int run = 0;
        while (run < elements.size() && elements.get(run).kind == ElementKind.PREFIX_DEREF) {
            run++;
        }
        return new PlaceId(base, elements.subList(0, run - 1));
    }

    public boolean hasSuffixDeref() {
        return lastSuffixDeref() >= 0;
    }

    /**
     * Portion of this place before its last suffix dereference, e.g. <code>x.0</code> for <code>x.0@deref</code>
     *
     * @return the prefix portion
     * @throws IllegalStateException
     *             if this place has no suffix dereference
     */
    public PlaceId getSuffixDerefPrefix() {
        int last = lastSuffixDeref();
        if (last < 0) {
            throw new IllegalStateException(canonical + " has no suffix dereference");
        }
        return new PlaceId(base, elements.subList(0, last));
    }

    private int lastSuffixDeref() {
        for (int i = elements.size() - 1; i >= 0; i--) {
            if (elements.get(i).kind == ElementKind.SUFFIX_DEREF) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Whether any projection of this place is a dereference
     *
     * @return true if the place reads through a pointer
     */
    public boolean hasDeref() {
        for (Element e : elements) {
            if (e.isDeref()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PlaceId)) {
            return false;
        }
        PlaceId other = (PlaceId) obj;
        return base.equals(other.base) && elements.equals(other.elements);
    }

    @Override
    public String toString() {
        return canonical;
    }
}
