package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Description of the type of a variable (or of a projection of a variable) as supplied by the front end. Only as
 * much structure as is needed to validate projections and to recognize pointer types is recorded; anything else is
 * {@link Kind#OPAQUE} and accepts every projection.
 */
public final class TypeDescriptor {

    /**
     * Shape of a type
     */
    public enum Kind {
        /**
         * Unmanaged pointer, dereference yields the pointee
         */
        RAW_POINTER("raw_pointer"),
        /**
         * Borrowed reference, dereference yields the pointee
         */
        REFERENCE("reference"),
        /**
         * Owning pointer (heap box), dereference yields the pointee
         */
        OWNED_POINTER("owned_pointer"),
        /**
         * Aggregate with numbered fields
         */
        STRUCT("struct"),
        /**
         * Tagged union, each variant has numbered fields
         */
        ENUM("enum"),
        /**
         * Type with no projections
         */
        SCALAR("scalar"),
        /**
         * Unknown structure, every projection is allowed
         */
        OPAQUE("opaque");

        private final String jsonName;

        private Kind(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }

        public static Kind fromJsonName(String name) {
            for (Kind k : values()) {
                if (k.jsonName.equals(name)) {
                    return k;
                }
            }
            throw new IllegalArgumentException("Unknown type kind: " + name);
        }
    }

    /**
     * Descriptor used when the front end supplies no type information
     */
    public static final TypeDescriptor UNKNOWN = new TypeDescriptor("?", Kind.OPAQUE, null,
                                                                    Collections.<TypeDescriptor> emptyList(),
                                                                    Collections.<TypeDescriptor> emptyList());

    /**
     * Human readable name of the type, e.g. "*mut u8"
     */
    private final String name;
    private final Kind kind;
    /**
     * Type pointed to for pointer kinds, null if unknown
     */
    private final TypeDescriptor pointee;
    /**
     * Field types for a struct
     */
    private final List<TypeDescriptor> fields;
    /**
     * One struct-like descriptor per variant for an enum
     */
    private final List<TypeDescriptor> variants;

    private TypeDescriptor(String name, Kind kind, TypeDescriptor pointee, List<TypeDescriptor> fields,
                           List<TypeDescriptor> variants) {
        this.name = name;
        this.kind = kind;
        this.pointee = pointee;
        this.fields = fields;
        this.variants = variants;
    }

    public static TypeDescriptor scalar(String name) {
        return new TypeDescriptor(name, Kind.SCALAR, null, Collections.<TypeDescriptor> emptyList(),
                                  Collections.<TypeDescriptor> emptyList());
    }

    public static TypeDescriptor opaque(String name) {
        return new TypeDescriptor(name, Kind.OPAQUE, null, Collections.<TypeDescriptor> emptyList(),
                                  Collections.<TypeDescriptor> emptyList());
    }

    /**
     * Create a pointer-like type
     *
     * @param name
     *            printable name
     * @param kind
     *            one of {@link Kind#RAW_POINTER}, {@link Kind#REFERENCE} or {@link Kind#OWNED_POINTER}
     * @param pointee
     *            type pointed to, null if unknown
     * @return new descriptor
     */
    public static TypeDescriptor pointer(String name, Kind kind, TypeDescriptor pointee) {
        if (kind != Kind.RAW_POINTER && kind != Kind.REFERENCE && kind != Kind.OWNED_POINTER) {
            throw new IllegalArgumentException("Not a pointer kind: " + kind);
        }
        return new TypeDescriptor(name, kind, pointee, Collections.<TypeDescriptor> emptyList(),
                                  Collections.<TypeDescriptor> emptyList());
    }

    public static TypeDescriptor struct(String name, List<TypeDescriptor> fields) {
        return new TypeDescriptor(name, Kind.STRUCT, null, Collections.unmodifiableList(new ArrayList<>(fields)),
                                  Collections.<TypeDescriptor> emptyList());
    }

    /**
     * Create an enum type
     *
     * @param name
     *            printable name
     * @param variants
     *            one struct descriptor per variant, holding the variant's fields
     * @return new descriptor
     */
    public static TypeDescriptor enumeration(String name, List<TypeDescriptor> variants) {
        return new TypeDescriptor(name, Kind.ENUM, null, Collections.<TypeDescriptor> emptyList(),
                                  Collections.unmodifiableList(new ArrayList<>(variants)));
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public TypeDescriptor getPointee() {
        return pointee;
    }

    public List<TypeDescriptor> getFields() {
        return fields;
    }

    public List<TypeDescriptor> getVariants() {
        return variants;
    }

    /**
     * Whether this is an unmanaged pointer type
     *
     * @return true for raw pointers
     */
    public boolean isRawPointer() {
        return kind == Kind.RAW_POINTER;
    }

    /**
     * Whether a dereference projection may be applied to a value of this type
     *
     * @return true for pointer-like and opaque types
     */
    public boolean isDereferenceable() {
        return kind == Kind.RAW_POINTER || kind == Kind.REFERENCE || kind == Kind.OWNED_POINTER
                || kind == Kind.OPAQUE;
    }

    /**
     * Get the type obtained by applying the given projection to a value of this type.
     *
     * @param p
     *            projection to apply
     * @return type of the projected place, {@link #UNKNOWN} if the descriptor does not say
     * @throws IllegalArgumentException
     *             if the projection cannot be applied to this type
     */
    public TypeDescriptor project(Projection p) {
        if (kind == Kind.OPAQUE) {
            return UNKNOWN;
        }
        switch (p.getKind()) {
        case DEREF:
            if (!isDereferenceable()) {
                throw new IllegalArgumentException("Cannot dereference a value of type " + name);
            }
            return pointee == null ? UNKNOWN : pointee;
        case FIELD:
            if (kind != Kind.STRUCT) {
                throw new IllegalArgumentException("Cannot take field " + p.getIndex() + " of type " + name);
            }
            if (p.getIndex() >= fields.size()) {
                throw new IllegalArgumentException("Field " + p.getIndex() + " out of range for " + name + " with "
                        + fields.size() + " fields");
            }
            return fields.get(p.getIndex());
        case DOWNCAST:
            if (kind != Kind.ENUM) {
                throw new IllegalArgumentException("Cannot downcast a value of non-enum type " + name);
            }
            if (p.getIndex() >= variants.size()) {
                throw new IllegalArgumentException("Variant " + p.getIndex() + " out of range for " + name + " with "
                        + variants.size() + " variants");
            }
            return variants.get(p.getIndex());
        default:
            throw new RuntimeException("Unhandled projection kind " + p.getKind());
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
