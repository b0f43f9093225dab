package analysis.lifetime.ir;

/**
 * Variable declared in a function body (a local, a parameter, the return slot or a static item referenced by the
 * body)
 */
public final class Variable {

    private final String name;
    private final StorageKind storage;
    private final TypeDescriptor type;

    /**
     * Declare a variable
     *
     * @param name
     *            name of the variable, unique within the body
     * @param storage
     *            storage duration
     * @param type
     *            declared type, {@link TypeDescriptor#UNKNOWN} if the front end gave none
     */
    public Variable(String name, StorageKind storage, TypeDescriptor type) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variables must have a name");
        }
        this.name = name;
        this.storage = storage;
        this.type = type == null ? TypeDescriptor.UNKNOWN : type;
    }

    public static Variable local(String name, TypeDescriptor type) {
        return new Variable(name, StorageKind.LOCAL, type);
    }

    public static Variable staticItem(String name, TypeDescriptor type) {
        return new Variable(name, StorageKind.STATIC, type);
    }

    public String getName() {
        return name;
    }

    public StorageKind getStorage() {
        return storage;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public boolean isStatic() {
        return storage == StorageKind.STATIC;
    }

    @Override
    public String toString() {
        return (isStatic() ? "static " : "") + name + ": " + type;
    }
}
