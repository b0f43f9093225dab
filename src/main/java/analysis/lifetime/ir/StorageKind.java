package analysis.lifetime.ir;

/**
 * Storage duration of a variable declared in a function body
 */
public enum StorageKind {
    /**
     * Storage owned by one activation of the function, released at the end of its scope
     */
    LOCAL("local"),
    /**
     * Process-wide storage, never released by the function
     */
    STATIC("static");

    /**
     * Name used in the serialized form
     */
    private final String jsonName;

    private StorageKind(String jsonName) {
        this.jsonName = jsonName;
    }

    /**
     * Name of this storage kind in the serialized form
     *
     * @return "local" or "static"
     */
    public String getJsonName() {
        return jsonName;
    }

    /**
     * Find the storage kind for the name used in the serialized form
     *
     * @param name
     *            "local" or "static"
     * @return the storage kind with the given name
     * @throws IllegalArgumentException
     *             if there is no storage kind with that name
     */
    public static StorageKind fromJsonName(String name) {
        for (StorageKind k : values()) {
            if (k.jsonName.equals(name)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown storage kind: " + name);
    }
}
