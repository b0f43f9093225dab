package analysis.lifetime.binding;

/**
 * How a resource was released
 */
public enum ReleaseKind {
    /**
     * Automatic release when the owning place goes out of scope
     */
    IMPLICIT_SCOPE_END("ImplicitScopeEnd"),
    /**
     * Call to a function recognized as releasing its argument
     */
    EXPLICIT_RELEASE_CALL("ExplicitReleaseCall");

    private final String displayName;

    private ReleaseKind(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
