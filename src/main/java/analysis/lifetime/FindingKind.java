package analysis.lifetime;

/**
 * Kinds of lifetime violations
 */
public enum FindingKind {
    /**
     * A place was read after the resource it denotes was released
     */
    USE_AFTER_RELEASE("UseAfterRelease"),
    /**
     * A resource was released while already released
     */
    DOUBLE_RELEASE("DoubleRelease");

    private final String displayName;

    private FindingKind(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
