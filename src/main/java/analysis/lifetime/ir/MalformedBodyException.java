package analysis.lifetime.ir;

/**
 * Thrown when a function body does not satisfy the assumptions of the lifetime analysis, e.g. a place names an
 * undeclared variable or a terminator targets a block that does not exist
 */
public class MalformedBodyException extends RuntimeException {

    private static final long serialVersionUID = -6209317461284077123L;

    /**
     * Name of the function with the malformed body
     */
    private final String functionName;

    public MalformedBodyException(String functionName, String message) {
        super(functionName + ": " + message);
        this.functionName = functionName;
    }

    public MalformedBodyException(String functionName, String message, Throwable cause) {
        super(functionName + ": " + message, cause);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
