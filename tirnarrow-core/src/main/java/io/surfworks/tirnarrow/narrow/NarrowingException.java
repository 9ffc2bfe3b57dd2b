package io.surfworks.tirnarrow.narrow;

/**
 * Thrown when narrowing a function or module fails.
 */
public class NarrowingException extends RuntimeException {

    private final String functionName;

    public NarrowingException(String functionName, String message, Throwable cause) {
        super(message, cause);
        this.functionName = functionName;
    }

    /**
     * Name of the function being narrowed when the failure happened.
     */
    public String getFunctionName() {
        return functionName;
    }
}
