package io.surfworks.tirnarrow.tir;

import java.util.List;

/**
 * Exception thrown when IR is malformed: mismatched operand types,
 * out-of-range literals, or a failed {@link TirTypeChecker} run.
 */
public class TirValidationException extends RuntimeException {

    private final List<String> errors;

    public TirValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public TirValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public TirValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    /**
     * Returns the individual validation errors behind this exception.
     */
    public List<String> getErrors() {
        return errors;
    }
}
