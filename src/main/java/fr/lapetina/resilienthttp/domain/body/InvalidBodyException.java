package fr.lapetina.resilienthttp.domain.body;

/**
 * Thrown when an entity body is requested for an input type that cannot
 * back one. No body is created.
 */
public final class InvalidBodyException extends IllegalArgumentException {

    private final Class<?> inputType;

    public InvalidBodyException(Object input) {
        super("Unsupported entity body input: "
                + (input == null ? "null" : input.getClass().getName()));
        this.inputType = input == null ? null : input.getClass();
    }

    public InvalidBodyException(String message, Throwable cause) {
        super(message, cause);
        this.inputType = null;
    }

    /**
     * Type of the rejected input, null when the input itself was null.
     */
    public Class<?> getInputType() {
        return inputType;
    }
}
