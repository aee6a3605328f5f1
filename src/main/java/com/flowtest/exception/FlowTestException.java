package com.flowtest.exception;

/**
 * Signals a problem that prevents a flow from being set up, such as a collection file that is
 * missing or cannot be parsed.
 * <p>
 * The message is written for the end user and ends up verbatim in the setup issue of the
 * resulting {@link com.flowtest.model.FlowResult}.
 */
public class FlowTestException extends RuntimeException {

    /**
     * @param message User-facing description of the problem.
     */
    public FlowTestException(String message) {
        super(message);
    }

    /**
     * @param message User-facing description of the problem.
     * @param cause   The underlying failure, kept for logging.
     */
    public FlowTestException(String message, Throwable cause) {
        super(message, cause);
    }
}
