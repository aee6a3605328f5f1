package com.flowtest.exception;

/**
 * Raised by a non-interactive command whose flow or request failed. The message is the rendered
 * report, printed in place of the command's normal output.
 */
public class FlowFailedException extends RuntimeException {

    public FlowFailedException(String report) {
        super(report);
    }
}
