package com.flowtest.cli;

import com.flowtest.exception.FlowFailedException;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;
import org.springframework.stereotype.Component;

/**
 * Prints the report of a failed flow and ends a non-interactive run with exit code {@value #EXIT_CODE_FAILED}.
 */
@Component
public class FlowFailureExceptionResolver implements CommandExceptionResolver {

    public static final int EXIT_CODE_FAILED = 1;

    /**
     * Also looks through the cause chain, since the shell may wrap what a command method throws.
     */
    @Override
    public CommandHandlingResult resolve(Exception ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof FlowFailedException) {
                return CommandHandlingResult.of(cause.getMessage() + "\n", EXIT_CODE_FAILED);
            }
        }
        return null;
    }
}
