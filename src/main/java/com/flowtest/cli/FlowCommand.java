package com.flowtest.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.flowtest.cli.ui.Spinner;
import com.flowtest.exception.FlowFailedException;
import com.flowtest.model.FlowResult;
import com.flowtest.model.SingleRequest;
import com.flowtest.service.api.FlowEngine;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;
import org.springframework.shell.context.InteractionMode;
import org.springframework.shell.context.ShellContext;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component exposing the flow engine on the command line.
 * <p>
 * {@code flow} runs a collection file; {@code request} sends one ad hoc request and checks its
 * status. Both print a human-readable report, or the raw result as JSON with {@code --json-output}.
 * Run non-interactively, a failed flow or request ends the process with exit code 1.
 */
@ShellComponent
public class FlowCommand {

    private final FlowEngine flowEngine;
    private final ResultFormatter formatter;
    private final Spinner spinner;
    private final ShellContext shellContext;

    /**
     * @param flowEngine   The engine that runs flows and requests.
     * @param formatter    Renders results for the terminal.
     * @param spinner      Shows progress while a flow runs.
     * @param shellContext Tells an interactive session from a one-shot run.
     */
    public FlowCommand(FlowEngine flowEngine, ResultFormatter formatter, Spinner spinner, ShellContext shellContext) {
        this.flowEngine = flowEngine;
        this.formatter = formatter;
        this.spinner = spinner;
        this.shellContext = shellContext;
    }

    /**
     * Runs every step of a YAML or JSON collection against {@code baseUrl}, stopping at the first
     * failing step.
     *
     * @param file       Path of the collection file.
     * @param baseUrl    Base URL that relative step URLs are resolved against.
     * @param jsonOutput Print the result as JSON instead of a report.
     * @param verbose    Enable debug logging and include response bodies in the report.
     * @return The rendered result.
     */
    @ShellMethod(key = "flow", value = "Runs an integration flow from a YAML or JSON collection.")
    public String flow(
            @ShellOption(value = {"--file", "-f"}, help = "Path to the YAML/JSON collection file.") String file,
            @ShellOption(value = {"--base-url", "-b"}, help = "Base URL for API requests.") String baseUrl,
            @ShellOption(value = "--json-output", help = "Print the result as JSON.", defaultValue = "false", arity = 0) boolean jsonOutput,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose output.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        return withVerbosity(verbose, () -> {
            FlowResult result = jsonOutput
                    ? flowEngine.runFlow(file, baseUrl)
                    : spinner.spin("Running flow", () -> flowEngine.runFlow(file, baseUrl));
            return report(result, jsonOutput, verbose);
        });
    }

    /**
     * Sends a single request and checks its status code.
     *
     * @return The rendered result.
     */
    @ShellMethod(key = "request", value = "Sends a single HTTP request and checks the response status.")
    public String request(
            @ShellOption(value = {"--method", "-m"}, help = "HTTP method (GET, POST, PUT, DELETE, ...).") String method,
            @ShellOption(value = {"--url", "-u"}, help = "URL path or full URL.") String url,
            @ShellOption(value = {"--base-url", "-b"}, help = "Base URL for API requests.") String baseUrl,
            @ShellOption(value = {"--status", "-s"}, help = "Expected HTTP status code.", defaultValue = "200") int status,
            @ShellOption(value = "--body", help = "Request body (JSON or plain text).", defaultValue = ShellOption.NULL) String body,
            @ShellOption(value = "--headers", help = "Request headers as a JSON object.", defaultValue = ShellOption.NULL) String headers,
            @ShellOption(value = "--extract", help = "Variables to extract as a JSON object of name to path.", defaultValue = ShellOption.NULL) String extract,
            @ShellOption(value = "--timeout", help = "Request timeout in seconds; flow.default-timeout when omitted.", defaultValue = ShellOption.NULL) Double timeout,
            @ShellOption(value = "--json-output", help = "Print the result as JSON.", defaultValue = "false", arity = 0) boolean jsonOutput,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose output.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        var singleRequest = new SingleRequest(method, url, baseUrl, status, body, headers, extract,
                timeout != null ? Duration.ofMillis(Math.round(timeout * 1000)) : null);
        return withVerbosity(verbose, () -> report(flowEngine.runSingle(singleRequest), jsonOutput, verbose));
    }

    /**
     * Renders the result. A failed result in a non-interactive run is raised as a
     * {@link FlowFailedException} so that the process exits with a non-zero code.
     */
    private String report(FlowResult result, boolean jsonOutput, boolean verbose) {
        String output = formatter.format(result, jsonOutput, verbose);
        if (!result.success() && shellContext.getInteractionMode() == InteractionMode.NONINTERACTIVE) {
            throw new FlowFailedException(output);
        }
        return output;
    }

    /**
     * Raises the root logger to DEBUG while {@code action} runs when {@code verbose} is set.
     */
    private String withVerbosity(boolean verbose, Supplier<String> action) {
        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }
        try {
            return action.get();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }
}
