package com.flowtest.service.api;

import com.flowtest.model.FlowCollection;
import com.flowtest.model.FlowResult;
import com.flowtest.model.SingleRequest;

/**
 * Runs integration flows and ad hoc requests. None of the methods throw: every problem is
 * reported as an issue of the returned {@link FlowResult}, and every result is handed to the
 * {@link ResultLogService}.
 */
public interface FlowEngine {

    /**
     * Loads a collection file and runs it.
     *
     * @param collectionPath Path of a YAML or JSON collection file; also used as the issue location.
     * @param baseUrl        Base URL that relative step URLs are resolved against.
     * @return The outcome of the flow.
     */
    FlowResult runFlow(String collectionPath, String baseUrl);

    /**
     * Runs an already parsed collection. Steps run in order and the flow stops at the first step
     * that fails, either because its request could not be completed or because its response
     * violated an expectation.
     *
     * @param collection The collection to run.
     * @param source     Label used in issue locations, usually the collection's file path.
     * @param baseUrl    Base URL that relative step URLs are resolved against.
     * @return The outcome of the flow.
     */
    FlowResult runFlow(FlowCollection collection, String source, String baseUrl);

    /**
     * Sends a single request, checks its status and optionally extracts values from the response.
     *
     * @param request The request to send.
     * @return The outcome, with an {@code extracted} map when extraction ran.
     */
    FlowResult runSingle(SingleRequest request);
}
