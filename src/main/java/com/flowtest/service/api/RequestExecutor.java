package com.flowtest.service.api;

import com.flowtest.engine.ExchangeResult;
import com.flowtest.engine.HttpCall;
import com.flowtest.engine.HttpSession;

/**
 * Sends prepared requests and buffers their responses.
 */
public interface RequestExecutor {

    /**
     * Opens a session whose cookies live for as long as the caller keeps it.
     */
    HttpSession newSession();

    /**
     * Sends one request within {@code session}.
     * <p>
     * Transport problems (timeouts, refused connections, unreadable responses, unbuildable
     * requests) are returned as a failed {@link ExchangeResult} instead of being thrown. Any HTTP
     * status, including 4xx and 5xx, counts as a response.
     *
     * @param session The session the request belongs to.
     * @param call    The fully resolved request.
     * @return The response with the elapsed time, or the kind of failure.
     */
    ExchangeResult execute(HttpSession session, HttpCall call);
}
