package com.flowtest.service.api;

import com.flowtest.engine.HttpResponseSnapshot;
import com.flowtest.model.Expectation;
import java.time.Duration;
import java.util.List;

public interface ResponseValidator {

    /**
     * Checks a response against an expectation. Status, body, headers and response time are all
     * checked, in that order, and every violation is reported.
     *
     * @param response    The buffered response.
     * @param elapsed     How long the exchange took.
     * @param expectation What the response should look like.
     * @return One message per violation, empty when the response passes.
     */
    List<String> validate(HttpResponseSnapshot response, Duration elapsed, Expectation expectation);
}
