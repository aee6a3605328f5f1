package com.flowtest.service.api;

import com.flowtest.model.FlowResult;

/**
 * A sink that keeps a record of every flow and request run.
 */
public interface ResultLogService {

    /**
     * Records one result. Implementations add a timestamp and a tool tag, and must not let a
     * storage failure escape to the caller.
     *
     * @param result The result to record.
     */
    void append(FlowResult result);
}
