package com.flowtest.engine;

/**
 * Why an HTTP exchange produced no usable response.
 */
public enum RequestErrorKind {
    /** The exchange did not complete within the step's timeout. */
    TIMEOUT,
    /** The connection could not be opened or broke off. */
    CONNECTION_FAILURE,
    /** A response arrived but could not be read. */
    MALFORMED_RESPONSE,
    /** The request could not be built, e.g. an unparsable URL or method. */
    INVALID_REQUEST
}
