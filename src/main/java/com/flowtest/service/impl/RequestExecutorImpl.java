package com.flowtest.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowtest.engine.ExchangeResult;
import com.flowtest.engine.HttpCall;
import com.flowtest.engine.HttpResponseSnapshot;
import com.flowtest.engine.HttpSession;
import com.flowtest.engine.RequestErrorKind;
import com.flowtest.service.api.RequestExecutor;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

/**
 * Sends requests with Spring's {@link WebClient}, blocking until the response body has been
 * buffered or the call's timeout has passed.
 */
@Service
@Slf4j
public class RequestExecutorImpl implements RequestExecutor {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RequestExecutorImpl(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public HttpSession newSession() {
        return new HttpSession(webClient);
    }

    @Override
    public ExchangeResult execute(HttpSession session, HttpCall call) {
        long start = System.nanoTime();
        try {
            WebClient.RequestBodySpec request = session.client()
                    .method(HttpMethod.valueOf(call.method().trim().toUpperCase(Locale.ROOT)))
                    .uri(toUri(call.url()))
                    .headers(headers -> call.headers().forEach(headers::set));

            WebClient.RequestHeadersSpec<?> ready = attachBody(request, call);
            log.debug("Sending {} {} (timeout {})", call.method(), call.url(), call.timeout());

            ResponseEntity<String> entity = ready
                    .exchangeToMono(response -> response.toEntity(String.class))
                    .timeout(call.timeout())
                    .block();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (entity == null) {
                return ExchangeResult.failure(RequestErrorKind.MALFORMED_RESPONSE, "no response received", elapsed);
            }
            HttpResponseSnapshot snapshot = new HttpResponseSnapshot(
                    entity.getStatusCode().value(), entity.getHeaders(), entity.getBody());
            return ExchangeResult.success(snapshot, elapsed);
        } catch (RuntimeException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            Throwable cause = Exceptions.unwrap(e);
            RequestErrorKind kind = classify(cause);
            if (kind == null) {
                throw e;
            }
            log.debug("{} {} failed with {}", call.method(), call.url(), kind, cause);
            return ExchangeResult.failure(kind, describe(cause), elapsed);
        }
    }

    private WebClient.RequestHeadersSpec<?> attachBody(WebClient.RequestBodySpec request, HttpCall call) {
        JsonNode body = call.body();
        if (body == null || body.isNull() || body.isMissingNode()) {
            return request;
        }
        if (body.isContainerNode()) {
            if (!hasHeader(call, HttpHeaders.CONTENT_TYPE)) {
                request.contentType(MediaType.APPLICATION_JSON);
            }
            return request.bodyValue(toJsonBytes(body));
        }
        if (!hasHeader(call, HttpHeaders.CONTENT_TYPE)) {
            request.contentType(TEXT_PLAIN_UTF8);
        }
        String text = body.isTextual() ? body.textValue() : body.asText();
        return request.bodyValue(text.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] toJsonBytes(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body cannot be written as JSON", e);
        }
    }

    private boolean hasHeader(HttpCall call, String name) {
        return call.headers().keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    /**
     * Uses the URL as written when it is a valid URI, otherwise percent-encodes the characters
     * that are not allowed.
     */
    private URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
        }
    }

    private RequestErrorKind classify(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return RequestErrorKind.TIMEOUT;
        }
        if (cause instanceof WebClientRequestException || cause instanceof IOException) {
            return RequestErrorKind.CONNECTION_FAILURE;
        }
        if (cause instanceof WebClientResponseException || cause instanceof CodecException
                || cause instanceof DataBufferLimitException) {
            return RequestErrorKind.MALFORMED_RESPONSE;
        }
        if (cause instanceof IllegalArgumentException) {
            return RequestErrorKind.INVALID_REQUEST;
        }
        return null;
    }

    private String describe(Throwable cause) {
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (root != cause && root.getMessage() != null && !message.contains(root.getMessage())) {
            message = message + " (" + root.getMessage() + ")";
        }
        return message;
    }
}
