package com.flowtest.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * A Spring configuration class responsible for creating the HTTP client used to run flow steps.
 * <p>
 * Failed requests are never retried: a flow reports the first failure it sees.
 */
@Configuration
@Slf4j
public class HttpClientFactory {

    /**
     * Creates the shared {@link WebClient}. Each flow run derives its own session client from it,
     * so the connection pool is shared while cookies are not.
     *
     * @param properties The {@code flow.*} settings, used for buffer size and user agent.
     * @return A configured {@link WebClient} instance.
     */
    @Bean
    public WebClient webClient(FlowProperties properties) {
        int maxInMemorySize = (int) properties.getHttp().getMaxInMemorySize().toBytes();
        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getHttp().getUserAgent())
                .filter(requestLogger())
                .build();
    }

    private ExchangeFilterFunction requestLogger() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("--> {} {} headers={}", request.method(), request.url(), request.headers());
            return Mono.just(request);
        });
    }
}
