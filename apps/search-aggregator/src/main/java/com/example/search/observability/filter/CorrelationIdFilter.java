package com.example.search.observability.filter;

import com.example.search.identity.resolver.IdentityContextArgumentResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation id, taken from {@code X-Correlation-Id} or
 * {@code X-Request-Id} when the gateway sent one. The id is echoed on the response,
 * written to the Reactor context and put in the MDC for the request's log lines.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String CALLER_ID_KEY = "callerId";

    private static final int MAX_ID_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String correlationId = extractOrGenerate(request);
        String callerId = request.getHeaders().getFirst(IdentityContextArgumentResolver.CALLER_ID_HEADER);
        String requestPath = request.getPath().value();
        String requestMethod = request.getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    if (callerId != null) {
                        MDC.put(CALLER_ID_KEY, callerId.replaceAll("[\\r\\n\\t]", ""));
                    }
                    log.debug("Request started: {} {}", requestMethod, requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod, requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(CALLER_ID_KEY);
                });
    }

    private static String extractOrGenerate(ServerHttpRequest request) {
        for (String header : new String[] {CORRELATION_ID_HEADER, REQUEST_ID_HEADER}) {
            String value = request.getHeaders().getFirst(header);
            if (value != null && !value.isBlank()) {
                String trimmed = value.trim().replaceAll("[\\r\\n\\t]", "");
                return trimmed.length() > MAX_ID_LENGTH ? trimmed.substring(0, MAX_ID_LENGTH) : trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
