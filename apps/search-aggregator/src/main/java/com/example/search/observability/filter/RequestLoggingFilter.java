package com.example.search.observability.filter;

import com.example.search.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Logs API requests with status and duration. Runs after {@link CorrelationIdFilter} so the
 * correlation id is already in the MDC. Request timing metrics come from Actuator's
 * {@code http.server.requests}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLoggingFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        long startedAt = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String sanitizedPath = StringSanitizer.forLog(path, 200);

        return chain.filter(exchange)
                .doFirst(() -> log.info("Incoming request: {} {}", method, sanitizedPath))
                .doFinally(signalType -> {
                    long durationMs = (System.nanoTime() - startedAt) / 1_000_000;
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    int statusCode = status != null ? status.value() : 200;

                    if (statusCode >= 500) {
                        log.error("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    } else if (statusCode >= 400) {
                        log.warn("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    } else {
                        log.info("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    }
                });
    }
}
