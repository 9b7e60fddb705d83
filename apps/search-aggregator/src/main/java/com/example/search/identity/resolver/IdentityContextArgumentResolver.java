package com.example.search.identity.resolver;

import com.example.search.common.util.StringSanitizer;
import com.example.search.identity.model.IdentityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves {@link IdentityContext} parameters in controller methods from the headers
 * set by the trusted gateway in front of this service.
 *
 * <p>A missing or malformed caller id yields an unauthenticated context; the aggregator
 * rejects it, so the resolver itself never fails the request.</p>
 */
@Slf4j
@Component
public class IdentityContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_EMAIL_HEADER = "X-Caller-Email";
    public static final String CALLER_SCOPES_HEADER = "X-Caller-Scopes";

    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return IdentityContext.class.equals(parameter.getParameterType());
    }

    @Override
    @NonNull
    public Mono<Object> resolveArgument(
            @NonNull MethodParameter parameter,
            @NonNull BindingContext bindingContext,
            @NonNull ServerWebExchange exchange) {

        return Mono.just(resolve(exchange.getRequest().getHeaders()));
    }

    @NonNull
    IdentityContext resolve(@NonNull HttpHeaders headers) {
        String callerId = StringSanitizer.headerValue(headers.getFirst(CALLER_ID_HEADER));
        if (callerId != null && !StringSanitizer.isValidCallerId(callerId)) {
            log.warn("Ignoring malformed caller id header: {}", StringSanitizer.forLog(callerId));
            callerId = null;
        }

        return new IdentityContext(
                callerId,
                StringSanitizer.headerValue(headers.getFirst(CALLER_EMAIL_HEADER)),
                bearerToken(headers.getFirst(HttpHeaders.AUTHORIZATION)),
                scopes(headers.getFirst(CALLER_SCOPES_HEADER)));
    }

    @Nullable
    private static String bearerToken(@Nullable String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static Set<String> scopes(@Nullable String header) {
        if (header == null || header.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(scope -> !scope.isEmpty())
                .collect(Collectors.toSet());
    }
}
