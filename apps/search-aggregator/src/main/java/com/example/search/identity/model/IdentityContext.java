package com.example.search.identity.model;

import com.example.search.source.model.SourceId;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Authenticated caller for the duration of one logical request.
 * Scopes are copied on construction so the context can be shared across fan-out branches.
 */
public record IdentityContext(
        @Nullable String callerId,
        @Nullable String email,
        @Nullable String bearerToken,
        Set<String> scopes
) {
    public IdentityContext {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public boolean isAuthenticated() {
        return callerId != null && !callerId.isBlank();
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public boolean canRead(SourceId source) {
        return hasScope(source.readScope());
    }
}
