package com.example.search.authz.service;

import com.example.search.identity.model.IdentityContext;
import com.example.search.source.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides per source whether the caller holds {@code <source>:read}.
 * Runs before any cache lookup or adapter call tied to that source.
 */
@Slf4j
@Component
public class PermissionFilter {

    public boolean isAllowed(@NonNull IdentityContext identity, @NonNull SourceId source) {
        return identity.isAuthenticated() && identity.canRead(source);
    }

    /**
     * Keeps the permitted sources in their given order. Denied sources are logged and dropped.
     */
    @NonNull
    public List<SourceId> permittedSources(
            @NonNull IdentityContext identity,
            @NonNull Collection<SourceId> sources) {

        List<SourceId> permitted = new ArrayList<>(sources.size());
        for (SourceId source : sources) {
            if (isAllowed(identity, source)) {
                permitted.add(source);
            } else {
                log.warn("Caller {} lacks scope {}, skipping source", identity.callerId(), source.readScope());
            }
        }
        return permitted;
    }
}
