package com.example.search.source.adapter;

import com.example.search.identity.model.IdentityContext;
import com.example.search.source.model.SourceId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup table from source to adapter factory, built once at startup.
 * Sources without a registered factory are treated as unsupported and are simply absent.
 * Created by {@link com.example.search.config.SourceAdapterConfig}.
 */
@Slf4j
public class SourceAdapterRegistry {

    private final Map<SourceId, SourceAdapterFactory> factories;

    public SourceAdapterRegistry(List<SourceAdapterFactory> factories) {
        EnumMap<SourceId, SourceAdapterFactory> table = new EnumMap<>(SourceId.class);
        for (SourceAdapterFactory factory : factories) {
            SourceAdapterFactory existing = table.putIfAbsent(factory.source(), factory);
            if (existing != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate adapter factories for source %s: %s and %s",
                        factory.source(),
                        existing.getClass().getSimpleName(),
                        factory.getClass().getSimpleName()));
            }
        }
        this.factories = Collections.unmodifiableMap(table);
        log.info("Source adapter registry initialized with sources: {}", this.factories.keySet());
    }

    /**
     * Resolves adapters for every registered source.
     */
    @NonNull
    public Map<SourceId, SourceAdapter> resolve(@NonNull IdentityContext identity) {
        return resolve(identity, factories.keySet());
    }

    /**
     * Resolves adapters for the requested sources only. Unregistered sources are omitted.
     */
    @NonNull
    public Map<SourceId, SourceAdapter> resolve(
            @NonNull IdentityContext identity,
            @NonNull Collection<SourceId> sources) {

        EnumMap<SourceId, SourceAdapter> adapters = new EnumMap<>(SourceId.class);
        for (SourceId source : sources) {
            SourceAdapterFactory factory = factories.get(source);
            if (factory != null) {
                adapters.put(source, factory.create(identity));
            }
        }
        return adapters;
    }

    @NonNull
    public Optional<SourceAdapter> resolve(@NonNull IdentityContext identity, @NonNull SourceId source) {
        return Optional.ofNullable(factories.get(source))
                .map(factory -> factory.create(identity));
    }

    @NonNull
    public Set<SourceId> registeredSources() {
        return factories.keySet();
    }
}
