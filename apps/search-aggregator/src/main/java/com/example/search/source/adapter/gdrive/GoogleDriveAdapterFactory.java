package com.example.search.source.adapter.gdrive;

import com.example.search.config.properties.SourcesProperties;
import com.example.search.identity.model.IdentityContext;
import com.example.search.source.adapter.SourceAdapter;
import com.example.search.source.adapter.SourceAdapterFactory;
import com.example.search.source.model.SourceId;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

import static com.example.search.config.GoogleDriveWebClientConfig.GDRIVE_WEBCLIENT;

/**
 * Builds a per-caller {@link GoogleDriveAdapter} bound to the caller's bearer token.
 * Only active with {@code app.sources.gdrive.mode=live}.
 */
@Component
@ConditionalOnProperty(prefix = "app.sources.gdrive", name = "mode", havingValue = "live")
public class GoogleDriveAdapterFactory implements SourceAdapterFactory {

    private final WebClient webClient;
    private final SourcesProperties sourcesProperties;
    private final Clock clock;

    public GoogleDriveAdapterFactory(
            @Qualifier(GDRIVE_WEBCLIENT) WebClient webClient,
            SourcesProperties sourcesProperties,
            Clock clock) {
        this.webClient = webClient;
        this.sourcesProperties = sourcesProperties;
        this.clock = clock;
    }

    @Override
    @NonNull
    public SourceId source() {
        return SourceId.GDRIVE;
    }

    @Override
    @NonNull
    public SourceAdapter create(@NonNull IdentityContext identity) {
        return new GoogleDriveAdapter(webClient, sourcesProperties.gdrive(), clock, identity.bearerToken());
    }
}
