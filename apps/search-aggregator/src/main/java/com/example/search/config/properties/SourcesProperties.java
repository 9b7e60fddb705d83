package com.example.search.config.properties;

import com.example.search.source.model.SourceId;
import com.example.search.source.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the source adapters.
 * {@code gdrive.mode=live} wires the Google Drive REST adapter; every source listed in
 * {@code sample-sources} without a live adapter gets the in-process fixture adapter.
 */
@ConfigurationProperties(prefix = "app.sources")
public record SourcesProperties(
        @NonNull GoogleDriveProperties gdrive,
        @NonNull List<SourceId> sampleSources
) {
    public SourcesProperties {
        if (gdrive == null) {
            gdrive = GoogleDriveProperties.defaults();
        }
        if (sampleSources == null) {
            sampleSources = List.of(SourceId.values());
        } else {
            sampleSources = List.copyOf(sampleSources);
        }
    }

    public enum Mode {
        LIVE,
        SAMPLE
    }

    /**
     * Google Drive v3 REST API settings.
     */
    public record GoogleDriveProperties(
            @NonNull Mode mode,
            @NonNull String baseUrl,
            @NonNull Duration timeout,
            int updatesPageSize,
            @NonNull RetryProperties retry
    ) {
        public GoogleDriveProperties {
            if (mode == null) {
                mode = Mode.SAMPLE;
            }
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://www.googleapis.com/drive/v3";
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(4);
            }
            if (updatesPageSize <= 0) {
                updatesPageSize = 50;
            }
            if (retry == null) {
                retry = new RetryProperties(3, Duration.ofMillis(200), Duration.ofSeconds(2));
            }
        }

        public static GoogleDriveProperties defaults() {
            return new GoogleDriveProperties(null, null, null, 0, null);
        }
    }

    /**
     * Retry configuration for outbound source calls.
     */
    public record RetryProperties(
            int maxAttempts,
            @NonNull Duration initialBackoff,
            @NonNull Duration maxBackoff
    ) {
        public RetryProperties {
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(200);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(2);
            }
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
        }
    }
}
