package com.example.search.source.adapter.sample;

import com.example.search.identity.model.IdentityContext;
import com.example.search.source.adapter.SourceAdapter;
import com.example.search.source.adapter.SourceAdapterFactory;
import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;

import java.time.Clock;

/**
 * Hands out one shared {@link SampleSourceAdapter} per source; the fixture adapter is stateless.
 */
public class SampleSourceAdapterFactory implements SourceAdapterFactory {

    private final SampleSourceAdapter adapter;

    public SampleSourceAdapterFactory(@NonNull SourceId source, @NonNull Clock clock) {
        this.adapter = new SampleSourceAdapter(source, SampleDocuments.forSource(source), clock);
    }

    @Override
    @NonNull
    public SourceId source() {
        return adapter.source();
    }

    @Override
    @NonNull
    public SourceAdapter create(@NonNull IdentityContext identity) {
        return adapter;
    }
}
