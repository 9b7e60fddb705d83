package com.example.search.source.adapter;

import com.example.search.identity.model.IdentityContext;
import com.example.search.source.model.SourceId;
import org.springframework.lang.NonNull;

/**
 * Builds the adapter for one source and one caller. Must not perform network I/O.
 * A factory may hand back a shared instance when its adapter holds no per-caller state
 * and is safe for concurrent use; otherwise it returns a fresh instance per call.
 */
public interface SourceAdapterFactory {

    @NonNull
    SourceId source();

    @NonNull
    SourceAdapter create(@NonNull IdentityContext identity);
}
