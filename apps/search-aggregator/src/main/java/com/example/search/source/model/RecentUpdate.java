package com.example.search.source.model;

import com.example.search.common.util.ContentTruncator;
import lombok.Builder;

/**
 * Activity on a document within the requested window. The update type is decided by the adapter.
 */
@Builder(toBuilder = true)
public record RecentUpdate(
        String id,
        String title,
        String snippet,
        String url,
        SourceId source,
        String lastModified,
        String author,
        UpdateType updateType
) {
    public RecentUpdate {
        snippet = ContentTruncator.snippet(snippet);
        if (updateType == null) {
            updateType = UpdateType.MODIFIED;
        }
    }
}
