package com.example.search.source.model;

import com.example.search.common.util.ContentTruncator;
import lombok.Builder;

/**
 * One search hit from a single source. The snippet is capped on construction.
 *
 * @param id           composite id ({@code <source>:<native-id>})
 * @param lastModified ISO-8601 timestamp as reported by the source
 */
@Builder(toBuilder = true)
public record SearchResult(
        String id,
        String title,
        String snippet,
        String url,
        SourceId source,
        String lastModified,
        String author,
        AccessLevel accessLevel
) {
    public SearchResult {
        snippet = ContentTruncator.snippet(snippet);
        if (accessLevel == null) {
            accessLevel = AccessLevel.VIEWER;
        }
    }
}
