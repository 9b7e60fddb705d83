package com.example.search.source.model;

import com.example.search.common.util.ContentTruncator;
import lombok.Builder;
import org.springframework.lang.NonNull;

/**
 * Full text of a single document. {@code id} is the composite id so the source can be
 * recovered without another lookup.
 */
@Builder(toBuilder = true)
public record DocumentContent(
        String id,
        String title,
        String content,
        SourceId source,
        String url,
        String lastModified,
        String author
) {

    /**
     * Returns a copy whose content fits in {@code maxBytes} of UTF-8.
     */
    @NonNull
    public DocumentContent withContentCappedAt(int maxBytes) {
        String capped = ContentTruncator.capUtf8Bytes(content, maxBytes);
        if (capped.equals(content)) {
            return this;
        }
        return toBuilder().content(capped).build();
    }
}
