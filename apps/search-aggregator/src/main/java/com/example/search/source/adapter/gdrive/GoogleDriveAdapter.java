package com.example.search.source.adapter.gdrive;

import com.example.search.aggregation.exception.DocumentAccessDeniedException;
import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.common.util.StringSanitizer;
import com.example.search.common.util.TimestampParser;
import com.example.search.config.properties.SourcesProperties.GoogleDriveProperties;
import com.example.search.source.adapter.SourceAdapter;
import com.example.search.source.adapter.gdrive.dto.DriveFile;
import com.example.search.source.adapter.gdrive.dto.DriveFileList;
import com.example.search.source.adapter.gdrive.dto.DriveUser;
import com.example.search.source.exception.AdapterException;
import com.example.search.source.model.AccessLevel;
import com.example.search.source.model.CompositeDocumentId;
import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.UpdateType;
import com.example.search.source.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Google Drive v3 REST adapter. One instance per caller; requests carry the caller's bearer token.
 */
@Slf4j
public class GoogleDriveAdapter implements SourceAdapter {

    static final String SEARCH_FIELDS =
            "files(id,name,description,webViewLink,modifiedTime,owners,mimeType)";
    static final String UPDATES_FIELDS =
            "files(id,name,description,webViewLink,modifiedTime,createdTime,owners,lastModifyingUser)";
    static final String FILE_FIELDS =
            "id,name,description,webViewLink,modifiedTime,owners,mimeType";
    static final int MAX_PAGE_SIZE = 100;
    static final Duration CREATED_WINDOW = Duration.ofSeconds(60);

    private static final String ORDER_BY = "modifiedTime desc";
    private static final String PLAIN_TEXT = "text/plain";

    /** Google Workspace types and the format they are exported as. */
    private static final Map<String, String> EXPORT_TYPES = Map.of(
            "application/vnd.google-apps.document", PLAIN_TEXT,
            "application/vnd.google-apps.presentation", PLAIN_TEXT,
            "application/vnd.google-apps.spreadsheet", "text/csv"
    );

    private final WebClient webClient;
    private final GoogleDriveProperties properties;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    @Nullable
    private final String bearerToken;

    public GoogleDriveAdapter(
            @NonNull WebClient webClient,
            @NonNull GoogleDriveProperties properties,
            @NonNull Clock clock,
            @Nullable String bearerToken) {
        this.webClient = webClient;
        this.properties = properties;
        this.retryPolicy = properties.retry().toPolicy();
        this.clock = clock;
        this.bearerToken = bearerToken;
    }

    @Override
    @NonNull
    public SourceId source() {
        return SourceId.GDRIVE;
    }

    @Override
    @NonNull
    public Mono<List<SearchResult>> search(@NonNull String query, int maxResults) {
        String escaped = escape(query);
        String q = "((fullText contains '" + escaped + "') or (name contains '" + escaped + "')) and trashed=false";
        int pageSize = Math.max(1, Math.min(maxResults, MAX_PAGE_SIZE));

        log.debug("Drive search q={} pageSize={}", StringSanitizer.forLog(q), pageSize);

        return listFiles(q, SEARCH_FIELDS, pageSize, "gdrive search")
                .map(list -> list.files().stream()
                        .limit(Math.max(0, maxResults))
                        .map(this::toSearchResult)
                        .toList());
    }

    @Override
    @NonNull
    public Mono<DocumentContent> getDocument(@NonNull String nativeId) {
        return webClient.get()
                .uri(builder -> builder.path("/files/{fileId}")
                        .queryParam("fields", "{fields}")
                        .build(Map.of("fileId", nativeId, "fields", FILE_FIELDS)))
                .headers(this::authorize)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, nativeId))
                .bodyToMono(DriveFile.class)
                .timeout(properties.timeout())
                .retryWhen(retryPolicy.toRetry("gdrive metadata"))
                .flatMap(file -> fetchContent(nativeId, file.mimeType())
                        .map(content -> toDocumentContent(file, content)));
    }

    @Override
    @NonNull
    public Mono<List<RecentUpdate>> getRecentUpdates(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days)).truncatedTo(ChronoUnit.SECONDS);
        String q = "modifiedTime >= '" + DateTimeFormatter.ISO_INSTANT.format(cutoff) + "' and trashed=false";

        return listFiles(q, UPDATES_FIELDS, properties.updatesPageSize(), "gdrive updates")
                .map(list -> list.files().stream()
                        .map(this::toRecentUpdate)
                        .toList());
    }

    private Mono<DriveFileList> listFiles(String q, String fields, int pageSize, String operation) {
        return webClient.get()
                .uri(builder -> builder.path("/files")
                        .queryParam("q", "{q}")
                        .queryParam("fields", "{fields}")
                        .queryParam("orderBy", "{orderBy}")
                        .queryParam("pageSize", pageSize)
                        .build(Map.of("q", q, "fields", fields, "orderBy", ORDER_BY)))
                .headers(this::authorize)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toError(response, null))
                .bodyToMono(DriveFileList.class)
                .timeout(properties.timeout())
                .retryWhen(retryPolicy.toRetry(operation))
                .defaultIfEmpty(new DriveFileList(List.of(), null));
    }

    /**
     * Export or download failures never fail the fetch; not-found and access-denied are
     * decided by the metadata call. Drive answers 403 for exports over its size limit.
     */
    private Mono<String> fetchContent(String nativeId, @Nullable String mimeType) {
        String type = mimeType == null ? "" : mimeType;
        String exportType = EXPORT_TYPES.get(type);

        Mono<String> body;
        if (exportType != null) {
            body = webClient.get()
                    .uri(builder -> builder.path("/files/{fileId}/export")
                            .queryParam("mimeType", "{mimeType}")
                            .build(Map.of("fileId", nativeId, "mimeType", exportType)))
                    .headers(this::authorize)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toError(response, null))
                    .bodyToMono(String.class);
        } else if (PLAIN_TEXT.equals(type)) {
            body = webClient.get()
                    .uri(builder -> builder.path("/files/{fileId}")
                            .queryParam("alt", "media")
                            .build(Map.of("fileId", nativeId)))
                    .headers(this::authorize)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toError(response, null))
                    .bodyToMono(String.class);
        } else {
            return Mono.just("Unsupported file type: " + type);
        }

        return body
                .timeout(properties.timeout())
                .retryWhen(retryPolicy.toRetry("gdrive content"))
                .defaultIfEmpty("")
                .onErrorResume(e -> {
                    log.warn("Could not extract content from Drive file {}: {}", nativeId, e.toString());
                    return Mono.just("Content not available for " + type + " files");
                });
    }

    private void authorize(HttpHeaders headers) {
        if (bearerToken != null && !bearerToken.isBlank()) {
            headers.setBearerAuth(bearerToken);
        }
    }

    private Mono<? extends Throwable> toError(ClientResponse response, @Nullable String nativeId) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> mapStatus(status, body, nativeId));
    }

    private Throwable mapStatus(int status, String body, @Nullable String nativeId) {
        if (nativeId != null && status == 404) {
            return new DocumentNotFoundException(SourceId.GDRIVE, CompositeDocumentId.format(SourceId.GDRIVE, nativeId));
        }
        if (nativeId != null && status == 403) {
            return new DocumentAccessDeniedException(SourceId.GDRIVE, CompositeDocumentId.format(SourceId.GDRIVE, nativeId));
        }
        log.warn("Drive API returned {}: {}", status, StringSanitizer.forLog(body));
        return new AdapterException(SourceId.GDRIVE, status, StringSanitizer.forLog(body));
    }

    private SearchResult toSearchResult(DriveFile file) {
        String snippet = hasText(file.description())
                ? file.description()
                : "Document: " + titleOf(file) + " - " + (file.mimeType() == null ? "Unknown type" : file.mimeType());

        return SearchResult.builder()
                .id(CompositeDocumentId.format(SourceId.GDRIVE, file.id()))
                .title(titleOf(file))
                .snippet(snippet)
                .url(file.webViewLink() == null ? "" : file.webViewLink())
                .source(SourceId.GDRIVE)
                .lastModified(modifiedOf(file))
                .author(file.ownerName())
                .accessLevel(file.ownedByCaller() ? AccessLevel.OWNER : AccessLevel.VIEWER)
                .build();
    }

    private RecentUpdate toRecentUpdate(DriveFile file) {
        UpdateType type = updateTypeOf(file);
        String snippet = hasText(file.description())
                ? file.description()
                : (type == UpdateType.CREATED ? "Created" : "Modified") + " document: " + titleOf(file);
        DriveUser modifier = file.lastModifyingUser();

        return RecentUpdate.builder()
                .id(CompositeDocumentId.format(SourceId.GDRIVE, file.id()))
                .title(titleOf(file))
                .snippet(snippet)
                .url(file.webViewLink() == null ? "" : file.webViewLink())
                .source(SourceId.GDRIVE)
                .lastModified(modifiedOf(file))
                .author(modifier == null || modifier.displayName() == null ? "Unknown" : modifier.displayName())
                .updateType(type)
                .build();
    }

    private DocumentContent toDocumentContent(DriveFile file, String content) {
        return DocumentContent.builder()
                .id(CompositeDocumentId.format(SourceId.GDRIVE, file.id()))
                .title(titleOf(file))
                .content(content)
                .source(SourceId.GDRIVE)
                .url(file.webViewLink() == null ? "" : file.webViewLink())
                .lastModified(modifiedOf(file))
                .author(file.ownerName())
                .build();
    }

    /**
     * A file counts as created when its last modification landed within a minute of creation.
     */
    static UpdateType updateTypeOf(DriveFile file) {
        Instant created = TimestampParser.parseOrMin(file.createdTime());
        Instant modified = TimestampParser.parseOrMin(file.modifiedTime());
        if (Instant.MIN.equals(created) || Instant.MIN.equals(modified)) {
            return UpdateType.MODIFIED;
        }
        return Duration.between(created, modified).compareTo(CREATED_WINDOW) < 0
                ? UpdateType.CREATED
                : UpdateType.MODIFIED;
    }

    static String escape(String query) {
        return query.replace("\\", "\\\\").replace("'", "\\'");
    }

    private String modifiedOf(DriveFile file) {
        return file.modifiedTime() != null ? file.modifiedTime() : clock.instant().toString();
    }

    private static String titleOf(DriveFile file) {
        return hasText(file.name()) ? file.name() : "Untitled";
    }

    private static boolean hasText(@Nullable String value) {
        return value != null && !value.isBlank();
    }
}
