package com.example.search.source.adapter.gdrive;

import com.example.search.aggregation.exception.DocumentAccessDeniedException;
import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.config.properties.SourcesProperties.GoogleDriveProperties;
import com.example.search.config.properties.SourcesProperties.Mode;
import com.example.search.config.properties.SourcesProperties.RetryProperties;
import com.example.search.source.adapter.gdrive.dto.DriveFile;
import com.example.search.source.exception.AdapterException;
import com.example.search.source.model.AccessLevel;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.UpdateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GoogleDriveAdapter")
class GoogleDriveAdapterTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final String BASE_URL = "https://drive.test/drive/v3";

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();

    private GoogleDriveAdapter adapter;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .exchangeFunction(request -> {
                    requests.add(request);
                    ClientResponse next = responses.poll();
                    return next == null
                            ? Mono.error(new IllegalStateException("No stubbed response for " + request.url()))
                            : Mono.just(next);
                })
                .build();
        GoogleDriveProperties properties = new GoogleDriveProperties(
                Mode.LIVE, BASE_URL, Duration.ofSeconds(2), 50,
                new RetryProperties(3, Duration.ofMillis(1), Duration.ofMillis(5)));
        adapter = new GoogleDriveAdapter(webClient, properties, Clock.fixed(NOW, ZoneOffset.UTC), "drive-token");
    }

    private void respondJson(HttpStatus status, String json) {
        responses.add(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    private void respondText(String text) {
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body(text)
                .build());
    }

    private static String queryParam(ClientRequest request, String name) {
        String raw = UriComponentsBuilder.fromUri(request.url()).build(true).getQueryParams().getFirst(name);
        return raw == null ? null : URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("Should send an escaped full-text query with the caller's token")
        void queryAndToken() {
            respondJson(HttpStatus.OK, "{\"files\":[]}");

            StepVerifier.create(adapter.search("bob's budget", 10))
                    .assertNext(results -> assertThat(results).isEmpty())
                    .verifyComplete();

            ClientRequest request = requests.get(0);
            assertThat(request.url().getPath()).isEqualTo("/drive/v3/files");
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer drive-token");
            assertThat(queryParam(request, "q")).isEqualTo(
                    "((fullText contains 'bob\\'s budget') or (name contains 'bob\\'s budget')) and trashed=false");
            assertThat(queryParam(request, "pageSize")).isEqualTo("10");
            assertThat(queryParam(request, "orderBy")).isEqualTo("modifiedTime desc");
        }

        @Test
        @DisplayName("Should cap the page size at the Drive maximum")
        void pageSizeCapped() {
            respondJson(HttpStatus.OK, "{\"files\":[]}");

            StepVerifier.create(adapter.search("x", 500))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(queryParam(requests.get(0), "pageSize")).isEqualTo("100");
        }

        @Test
        @DisplayName("Should map files to results with snippet fallback and owner access")
        void mapsFiles() {
            respondJson(HttpStatus.OK, """
                    {"files":[
                      {"id":"f1","name":"Budget","description":"Q4 numbers","webViewLink":"https://d/f1",
                       "modifiedTime":"2024-03-09T10:00:00Z","mimeType":"application/vnd.google-apps.document",
                       "owners":[{"displayName":"Ana","me":true}]},
                      {"id":"f2","name":"Notes","modifiedTime":"2024-03-08T10:00:00Z","mimeType":"text/plain",
                       "owners":[{"displayName":"Raj","me":false}]}
                    ]}
                    """);

            StepVerifier.create(adapter.search("budget", 10))
                    .assertNext(results -> {
                        assertThat(results).hasSize(2);
                        assertThat(results.get(0).id()).isEqualTo("gdrive:f1");
                        assertThat(results.get(0).snippet()).isEqualTo("Q4 numbers");
                        assertThat(results.get(0).author()).isEqualTo("Ana");
                        assertThat(results.get(0).accessLevel()).isEqualTo(AccessLevel.OWNER);
                        assertThat(results.get(0).source()).isEqualTo(SourceId.GDRIVE);
                        assertThat(results.get(1).snippet()).isEqualTo("Document: Notes - text/plain");
                        assertThat(results.get(1).accessLevel()).isEqualTo(AccessLevel.VIEWER);
                        assertThat(results.get(1).url()).isEmpty();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should retry 503 and give up with the upstream status")
        void retriesTransientFailures() {
            respondJson(HttpStatus.SERVICE_UNAVAILABLE, "{}");
            respondJson(HttpStatus.SERVICE_UNAVAILABLE, "{}");
            respondJson(HttpStatus.SERVICE_UNAVAILABLE, "{}");

            StepVerifier.create(adapter.search("x", 5))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(AdapterException.class);
                        assertThat(((AdapterException) error).getStatusCode()).isEqualTo(503);
                    })
                    .verify(Duration.ofSeconds(5));

            assertThat(requests).hasSize(3);
        }

        @Test
        @DisplayName("Should recover when a retry succeeds")
        void recoversAfterRetry() {
            respondJson(HttpStatus.SERVICE_UNAVAILABLE, "{}");
            respondJson(HttpStatus.OK, "{\"files\":[{\"id\":\"f1\",\"name\":\"Budget\"}]}");

            StepVerifier.create(adapter.search("x", 5))
                    .assertNext(results -> assertThat(results).hasSize(1))
                    .verifyComplete();

            assertThat(requests).hasSize(2);
        }

        @Test
        @DisplayName("Should not retry a 401")
        void permanentFailureNotRetried() {
            respondJson(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid_token\"}");

            StepVerifier.create(adapter.search("x", 5))
                    .expectError(AdapterException.class)
                    .verify();

            assertThat(requests).hasSize(1);
        }
    }

    @Nested
    @DisplayName("getDocument")
    class GetDocument {

        @Test
        @DisplayName("Should export Google Docs as plain text")
        void exportsWorkspaceDocs() {
            respondJson(HttpStatus.OK, """
                    {"id":"f1","name":"Budget","mimeType":"application/vnd.google-apps.document",
                     "modifiedTime":"2024-03-09T10:00:00Z","owners":[{"displayName":"Ana"}]}
                    """);
            respondText("Budget body");

            StepVerifier.create(adapter.getDocument("f1"))
                    .assertNext(doc -> {
                        assertThat(doc.id()).isEqualTo("gdrive:f1");
                        assertThat(doc.content()).isEqualTo("Budget body");
                        assertThat(doc.author()).isEqualTo("Ana");
                    })
                    .verifyComplete();

            assertThat(requests).hasSize(2);
            assertThat(requests.get(1).url().getPath()).isEqualTo("/drive/v3/files/f1/export");
            assertThat(queryParam(requests.get(1), "mimeType")).isEqualTo("text/plain");
        }

        @Test
        @DisplayName("Should download plain text files directly")
        void downloadsPlainText() {
            respondJson(HttpStatus.OK, "{\"id\":\"f2\",\"name\":\"Notes\",\"mimeType\":\"text/plain\"}");
            respondText("raw notes");

            StepVerifier.create(adapter.getDocument("f2"))
                    .assertNext(doc -> assertThat(doc.content()).isEqualTo("raw notes"))
                    .verifyComplete();

            assertThat(queryParam(requests.get(1), "alt")).isEqualTo("media");
        }

        @Test
        @DisplayName("Should describe unsupported types without downloading them")
        void unsupportedType() {
            respondJson(HttpStatus.OK, "{\"id\":\"f3\",\"name\":\"Photo\",\"mimeType\":\"image/png\"}");

            StepVerifier.create(adapter.getDocument("f3"))
                    .assertNext(doc -> assertThat(doc.content()).isEqualTo("Unsupported file type: image/png"))
                    .verifyComplete();

            assertThat(requests).hasSize(1);
        }

        @Test
        @DisplayName("Should degrade to a placeholder when the export fails")
        void exportFailureDegrades() {
            respondJson(HttpStatus.OK, "{\"id\":\"f1\",\"name\":\"Sheet\",\"mimeType\":\"application/vnd.google-apps.spreadsheet\"}");
            respondJson(HttpStatus.BAD_REQUEST, "{\"error\":\"exportSizeLimitExceeded\"}");

            StepVerifier.create(adapter.getDocument("f1"))
                    .assertNext(doc -> assertThat(doc.content())
                            .isEqualTo("Content not available for application/vnd.google-apps.spreadsheet files"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should degrade to a placeholder when Drive refuses an oversized export")
        void exportSizeLimitDegrades() {
            respondJson(HttpStatus.OK, "{\"id\":\"big\",\"name\":\"Handbook\",\"mimeType\":\"application/vnd.google-apps.document\"}");
            respondJson(HttpStatus.FORBIDDEN,
                    "{\"error\":{\"errors\":[{\"reason\":\"exportSizeLimitExceeded\"}],\"code\":403}}");

            StepVerifier.create(adapter.getDocument("big"))
                    .assertNext(doc -> {
                        assertThat(doc.id()).isEqualTo("gdrive:big");
                        assertThat(doc.content())
                                .isEqualTo("Content not available for application/vnd.google-apps.document files");
                    })
                    .verifyComplete();

            assertThat(requests).hasSize(2);
        }

        @Test
        @DisplayName("Should degrade to a placeholder when the download is gone")
        void downloadNotFoundDegrades() {
            respondJson(HttpStatus.OK, "{\"id\":\"f2\",\"name\":\"Notes\",\"mimeType\":\"text/plain\"}");
            respondJson(HttpStatus.NOT_FOUND, "{}");

            StepVerifier.create(adapter.getDocument("f2"))
                    .assertNext(doc -> assertThat(doc.content()).isEqualTo("Content not available for text/plain files"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map 404 to not found")
        void notFound() {
            respondJson(HttpStatus.NOT_FOUND, "{}");

            StepVerifier.create(adapter.getDocument("missing"))
                    .expectError(DocumentNotFoundException.class)
                    .verify();

            assertThat(requests).hasSize(1);
        }

        @Test
        @DisplayName("Should map 403 to access denied")
        void accessDenied() {
            respondJson(HttpStatus.FORBIDDEN, "{}");

            StepVerifier.create(adapter.getDocument("locked"))
                    .expectError(DocumentAccessDeniedException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("getRecentUpdates")
    class RecentUpdates {

        @Test
        @DisplayName("Should query files modified since the cutoff")
        void cutoffQuery() {
            respondJson(HttpStatus.OK, "{\"files\":[]}");

            StepVerifier.create(adapter.getRecentUpdates(7))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(queryParam(requests.get(0), "q"))
                    .isEqualTo("modifiedTime >= '2024-03-03T12:00:00Z' and trashed=false");
            assertThat(queryParam(requests.get(0), "pageSize")).isEqualTo("50");
        }

        @Test
        @DisplayName("Should classify updates and name the last modifier")
        void mapsUpdates() {
            respondJson(HttpStatus.OK, """
                    {"files":[
                      {"id":"n1","name":"New","createdTime":"2024-03-09T10:00:00Z","modifiedTime":"2024-03-09T10:00:30Z",
                       "lastModifyingUser":{"displayName":"Ana"}},
                      {"id":"e1","name":"Edited","createdTime":"2024-01-01T10:00:00Z","modifiedTime":"2024-03-08T10:00:00Z"}
                    ]}
                    """);

            StepVerifier.create(adapter.getRecentUpdates(7))
                    .assertNext(updates -> {
                        assertThat(updates.get(0).updateType()).isEqualTo(UpdateType.CREATED);
                        assertThat(updates.get(0).snippet()).isEqualTo("Created document: New");
                        assertThat(updates.get(0).author()).isEqualTo("Ana");
                        assertThat(updates.get(1).updateType()).isEqualTo(UpdateType.MODIFIED);
                        assertThat(updates.get(1).snippet()).isEqualTo("Modified document: Edited");
                        assertThat(updates.get(1).author()).isEqualTo("Unknown");
                    })
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should treat unparseable timestamps as modified")
    void updateTypeWithBadTimestamps() {
        DriveFile file = new DriveFile("x", "X", null, null, null, "garbage", "2024-03-09T10:00:00Z", null, null);

        assertThat(GoogleDriveAdapter.updateTypeOf(file)).isEqualTo(UpdateType.MODIFIED);
    }

    @Test
    @DisplayName("Should escape backslashes before quotes")
    void escape() {
        assertThat(GoogleDriveAdapter.escape("a\\'b")).isEqualTo("a\\\\\\'b");
    }
}
