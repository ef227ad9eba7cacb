package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wafsentinel.engine.ingest.FetchBatch;
import com.wafsentinel.engine.ingest.FetchWindow;
import com.wafsentinel.engine.ingest.LogFetcher;
import com.wafsentinel.engine.ingest.RecordSequence;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.BucketGranularity;
import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.support.InMemoryCursorRepository;
import com.wafsentinel.engine.support.Records;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElasticAuditLogStoreTest {

    private static final TimeBucket FOUR = Records.BUCKET;
    private static final String BLANK_ID_PAGE = "{\"hits\":{\"hits\":["
            + "{\"_id\":\"zzz\",\"_source\":{\"transaction_id\":\" \",\"request_path\":\"/a\"},\"sort\":[\" \"]},"
            + "{\"_id\":\"k1\",\"_source\":{\"transaction_id\":\"b\",\"request_path\":\"/b\"},\"sort\":[\"b\"]}"
            + "]}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ElasticAuditLogStore store;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        WebClient webClient = WebClient.builder().baseUrl(server.url("/").toString()).build();
        ElasticsearchGateway gateway = new ElasticsearchGateway(webClient, objectMapper, Duration.ofSeconds(5),
                new SimpleMeterRegistry());
        store = new ElasticAuditLogStore(gateway, objectMapper, "unclassified_", "transaction_id");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void shouldExcludeEmptyIdsAndPageAfterGivenId() throws Exception {
        server.enqueue(json("{\"hits\":{\"hits\":[]}}"));

        store.search(FOUR, "a", 10);

        RecordedRequest request = server.takeRequest();
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("asc", body.path("sort").get(0).path("transaction_id").asText());
        assertEquals("a", body.path("search_after").get(0).asText());
        JsonNode bool = body.path("query").path("bool");
        assertEquals("transaction_id", bool.path("filter").get(0).path("exists").path("field").asText());
        assertEquals("", bool.path("must_not").get(0).path("term").path("transaction_id").asText("missing"));
    }

    @Test
    void shouldKeyRecordsBySortValue() {
        server.enqueue(json(BLANK_ID_PAGE));

        List<AuditRecord> records = store.search(FOUR, null, 10);

        assertEquals(List.of(" ", "b"), records.stream().map(AuditRecord::id).toList());
        assertEquals("/a", records.get(0).uri());
    }

    @Test
    void shouldAdvanceCursorPastBlankIdWithoutRegressionOrSkip() throws Exception {
        server.enqueue(json(BLANK_ID_PAGE));
        server.enqueue(json("{\"hits\":{\"hits\":[{\"_id\":\"k2\",\"_source\":{\"transaction_id\":\"c\"},"
                + "\"sort\":[\"c\"]}]}}"));
        InMemoryCursorRepository cursors = new InMemoryCursorRepository();
        Clock clock = Clock.fixed(Instant.parse("2025-06-19T05:10:00Z"), ZoneOffset.UTC);
        LogFetcher fetcher = new LogFetcher(store, cursors, BucketGranularity.HOURLY, Duration.ofMinutes(5), clock);

        RecordSequence sequence = fetcher.fetch(new FetchWindow(FOUR.start(), clock.instant()));
        FetchBatch first = sequence.nextBatch(2);
        first.records().forEach(fetcher::advance);

        assertEquals("b", cursors.current().lastId());

        FetchBatch second = sequence.nextBatch(2);
        assertEquals(List.of("c"), second.records().stream().map(AuditRecord::id).toList());
        second.records().forEach(fetcher::advance);

        server.takeRequest();
        RecordedRequest next = server.takeRequest();
        assertEquals("b", objectMapper.readTree(next.getBody().readUtf8()).path("search_after").get(0).asText());
        assertEquals("c", cursors.current().lastId());
    }
}
