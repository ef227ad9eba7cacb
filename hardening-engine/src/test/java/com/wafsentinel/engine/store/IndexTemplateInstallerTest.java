package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.classifier.Label;
import com.wafsentinel.engine.record.AuditRecord;
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
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IndexTemplateInstallerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ElasticsearchGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        WebClient webClient = WebClient.builder().baseUrl(server.url("/").toString()).build();
        gateway = new ElasticsearchGateway(webClient, objectMapper, Duration.ofSeconds(5), new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse().setResponseCode(status).setHeader("Content-Type", "application/json").setBody(body);
    }

    private IndexTemplateInstaller installer(String idField) {
        return new IndexTemplateInstaller(gateway, objectMapper, "classified_", "unclassified_", idField);
    }

    @Test
    void shouldMapPagingKeysAsKeywordsForBothIndexFamilies() throws Exception {
        server.enqueue(json(200, "{\"acknowledged\":true}"));
        server.enqueue(json(200, "{\"acknowledged\":true}"));

        installer("txn").install();

        RecordedRequest classified = server.takeRequest();
        assertEquals("/_index_template/waf-sentinel-classified", classified.getPath());
        JsonNode classifiedBody = objectMapper.readTree(classified.getBody().readUtf8());
        assertEquals("classified_*", classifiedBody.path("index_patterns").get(0).asText());
        JsonNode properties = classifiedBody.path("template").path("mappings").path("properties");
        assertEquals("keyword", properties.path(ClassifiedDocuments.KEY_FIELD).path("type").asText());
        assertEquals("keyword", properties.path("record_id").path("type").asText());

        RecordedRequest unclassified = server.takeRequest();
        assertEquals("/_index_template/waf-sentinel-unclassified", unclassified.getPath());
        JsonNode unclassifiedBody = objectMapper.readTree(unclassified.getBody().readUtf8());
        assertEquals("unclassified_*", unclassifiedBody.path("index_patterns").get(0).asText());
        assertEquals("keyword",
                unclassifiedBody.path("template").path("mappings").path("properties").path("txn").path("type").asText());
    }

    @Test
    void shouldLeaveMultiFieldIdUnmapped() {
        JsonNode template = installer("transaction_id.keyword")
                .template(IndexTemplateInstaller.UNCLASSIFIED_TEMPLATE, "unclassified_", "transaction_id.keyword");

        JsonNode properties = template.path("template").path("mappings").path("properties");
        assertTrue(properties.path("transaction_id.keyword").isMissingNode());
        assertEquals("keyword", properties.path("transaction_id").path("type").asText());
    }

    @Test
    void shouldInstallBeforeFirstClassifiedWriteAfterStartupOutage() throws Exception {
        server.enqueue(json(503, "{\"error\":\"unavailable\"}"));
        IndexTemplateInstaller templates = installer("transaction_id");
        templates.install();
        assertFalse(templates.isInstalled());

        server.enqueue(json(200, "{\"acknowledged\":true}"));
        server.enqueue(json(200, "{\"acknowledged\":true}"));
        server.enqueue(json(201, "{\"result\":\"created\"}"));
        server.enqueue(json(201, "{\"result\":\"created\"}"));
        ElasticClassifiedStore store = new ElasticClassifiedStore(gateway, objectMapper, "classified_", templates);
        AuditRecord record = Records.record("tx-1", "942100");
        ClassificationResult result = Records.verdict(record, Label.MALICIOUS, 0.9, "lr-1", Records.BUCKET_START);

        assertEquals(WriteOutcome.CREATED, store.createIfAbsent(record.bucket(), new ClassifiedRecord(record, result)));
        assertEquals(WriteOutcome.CREATED, store.createIfAbsent(record.bucket(), new ClassifiedRecord(record, result)));

        assertTrue(templates.isInstalled());
        server.takeRequest();
        assertTrue(server.takeRequest().getPath().startsWith("/_index_template/"));
        assertTrue(server.takeRequest().getPath().startsWith("/_index_template/"));
        assertTrue(server.takeRequest().getPath().contains("/_create/"));
        assertTrue(server.takeRequest().getPath().contains("/_create/"));
        assertEquals(5, server.getRequestCount());
    }

    @Test
    void shouldNotRetryRefusedTemplate() {
        server.enqueue(json(403, "{\"error\":\"security_exception\"}"));
        IndexTemplateInstaller templates = installer("transaction_id");

        templates.ensureInstalled();
        templates.ensureInstalled();

        assertTrue(templates.isInstalled());
        assertEquals(1, server.getRequestCount());
    }
}
