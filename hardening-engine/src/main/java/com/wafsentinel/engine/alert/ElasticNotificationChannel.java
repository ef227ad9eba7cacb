package com.wafsentinel.engine.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wafsentinel.engine.SentinelException;
import com.wafsentinel.engine.store.ElasticsearchGateway;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Indexes notifications into a daily alert index ({@code <index>-yyyy.MM.dd})
 * so they can be searched and charted next to the classified traffic.
 *
 * @author WAF Sentinel Team
 */
public class ElasticNotificationChannel implements NotificationChannel {

    private static final DateTimeFormatter INDEX_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd")
            .withZone(ZoneOffset.UTC);

    private final ElasticsearchGateway gateway;
    private final ObjectMapper objectMapper;
    private final String indexName;

    public ElasticNotificationChannel(ElasticsearchGateway gateway, ObjectMapper objectMapper, String indexName) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.indexName = indexName;
    }

    @Override
    public String name() {
        return "elasticsearch";
    }

    @Override
    public void send(NotificationEvent event) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("@timestamp", event.timestamp().toString());
        document.put("alert_id", event.eventId());
        document.put("kind", event.kind().getDisplayName());
        document.put("severity", event.severity().name());
        document.put("subject", event.subject());
        document.put("body", event.body());
        document.set("details", objectMapper.valueToTree(event.details()));

        try {
            gateway.index(indexName + "-" + INDEX_DATE.format(event.timestamp()), document);
        } catch (SentinelException e) {
            throw new NotificationException("Elasticsearch delivery failed: " + e.getMessage(), e);
        }
    }
}
