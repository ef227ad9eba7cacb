package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.record.AuditRecordParser;
import com.wafsentinel.engine.record.TimeBucket;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AuditLogStore} over the {@code unclassified_*} indices, paged with
 * {@code search_after} on the keyword id field.
 *
 * <p>
 * A record's id is the sort value Elasticsearch returned for it, so the
 * cursor, the next {@code search_after} and the index order always agree even
 * when the source id is malformed. Documents with an empty id cannot be
 * ordered after one another and are left out of the scan.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class ElasticAuditLogStore implements AuditLogStore {

    private final ElasticsearchGateway gateway;
    private final ObjectMapper objectMapper;
    private final String indexPrefix;
    private final String idField;

    public ElasticAuditLogStore(ElasticsearchGateway gateway, ObjectMapper objectMapper, String indexPrefix,
            String idField) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.indexPrefix = indexPrefix;
        this.idField = idField;
    }

    @Override
    public List<AuditRecord> search(TimeBucket bucket, String afterId, int size) {
        ObjectNode query = objectMapper.createObjectNode();
        query.put("size", size);
        query.putArray("sort").addObject().put(idField, "asc");
        ObjectNode bool = query.putObject("query").putObject("bool");
        bool.putArray("filter").addObject().putObject("exists").put("field", idField);
        bool.putArray("must_not").addObject().putObject("term").put(idField, "");
        if (afterId != null) {
            query.putArray("search_after").add(afterId);
        }

        JsonNode response = gateway.search(bucket.indexName(indexPrefix), query);
        List<AuditRecord> records = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            AuditRecord record = AuditRecordParser.parse(bucket, hit.path("_id").asText(), hit.path("_source"));
            JsonNode sort = hit.path("sort");
            if (sort.isArray() && !sort.isEmpty() && sort.get(0).isValueNode() && !sort.get(0).isNull()) {
                String key = sort.get(0).asText();
                if (!key.equals(record.id())) {
                    record = record.withId(key);
                }
            }
            records.add(record);
        }
        return records;
    }
}
