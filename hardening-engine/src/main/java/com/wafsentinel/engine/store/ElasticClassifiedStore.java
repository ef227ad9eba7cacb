package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wafsentinel.engine.record.TimeBucket;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ClassifiedStore} over the {@code classified_*} indices.
 *
 * <p>
 * The document id is the classification key ({@code recordId:modelVersion}) and
 * writes use {@code _create}, so replaying a record under the same model is a
 * no-op. The keyword mapping the scan sorts on comes from the index template,
 * which is put before the first write.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class ElasticClassifiedStore implements ClassifiedStore {

    private final ElasticsearchGateway gateway;
    private final ObjectMapper objectMapper;
    private final String indexPrefix;
    private final IndexTemplateInstaller templates;

    public ElasticClassifiedStore(ElasticsearchGateway gateway, ObjectMapper objectMapper, String indexPrefix,
            IndexTemplateInstaller templates) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.indexPrefix = indexPrefix;
        this.templates = templates;
    }

    @Override
    public WriteOutcome createIfAbsent(TimeBucket bucket, ClassifiedRecord document) {
        templates.ensureInstalled();
        boolean created = gateway.create(bucket.indexName(indexPrefix), document.documentId(),
                ClassifiedDocuments.encode(document));
        return created ? WriteOutcome.CREATED : WriteOutcome.ALREADY_PRESENT;
    }

    @Override
    public ClassifiedPage scan(TimeBucket bucket, String afterKey, int size) {
        ObjectNode query = objectMapper.createObjectNode();
        query.put("size", size);
        query.putArray("sort").addObject().put(ClassifiedDocuments.KEY_FIELD, "asc");
        query.putObject("query").putObject("match_all");
        if (afterKey != null) {
            query.putArray("search_after").add(afterKey);
        }

        JsonNode response = gateway.search(bucket.indexName(indexPrefix), query);
        List<ClassifiedRecord> records = new ArrayList<>();
        String lastKey = afterKey;
        int hitCount = 0;
        for (JsonNode hit : response.path("hits").path("hits")) {
            hitCount++;
            JsonNode sort = hit.path("sort");
            lastKey = sort.isArray() && !sort.isEmpty()
                    ? sort.get(0).asText()
                    : hit.path("_source").path(ClassifiedDocuments.KEY_FIELD).asText(hit.path("_id").asText());
            ClassifiedDocuments.decode(bucket, hit.path("_id").asText(), hit.path("_source"))
                    .ifPresent(records::add);
        }
        return new ClassifiedPage(records, lastKey, hitCount);
    }
}
