package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Installs the index templates that map the paging keys as {@code keyword}.
 *
 * <p>
 * Both scans sort and page with {@code search_after} on a string key, which
 * Elasticsearch only allows on keyword fields. Without a template, dynamic
 * mapping would turn {@code classification_key} into {@code text} on the first
 * {@code _create} and every later scan would be rejected. Templates only apply
 * to indices created after them; the unclassified indices are created upstream,
 * so for indices that already exist the id field must point at a keyword field
 * (for instance {@code transaction_id.keyword}).
 * </p>
 *
 * <p>
 * Installation is attempted at startup and, until it succeeds, again before
 * each classified write. A transient failure is rethrown so the caller's retry
 * applies; a refusal (missing privilege, invalid template) is logged once and
 * not repeated.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class IndexTemplateInstaller {

    private static final Logger log = LoggerFactory.getLogger(IndexTemplateInstaller.class);

    static final String CLASSIFIED_TEMPLATE = "elasticsearch/classified-index-template.json";
    static final String UNCLASSIFIED_TEMPLATE = "elasticsearch/unclassified-index-template.json";

    private final ElasticsearchGateway gateway;
    private final ObjectMapper objectMapper;
    private final String classifiedPrefix;
    private final String unclassifiedPrefix;
    private final String idField;

    private final AtomicBoolean installed = new AtomicBoolean();

    public IndexTemplateInstaller(ElasticsearchGateway gateway, ObjectMapper objectMapper, String classifiedPrefix,
            String unclassifiedPrefix, String idField) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.classifiedPrefix = classifiedPrefix;
        this.unclassifiedPrefix = unclassifiedPrefix;
        this.idField = idField;
    }

    @PostConstruct
    public void install() {
        try {
            ensureInstalled();
        } catch (TransientIOException e) {
            log.warn("Index templates not installed yet, retrying before the first classified write: {}",
                    e.getMessage());
        }
    }

    /**
     * Put both templates unless that already happened.
     *
     * @throws TransientIOException if Elasticsearch cannot be reached
     */
    public void ensureInstalled() {
        if (installed.get()) {
            return;
        }
        synchronized (this) {
            if (installed.get()) {
                return;
            }
            try {
                gateway.putIndexTemplate(templateName(classifiedPrefix),
                        template(CLASSIFIED_TEMPLATE, classifiedPrefix, ClassifiedDocuments.KEY_FIELD));
                gateway.putIndexTemplate(templateName(unclassifiedPrefix),
                        template(UNCLASSIFIED_TEMPLATE, unclassifiedPrefix, idField));
                log.info("Index templates installed for {}* and {}*", classifiedPrefix, unclassifiedPrefix);
            } catch (StoreRequestException e) {
                log.error("Elasticsearch refused the index templates (HTTP {}); scans of new indices may be "
                        + "rejected until keyword mappings exist: {}", e.getStatus(), e.getMessage());
            }
            installed.set(true);
        }
    }

    public boolean isInstalled() {
        return installed.get();
    }

    ObjectNode template(String resource, String prefix, String keyField) {
        ObjectNode template;
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            template = (ObjectNode) objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read index template " + resource, e);
        }
        template.putArray("index_patterns").add(prefix + "*");
        // a sub-field such as transaction_id.keyword is mapped by the multi-field itself
        if (keyField.indexOf('.') < 0) {
            JsonNode properties = template.path("template").path("mappings").path("properties");
            if (properties.isObject()) {
                ((ObjectNode) properties).putObject(keyField).put("type", "keyword");
            }
        }
        return template;
    }

    static String templateName(String prefix) {
        String name = prefix.endsWith("_") || prefix.endsWith("-") ? prefix.substring(0, prefix.length() - 1) : prefix;
        return "waf-sentinel-" + name;
    }
}
