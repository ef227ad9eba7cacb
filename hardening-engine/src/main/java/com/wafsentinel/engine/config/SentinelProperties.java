package com.wafsentinel.engine.config;

import com.wafsentinel.engine.record.BucketGranularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the engine, bound from {@code waf-sentinel.*}.
 *
 * <p>
 * Every threshold, window and path has a default suitable for a single
 * ModSecurity host; credentials come from the environment.
 * </p>
 *
 * @author WAF Sentinel Team
 */
@Validated
@ConfigurationProperties(prefix = "waf-sentinel")
public class SentinelProperties {

    @Valid
    private Elasticsearch elasticsearch = new Elasticsearch();
    @Valid
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Model model = new Model();
    @Valid
    private Hardening hardening = new Hardening();
    @Valid
    private Notification notification = new Notification();
    @Min(1)
    private int historySize = 100;

    public Elasticsearch getElasticsearch() {
        return elasticsearch;
    }

    public void setElasticsearch(Elasticsearch elasticsearch) {
        this.elasticsearch = elasticsearch;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model;
    }

    public Hardening getHardening() {
        return hardening;
    }

    public void setHardening(Hardening hardening) {
        this.hardening = hardening;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public static class Elasticsearch {
        @NotBlank
        private String url = "http://localhost:9200";
        private String apiKey;
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @NotBlank
        private String unclassifiedPrefix = "unclassified_";
        @NotBlank
        private String classifiedPrefix = "classified_";
        /** Keyword field the unclassified scan sorts on; {@code transaction_id.keyword} for dynamically mapped indices. */
        @NotBlank
        private String idField = "transaction_id";
        @Min(1)
        private int pageSize = 1000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getUnclassifiedPrefix() {
            return unclassifiedPrefix;
        }

        public void setUnclassifiedPrefix(String unclassifiedPrefix) {
            this.unclassifiedPrefix = unclassifiedPrefix;
        }

        public String getClassifiedPrefix() {
            return classifiedPrefix;
        }

        public void setClassifiedPrefix(String classifiedPrefix) {
            this.classifiedPrefix = classifiedPrefix;
        }

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Pipeline {
        @NotNull
        private BucketGranularity granularity = BucketGranularity.HOURLY;
        @NotNull
        private Duration settleDelay = Duration.ofMinutes(5);
        @Min(1)
        private int batchSize = 500;
        @Min(1)
        private int concurrency = 4;
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);
        @NotNull
        private Duration initialLookback = Duration.ofHours(24);
        @NotBlank
        private String cursorFile = "state/cursor.json";

        public BucketGranularity getGranularity() {
            return granularity;
        }

        public void setGranularity(BucketGranularity granularity) {
            this.granularity = granularity;
        }

        public Duration getSettleDelay() {
            return settleDelay;
        }

        public void setSettleDelay(Duration settleDelay) {
            this.settleDelay = settleDelay;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getInitialLookback() {
            return initialLookback;
        }

        public void setInitialLookback(Duration initialLookback) {
            this.initialLookback = initialLookback;
        }

        public String getCursorFile() {
            return cursorFile;
        }

        public void setCursorFile(String cursorFile) {
            this.cursorFile = cursorFile;
        }
    }

    public static class Model {
        @NotBlank
        private String path = "models/waf-model.json";
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.5;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }
    }

    public static class Hardening {
        @NotNull
        private Duration lookback = Duration.ofHours(24);
        @Min(1)
        private int minSample = 20;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double promotionThreshold = 0.9;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double demotionThreshold = 0.7;
        @Min(1)
        private int confirmationCycles = 2;
        @Min(1)
        private int maxActivationsPerCycle = 3;
        @Min(1)
        private int minParanoiaLevel = 3;
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double attackPercentageThreshold = 50.0;
        private List<String> crsRuleFiles = new ArrayList<>();
        @NotBlank
        private String ruleIdPrefix = "999";
        @NotBlank
        private String customRulesFile = "rules/custom_rules.conf";
        @NotBlank
        private String exclusionsFile = "rules/rule-exclusions.conf";
        @NotBlank
        private String stateFile = "state/rule-set.json";
        @NotBlank
        private String journalFile = "state/rule-set-journal.jsonl";
        @NotBlank
        private String signingKey;

        public Duration getLookback() {
            return lookback;
        }

        public void setLookback(Duration lookback) {
            this.lookback = lookback;
        }

        public int getMinSample() {
            return minSample;
        }

        public void setMinSample(int minSample) {
            this.minSample = minSample;
        }

        public double getPromotionThreshold() {
            return promotionThreshold;
        }

        public void setPromotionThreshold(double promotionThreshold) {
            this.promotionThreshold = promotionThreshold;
        }

        public double getDemotionThreshold() {
            return demotionThreshold;
        }

        public void setDemotionThreshold(double demotionThreshold) {
            this.demotionThreshold = demotionThreshold;
        }

        public int getConfirmationCycles() {
            return confirmationCycles;
        }

        public void setConfirmationCycles(int confirmationCycles) {
            this.confirmationCycles = confirmationCycles;
        }

        public int getMaxActivationsPerCycle() {
            return maxActivationsPerCycle;
        }

        public void setMaxActivationsPerCycle(int maxActivationsPerCycle) {
            this.maxActivationsPerCycle = maxActivationsPerCycle;
        }

        public int getMinParanoiaLevel() {
            return minParanoiaLevel;
        }

        public void setMinParanoiaLevel(int minParanoiaLevel) {
            this.minParanoiaLevel = minParanoiaLevel;
        }

        public double getAttackPercentageThreshold() {
            return attackPercentageThreshold;
        }

        public void setAttackPercentageThreshold(double attackPercentageThreshold) {
            this.attackPercentageThreshold = attackPercentageThreshold;
        }

        public List<String> getCrsRuleFiles() {
            return crsRuleFiles;
        }

        public void setCrsRuleFiles(List<String> crsRuleFiles) {
            this.crsRuleFiles = crsRuleFiles;
        }

        public String getRuleIdPrefix() {
            return ruleIdPrefix;
        }

        public void setRuleIdPrefix(String ruleIdPrefix) {
            this.ruleIdPrefix = ruleIdPrefix;
        }

        public String getCustomRulesFile() {
            return customRulesFile;
        }

        public void setCustomRulesFile(String customRulesFile) {
            this.customRulesFile = customRulesFile;
        }

        public String getExclusionsFile() {
            return exclusionsFile;
        }

        public void setExclusionsFile(String exclusionsFile) {
            this.exclusionsFile = exclusionsFile;
        }

        public String getStateFile() {
            return stateFile;
        }

        public void setStateFile(String stateFile) {
            this.stateFile = stateFile;
        }

        public String getJournalFile() {
            return journalFile;
        }

        public void setJournalFile(String journalFile) {
            this.journalFile = journalFile;
        }

        public String getSigningKey() {
            return signingKey;
        }

        public void setSigningKey(String signingKey) {
            this.signingKey = signingKey;
        }
    }

    public static class Notification {
        @Valid
        private Mail mail = new Mail();
        @Valid
        private Elastic elastic = new Elastic();

        public Mail getMail() {
            return mail;
        }

        public void setMail(Mail mail) {
            this.mail = mail;
        }

        public Elastic getElastic() {
            return elastic;
        }

        public void setElastic(Elastic elastic) {
            this.elastic = elastic;
        }
    }

    public static class Mail {
        private boolean enabled;
        @NotBlank
        private String from = "waf-sentinel@localhost";
        private List<String> recipients = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public List<String> getRecipients() {
            return recipients;
        }

        public void setRecipients(List<String> recipients) {
            this.recipients = recipients;
        }
    }

    public static class Elastic {
        private boolean enabled = true;
        @NotBlank
        private String index = "waf-sentinel-alerts";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIndex() {
            return index;
        }

        public void setIndex(String index) {
            this.index = index;
        }
    }
}
