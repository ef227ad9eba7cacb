package com.wafsentinel.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wafsentinel.engine.alert.ElasticNotificationChannel;
import com.wafsentinel.engine.alert.MailNotificationChannel;
import com.wafsentinel.engine.alert.NotificationChannel;
import com.wafsentinel.engine.alert.Notifier;
import com.wafsentinel.engine.classifier.ModelArtifactLoader;
import com.wafsentinel.engine.classifier.TrafficClassifier;
import com.wafsentinel.engine.feature.FeatureExtractor;
import com.wafsentinel.engine.hardening.CrsRuleCatalog;
import com.wafsentinel.engine.hardening.DiffJournal;
import com.wafsentinel.engine.hardening.DiffSigner;
import com.wafsentinel.engine.hardening.FileRuleSetRepository;
import com.wafsentinel.engine.hardening.HardeningPolicy;
import com.wafsentinel.engine.hardening.ModSecurityRuleRenderer;
import com.wafsentinel.engine.hardening.RuleHardeningEngine;
import com.wafsentinel.engine.hardening.RuleSetRepository;
import com.wafsentinel.engine.ingest.FileCursorRepository;
import com.wafsentinel.engine.ingest.LogFetcher;
import com.wafsentinel.engine.ingest.ResultWriter;
import com.wafsentinel.engine.orchestration.ClassificationRun;
import com.wafsentinel.engine.orchestration.HardeningCycle;
import com.wafsentinel.engine.orchestration.PipelineSettings;
import com.wafsentinel.engine.orchestration.RunHistory;
import com.wafsentinel.engine.store.ClassifiedStore;
import com.wafsentinel.engine.store.ElasticAuditLogStore;
import com.wafsentinel.engine.store.ElasticClassifiedStore;
import com.wafsentinel.engine.store.ElasticsearchGateway;
import com.wafsentinel.engine.store.IndexTemplateInstaller;
import com.wafsentinel.engine.trend.TrendAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the pipeline from {@link SentinelProperties}.
 *
 * @author WAF Sentinel Team
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ElasticsearchGateway elasticsearchGateway(SentinelProperties properties, ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        SentinelProperties.Elasticsearch es = properties.getElasticsearch();
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(es.getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (es.getApiKey() != null && !es.getApiKey().isEmpty()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + es.getApiKey());
        }
        return new ElasticsearchGateway(builder.build(), objectMapper, es.getTimeout(), meterRegistry);
    }

    @Bean
    public IndexTemplateInstaller indexTemplateInstaller(ElasticsearchGateway gateway, ObjectMapper objectMapper,
            SentinelProperties properties) {
        SentinelProperties.Elasticsearch es = properties.getElasticsearch();
        return new IndexTemplateInstaller(gateway, objectMapper, es.getClassifiedPrefix(), es.getUnclassifiedPrefix(),
                es.getIdField());
    }

    @Bean
    public ClassifiedStore classifiedStore(ElasticsearchGateway gateway, ObjectMapper objectMapper,
            SentinelProperties properties, IndexTemplateInstaller indexTemplateInstaller) {
        return new ElasticClassifiedStore(gateway, objectMapper, properties.getElasticsearch().getClassifiedPrefix(),
                indexTemplateInstaller);
    }

    @Bean
    public LogFetcher logFetcher(ElasticsearchGateway gateway, ObjectMapper objectMapper,
            SentinelProperties properties, Clock clock) {
        SentinelProperties.Elasticsearch es = properties.getElasticsearch();
        SentinelProperties.Pipeline pipeline = properties.getPipeline();
        return new LogFetcher(
                new ElasticAuditLogStore(gateway, objectMapper, es.getUnclassifiedPrefix(), es.getIdField()),
                new FileCursorRepository(Path.of(pipeline.getCursorFile()), objectMapper),
                pipeline.getGranularity(),
                pipeline.getSettleDelay(),
                clock);
    }

    @Bean
    public TrafficClassifier trafficClassifier(SentinelProperties properties, ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        SentinelProperties.Model model = properties.getModel();
        return new TrafficClassifier(
                new ModelArtifactLoader(objectMapper).load(Path.of(model.getPath())),
                model.getThreshold(),
                meterRegistry);
    }

    @Bean
    public ResultWriter resultWriter(ClassifiedStore classifiedStore, MeterRegistry meterRegistry) {
        return new ResultWriter(classifiedStore, meterRegistry);
    }

    @Bean
    public Notifier notifier(SentinelProperties properties, ObjectProvider<JavaMailSender> mailSender,
            ElasticsearchGateway gateway, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        List<NotificationChannel> channels = new ArrayList<>();
        SentinelProperties.Notification notification = properties.getNotification();
        if (notification.getMail().isEnabled()) {
            JavaMailSender sender = mailSender.getIfAvailable();
            if (sender == null) {
                log.warn("Mail notifications enabled but no mail sender is configured (spring.mail.host)");
            } else {
                channels.add(new MailNotificationChannel(sender, notification.getMail().getFrom(),
                        notification.getMail().getRecipients()));
            }
        }
        if (notification.getElastic().isEnabled()) {
            channels.add(new ElasticNotificationChannel(gateway, objectMapper, notification.getElastic().getIndex()));
        }
        return new Notifier(channels, meterRegistry);
    }

    @Bean
    public RunHistory runHistory(SentinelProperties properties) {
        return new RunHistory(properties.getHistorySize());
    }

    @Bean
    public ClassificationRun classificationRun(LogFetcher logFetcher, FeatureExtractor featureExtractor,
            TrafficClassifier trafficClassifier, ResultWriter resultWriter, Notifier notifier,
            RunHistory runHistory, SentinelProperties properties, Clock clock, MeterRegistry meterRegistry) {
        SentinelProperties.Pipeline pipeline = properties.getPipeline();
        PipelineSettings settings = new PipelineSettings(pipeline.getBatchSize(), pipeline.getConcurrency(),
                pipeline.getMaxAttempts(), pipeline.getInitialBackoff(), pipeline.getInitialLookback());
        return new ClassificationRun(logFetcher, featureExtractor, trafficClassifier, resultWriter, notifier,
                runHistory, settings, clock, meterRegistry);
    }

    @Bean
    public CrsRuleCatalog crsRuleCatalog(SentinelProperties properties) {
        List<Path> files = properties.getHardening().getCrsRuleFiles().stream().map(Path::of).toList();
        if (files.isEmpty()) {
            log.warn("No CRS rule files configured; no rule can be promoted");
        }
        return CrsRuleCatalog.load(files);
    }

    @Bean
    public RuleSetRepository ruleSetRepository(SentinelProperties properties, CrsRuleCatalog catalog,
            ObjectMapper objectMapper) {
        SentinelProperties.Hardening hardening = properties.getHardening();
        return new FileRuleSetRepository(
                Path.of(hardening.getStateFile()),
                Path.of(hardening.getCustomRulesFile()),
                Path.of(hardening.getExclusionsFile()),
                new ModSecurityRuleRenderer(catalog, hardening.getRuleIdPrefix()),
                objectMapper);
    }

    @Bean
    public DiffSigner diffSigner(SentinelProperties properties) {
        return new DiffSigner(properties.getHardening().getSigningKey());
    }

    @Bean
    public DiffJournal diffJournal(SentinelProperties properties, ObjectMapper objectMapper, DiffSigner signer) {
        return new DiffJournal(Path.of(properties.getHardening().getJournalFile()), objectMapper, signer);
    }

    @Bean
    public HardeningCycle hardeningCycle(ClassifiedStore classifiedStore, CrsRuleCatalog catalog,
            RuleSetRepository repository, DiffJournal journal, DiffSigner signer, Notifier notifier,
            RunHistory runHistory, SentinelProperties properties, Clock clock, MeterRegistry meterRegistry) {
        SentinelProperties.Hardening hardening = properties.getHardening();
        HardeningPolicy policy = new HardeningPolicy(
                hardening.getMinSample(),
                hardening.getPromotionThreshold(),
                hardening.getDemotionThreshold(),
                hardening.getConfirmationCycles(),
                hardening.getMaxActivationsPerCycle(),
                hardening.getMinParanoiaLevel());
        TrendAggregator aggregator = new TrendAggregator(classifiedStore, properties.getPipeline().getGranularity(),
                properties.getElasticsearch().getPageSize(), clock, meterRegistry);
        return new HardeningCycle(aggregator, new RuleHardeningEngine(catalog::contains), repository, journal,
                signer, notifier, runHistory, policy, hardening.getLookback(),
                hardening.getAttackPercentageThreshold(), clock, meterRegistry);
    }
}
