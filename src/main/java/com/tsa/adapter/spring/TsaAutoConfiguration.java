package com.tsa.adapter.spring;

import com.tsa.condition.ConditionCompiler;
import com.tsa.config.ConfigLoader;
import com.tsa.config.TsaConfig;
import com.tsa.core.CondCollectionEvaluator;
import com.tsa.core.ConditionAnalyzer;
import com.tsa.report.ReportWriter;
import com.tsa.store.InMemoryObservationStore;
import com.tsa.store.ObservationLoader;
import com.tsa.store.ObservationStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration for the condition analyzer.
 */
@Configuration
@ConditionalOnProperty(prefix = "tsa", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TsaProperties.class)
public class TsaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TsaAutoConfiguration.class);

    private ExecutorService evaluationExecutor;

    @Bean
    @ConditionalOnMissingBean
    public TsaConfig tsaConfig(TsaProperties properties) {
        log.info("Loading analysis configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ObservationStore observationStore(TsaProperties properties) {
        String path = properties.getObservationsPath();
        if (path == null || path.isBlank()) {
            log.warn("No tsa.observations-path set, using an empty observation store");
            return new InMemoryObservationStore();
        }
        return ObservationLoader.load(path);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionCompiler conditionCompiler(TsaConfig config, ObservationStore store) {
        return new ConditionCompiler(
                config.parser().toPolicy(store.reservedIdentifiers()),
                config.parser().numericValuesOnly());
    }

    @Bean(name = "tsaEvaluationExecutor")
    @ConditionalOnMissingBean(name = "tsaEvaluationExecutor")
    public ExecutorService tsaEvaluationExecutor(TsaConfig config) {
        int threads = config.evaluation().threads();
        log.info("Creating evaluation executor with {} threads", threads);
        AtomicInteger counter = new AtomicInteger();
        this.evaluationExecutor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "tsa-eval-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        });
        return this.evaluationExecutor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionAnalyzer conditionAnalyzer(TsaConfig config, ObservationStore store) {
        return new ConditionAnalyzer(store, config.evaluation().gapTolerance());
    }

    @Bean
    @ConditionalOnMissingBean
    public CondCollectionEvaluator condCollectionEvaluator(ConditionAnalyzer analyzer,
                                                           ExecutorService tsaEvaluationExecutor) {
        return new CondCollectionEvaluator(analyzer, tsaEvaluationExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportWriter reportWriter() {
        return new ReportWriter();
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (evaluationExecutor != null && !evaluationExecutor.isShutdown()) {
            log.info("Shutting down evaluation executor");
            evaluationExecutor.shutdown();
            if (!evaluationExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Evaluation executor did not terminate in time, forcing shutdown");
                evaluationExecutor.shutdownNow();
            }
        }
    }
}
