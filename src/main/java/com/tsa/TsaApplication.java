package com.tsa;

import com.tsa.condition.ConditionCompiler;
import com.tsa.config.TsaConfig;
import com.tsa.core.Analysis;
import com.tsa.core.CollectionResult;
import com.tsa.core.CondCollectionEvaluator;
import com.tsa.core.ConditionResult;
import com.tsa.adapter.spring.TsaProperties;
import com.tsa.report.ReportWriter;
import com.tsa.spring.EnableTsa;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Batch runner: analyzes the configured collections and writes the report.
 */
@SpringBootApplication
@EnableTsa
public class TsaApplication {

    private static final Logger log = LoggerFactory.getLogger(TsaApplication.class);

    /**
     * Runs the analysis once and exits. Closing the context shuts down the
     * evaluation executor, whose threads would otherwise keep the JVM alive.
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TsaApplication.class, args)));
    }

    @Bean
    public CommandLineRunner analysisRunner(TsaConfig config,
                                            ConditionCompiler compiler,
                                            CondCollectionEvaluator evaluator,
                                            ReportWriter reportWriter,
                                            TsaProperties properties) {
        return args -> {
            log.info("=== Analysis {} started ===", config.name());

            Analysis analysis = Analysis.fromConfig(config, compiler);
            List<CollectionResult> results = analysis.run(evaluator);

            for (CollectionResult result : results) {
                log.info("{}: {}/{} conditions evaluated", result.getCollection().getTitle(),
                        result.size(), result.getCollection().size());
                for (ConditionResult conditionResult : result.getResults()) {
                    log.info("  {}", conditionResult);
                }
            }

            if (analysis.hasErrors()) {
                for (Map.Entry<String, List<String>> branch : analysis.errorTree().entrySet()) {
                    log.warn("{}:", branch.getKey());
                    branch.getValue().forEach(error -> log.warn("  {}", error));
                }
            }

            String outputPath = properties.getOutputPath();
            if (outputPath != null && !outputPath.isBlank()) {
                reportWriter.write(config.name(), results, Path.of(outputPath));
            }

            log.info("=== Analysis {} finished ===", config.name());
        };
    }
}
