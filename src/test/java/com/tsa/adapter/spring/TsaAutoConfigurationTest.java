package com.tsa.adapter.spring;

import com.tsa.condition.ConditionCompiler;
import com.tsa.config.TsaConfig;
import com.tsa.core.CondCollectionEvaluator;
import com.tsa.exception.IdentifierException;
import com.tsa.report.ReportWriter;
import com.tsa.store.ObservationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for TsaAutoConfiguration.
 */
class TsaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TsaAutoConfiguration.class)
            .withPropertyValues(
                    "tsa.config-path=classpath:tsa-test.yaml",
                    "tsa.observations-path=classpath:observations-test.json");

    @Test
    @DisplayName("Beans are created from configured files")
    void createsBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TsaConfig.class);
            assertThat(context).hasSingleBean(ObservationStore.class);
            assertThat(context).hasSingleBean(ConditionCompiler.class);
            assertThat(context).hasSingleBean(CondCollectionEvaluator.class);
            assertThat(context).hasSingleBean(ReportWriter.class);
            assertThat(context).hasBean("tsaEvaluationExecutor");

            assertEquals("test-analysis", context.getBean(TsaConfig.class).name());
            assertEquals(27, context.getBean(ObservationStore.class).resolveSensorId("kitka3_luku"));
        });
    }

    @Test
    @DisplayName("Compiler rejects reserved names from config and store")
    void compilerUsesReservedNames() {
        contextRunner.run(context -> {
            ConditionCompiler compiler = context.getBean(ConditionCompiler.class);
            assertThrows(IdentifierException.class, () -> compiler.compile("obs_main", "c1", "s1#x > 1"));
            assertThrows(IdentifierException.class, () -> compiler.compile("statobs", "c1", "s1#x > 1"));
        });
    }

    @Test
    @DisplayName("Executor is shut down with the context")
    void shutsDownExecutor() {
        ExecutorService[] executor = new ExecutorService[1];
        contextRunner.run(context -> executor[0] = context.getBean("tsaEvaluationExecutor", ExecutorService.class));

        assertThat(executor[0].isShutdown()).isTrue();
    }

    @Test
    @DisplayName("Nothing is created when disabled")
    void disabled() {
        contextRunner.withPropertyValues("tsa.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(TsaConfig.class));
    }

    @Test
    @DisplayName("Empty store is used when no observation file is set")
    void emptyStore() {
        new ApplicationContextRunner()
                .withUserConfiguration(TsaAutoConfiguration.class)
                .withPropertyValues("tsa.config-path=classpath:tsa-test.yaml")
                .run(context -> assertThat(context).hasSingleBean(ObservationStore.class));
    }
}
