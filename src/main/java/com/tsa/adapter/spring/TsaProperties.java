package com.tsa.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the condition analyzer.
 */
@ConfigurationProperties(prefix = "tsa")
public class TsaProperties {

    /**
     * Whether the analyzer is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the analysis configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:tsa-analysis.yaml";

    /**
     * Path to the observation JSON file. Empty for an empty store.
     * Supports classpath: prefix for classpath resources.
     */
    private String observationsPath;

    /**
     * Where to write the JSON report. Empty to skip the report.
     */
    private String outputPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getObservationsPath() {
        return observationsPath;
    }

    public void setObservationsPath(String observationsPath) {
        this.observationsPath = observationsPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }
}
