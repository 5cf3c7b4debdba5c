package com.di.importgate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed binding for all {@code importgate.*} properties.
 *
 * <p>Run-level values ({@code run.*}) are usually passed on the command line,
 * e.g. {@code --importgate.run.dataset=wb_gdp --importgate.run.mapping-file=in/gdp.tmcf}.
 *
 * <pre>
 * importgate:
 *   run:
 *     dataset:       wb_gdp
 *     mapping-file:  input/gdp.tmcf
 *     data-table:    input/gdp.csv
 *     rules:         check_min_value,check_unit_consistency
 *   output:
 *     base-dir: ./output
 *   row-volume:
 *     threshold: 1000
 *   review:
 *     advisor:
 *       enabled:       true
 *       type:          chat
 *       advisory-mode: true
 *   generation:
 *     jar-path:        bin/datacommons-import-tool.jar
 *     resolution-mode: LOCAL
 *   validation:
 *     command:     python -m tools.import_validation.runner
 *     working-dir: ../data
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "importgate")
public class ImportGateProperties {

    @Valid
    @NestedConfigurationProperty
    private RunConfig run = new RunConfig();

    @Valid
    @NestedConfigurationProperty
    private OutputConfig output = new OutputConfig();

    @Valid
    @NestedConfigurationProperty
    private RulesConfig rules = new RulesConfig();

    @Valid
    @NestedConfigurationProperty
    private QualityConfig quality = new QualityConfig();

    @Valid
    @NestedConfigurationProperty
    private RowVolumeConfig rowVolume = new RowVolumeConfig();

    @Valid
    @NestedConfigurationProperty
    private ReviewConfig review = new ReviewConfig();

    @Valid
    @NestedConfigurationProperty
    private GenerationConfig generation = new GenerationConfig();

    @Valid
    @NestedConfigurationProperty
    private ValidationConfig validation = new ValidationConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class RunConfig {
        /** When false, the application starts without running a pipeline. */
        private boolean enabled = true;
        private String dataset;
        /** Blank means a fresh id is generated per run. */
        private String runId;
        private String mappingFile;
        private String dataTable;
        private List<String> metadataFiles = new ArrayList<>();
        private String differFile;
        /** Comma-separated rule ids to keep. Mutually exclusive with {@link #skipRules}. */
        private String rules;
        /** Comma-separated rule ids to drop. */
        private String skipRules;
    }

    @Data
    public static class OutputConfig {
        @NotBlank
        private String baseDir = "./output";
    }

    @Data
    public static class RulesConfig {
        @NotBlank
        private String configFile = "classpath:validation_configs/new_import_config.json";
        private String warnOnlyFile = "classpath:validation_configs/warn_only_rules.json";
    }

    @Data
    public static class QualityConfig {
        @NotBlank
        private String measurementColumn = "value";
        /** When false, wholly empty columns are reported as advisory findings only. */
        private boolean emptyColumnBlocking = true;
    }

    @Data
    public static class RowVolumeConfig {
        @Min(0)
        private long threshold = 1000;
        @NotBlank
        private String ruleId = "check_csv_row_count";
    }

    @Data
    public static class ReviewConfig {
        @Valid
        @NestedConfigurationProperty
        private AdvisorConfig advisor = new AdvisorConfig();
    }

    @Data
    public static class AdvisorConfig {
        private boolean enabled = false;
        /** {@code process} or {@code chat}. */
        private String type = "process";
        /** Downgrades every advisor finding to advisory; reviewer crashes still block. */
        private boolean advisoryMode = false;
        /** Command line for the process advisor. */
        private String command;
        @Min(0)
        private int timeoutSeconds = 300;
        @Min(1)
        private int maxFindings = 25;
    }

    @Data
    public static class GenerationConfig {
        /** Command prefix; {@code {jar}} is replaced with the resolved tool jar. */
        @NotBlank
        private String command = "java -jar {jar}";
        private String jarPath;
        private String binDir = "bin";
        private String jarUrl = "https://github.com/datacommonsorg/import/releases/download/v0.3.0/datacommons-import-tool-0.3.0-jar-with-dependencies.jar";
        @Min(1)
        private int downloadAttempts = 3;
        @NotBlank
        private String resolutionMode = "LOCAL";
        private boolean existenceChecks = true;
        @Min(0)
        private int timeoutSeconds = 1800;
    }

    @Data
    public static class ValidationConfig {
        @NotBlank
        private String command = "python3 -m tools.import_validation.runner";
        private String workingDir;
        @Min(0)
        private int timeoutSeconds = 900;
        @NotBlank
        private String emptyDifferHeader = "variableMeasured,added,deleted,modified";
    }
}
