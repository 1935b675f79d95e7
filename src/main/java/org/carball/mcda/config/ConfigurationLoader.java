package org.carball.mcda.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_CONSISTENCY_THRESHOLD = "MCDA_CONSISTENCY_THRESHOLD";
    static final String ENV_WEIGHT_TOLERANCE = "MCDA_WEIGHT_TOLERANCE";
    static final String ENV_MIN_ALTERNATIVES = "MCDA_MIN_ALTERNATIVES";
    static final String ENV_MAX_AHP_CRITERIA = "MCDA_MAX_AHP_CRITERIA";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads configuration using the hierarchy: overrides > env vars > defaults
     */
    public AnalysisThresholds loadConfiguration(String[] overrides) {
        log.debug("Loading configuration");

        AnalysisThresholds.AnalysisThresholdsBuilder builder = AnalysisThresholds.builder();

        applyEnvironmentVariables(builder);
        applyOverrides(builder, overrides);

        AnalysisThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public AnalysisThresholds loadProfile(String profileName) {
        try {
            AnalysisProfile profile = AnalysisProfile.fromName(profileName);
            AnalysisThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public AnalysisThresholds loadConfigurationWithProfile(String profileName, String[] overrides) {
        AnalysisThresholds.AnalysisThresholdsBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyOverrides(builder, overrides);

        AnalysisThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads a YAML threshold file. The file may name a profile to start from; its other keys
     * override that profile. Environment variables still take precedence over the file.
     * A missing or unreadable file falls back to the defaults.
     */
    public AnalysisThresholds loadFromFile(Path configPath) {
        if (configPath == null) {
            log.info("No threshold config path provided, using defaults");
            return loadConfiguration(new String[0]);
        }

        if (!Files.exists(configPath)) {
            log.warn("Threshold config file not found: {}, using defaults", configPath);
            return loadConfiguration(new String[0]);
        }

        ThresholdConfig fileConfig;
        try {
            fileConfig = yamlMapper.readValue(configPath.toFile(), ThresholdConfig.class);
        } catch (IOException e) {
            log.error("Failed to load threshold config from {}: {}, using defaults", configPath, e.getMessage());
            return loadConfiguration(new String[0]);
        }
        log.info("Loaded threshold configuration from: {}", configPath);

        AnalysisThresholds.AnalysisThresholdsBuilder builder = fileConfig.getProfile() != null
                ? loadProfile(fileConfig.getProfile()).toBuilder()
                : AnalysisThresholds.builder();
        fileConfig.applyTo(builder);
        applyEnvironmentVariables(builder);

        AnalysisThresholds thresholds = builder.build();
        thresholds.validate();
        return thresholds;
    }

    private void applyEnvironmentVariables(AnalysisThresholds.AnalysisThresholdsBuilder builder) {
        String value = environment.get(ENV_CONSISTENCY_THRESHOLD);
        if (value != null) {
            parseDouble(ENV_CONSISTENCY_THRESHOLD, value, builder::consistencyThreshold);
        }
        value = environment.get(ENV_WEIGHT_TOLERANCE);
        if (value != null) {
            parseDouble(ENV_WEIGHT_TOLERANCE, value, builder::weightSumTolerance);
        }
        value = environment.get(ENV_MIN_ALTERNATIVES);
        if (value != null) {
            parseInt(ENV_MIN_ALTERNATIVES, value, builder::minimumAlternatives);
        }
        value = environment.get(ENV_MAX_AHP_CRITERIA);
        if (value != null) {
            parseInt(ENV_MAX_AHP_CRITERIA, value, builder::maximumAhpCriteria);
        }
    }

    private void applyOverrides(AnalysisThresholds.AnalysisThresholdsBuilder builder, String[] overrides) {
        for (int i = 0; i < overrides.length - 1; i++) {
            String key = overrides[i];
            String value = overrides[i + 1];

            switch (key) {
                case "--thresholds.consistency":
                    parseDouble(key, value, builder::consistencyThreshold);
                    break;
                case "--thresholds.weight-tolerance":
                    parseDouble(key, value, builder::weightSumTolerance);
                    break;
                case "--thresholds.min-alternatives":
                    parseInt(key, value, builder::minimumAlternatives);
                    break;
                case "--thresholds.max-ahp-criteria":
                    parseInt(key, value, builder::maximumAhpCriteria);
                    break;
                case "--thresholds.sensitivity-variations":
                    parseVariations(key, value, builder);
                    break;
                case "--thresholds.monte-carlo-simulations":
                    parseInt(key, value, builder::monteCarloSimulations);
                    break;
                case "--thresholds.weight-uncertainty":
                    parseDouble(key, value, builder::weightUncertainty);
                    break;
                case "--thresholds.data-uncertainty":
                    parseDouble(key, value, builder::dataUncertainty);
                    break;
                case "--thresholds.monte-carlo-seed":
                    parseLong(key, value, builder::monteCarloSeed);
                    break;
            }
        }
    }

    private void parseVariations(String key, String value, AnalysisThresholds.AnalysisThresholdsBuilder builder) {
        List<Double> variations = new ArrayList<>();
        try {
            for (String part : value.split(",")) {
                variations.add(Double.parseDouble(part.trim()));
            }
            builder.sensitivityVariations(List.copyOf(variations));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    private void parseDouble(String key, String value, DoubleConsumer target) {
        try {
            target.accept(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    private void parseLong(String key, String value, LongConsumer target) {
        try {
            target.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    private void parseInt(String key, String value, IntConsumer target) {
        try {
            target.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            Overrides:
              --thresholds.consistency <num>            Maximum AHP consistency ratio accepted as consistent
              --thresholds.weight-tolerance <num>       Allowed deviation of direct weights from a sum of 1
              --thresholds.min-alternatives <num>       Minimum number of sites per analysis
              --thresholds.max-ahp-criteria <num>       Maximum number of criteria for AHP weighting
              --thresholds.sensitivity-variations <list> Comma-separated weight multipliers
              --thresholds.monte-carlo-simulations <num> Number of Monte Carlo ranking simulations
              --thresholds.weight-uncertainty <num>     Relative standard deviation of simulated weights
              --thresholds.data-uncertainty <num>       Relative standard deviation of simulated site values
              --thresholds.monte-carlo-seed <num>       Seed that makes simulations repeatable

            Environment Variables:
              MCDA_CONSISTENCY_THRESHOLD    Same as --thresholds.consistency
              MCDA_WEIGHT_TOLERANCE         Same as --thresholds.weight-tolerance
              MCDA_MIN_ALTERNATIVES         Same as --thresholds.min-alternatives
              MCDA_MAX_AHP_CRITERIA         Same as --thresholds.max-ahp-criteria

            Priority Order (highest to lowest):
              1. Overrides
              2. Environment variables
              3. Threshold file, profile defaults or built-in defaults
            """;
    }
}
