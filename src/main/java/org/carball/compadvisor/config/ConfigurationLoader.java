package org.carball.compadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public AdvisorSettings loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public AdvisorSettings loadConfiguration(Path settingsFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        AdvisorSettings.AdvisorSettingsBuilder builder = AdvisorSettings.builder();

        // 1. Apply settings file
        if (settingsFile != null) {
            applySettingsFile(builder, settingsFile);
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AdvisorSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applySettingsFile(AdvisorSettings.AdvisorSettingsBuilder builder, Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            log.warn("Settings file not found: {}, using defaults", settingsFile);
            return;
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            SettingsFile file = mapper.readValue(settingsFile.toFile(), SettingsFile.class);
            if (file != null) {
                file.applyTo(builder);
            }
            log.info("Loaded settings from: {}", settingsFile);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(AdvisorSettings.AdvisorSettingsBuilder builder) {
        applyNumeric("COMPADVISOR_PARALLELISM", value -> builder.analysisParallelism(Integer.parseInt(value)));
        applyNumeric("COMPADVISOR_OBJECT_TIMEOUT_SECONDS", value -> builder.objectTimeoutSeconds(Integer.parseInt(value)));
        applyNumeric("COMPADVISOR_SAMPLE_SIZE", value -> builder.sampleSize(Long.parseLong(value)));
        applyNumeric("COMPADVISOR_EXECUTION_PARALLELISM", value -> builder.executionParallelism(Integer.parseInt(value)));
        applyNumeric("COMPADVISOR_EXECUTION_TIMEOUT_MINUTES",
                value -> builder.executionTimeoutMinutes(Integer.parseInt(value)));
        applyNumeric("COMPADVISOR_MIN_SAVINGS_PCT", value -> builder.minSavingsPct(Double.parseDouble(value)));

        Map<String, String> env = environment;
        if (env.containsKey("COMPADVISOR_STATE_FILE")) {
            builder.stateFile(env.get("COMPADVISOR_STATE_FILE"));
        }
        if (env.containsKey("COMPADVISOR_STRATEGIES_FILE")) {
            builder.strategiesFile(env.get("COMPADVISOR_STRATEGIES_FILE"));
        }
        if (env.containsKey("COMPADVISOR_JDBC_URL")) {
            builder.connectionString(env.get("COMPADVISOR_JDBC_URL"));
        }
    }

    private void applyNumeric(String variable, Consumer<String> setter) {
        String value = environment.get(variable);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric value for {}: {}", variable, value);
        }
    }

    private void applyCLIArguments(AdvisorSettings.AdvisorSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--parallelism":
                        builder.analysisParallelism(Integer.parseInt(value));
                        break;
                    case "--object-timeout":
                        builder.objectTimeoutSeconds(Integer.parseInt(value));
                        break;
                    case "--sample-size":
                        builder.sampleSize(Long.parseLong(value));
                        break;
                    case "--execution-parallelism":
                        builder.executionParallelism(Integer.parseInt(value));
                        break;
                    case "--execution-timeout":
                        builder.executionTimeoutMinutes(Integer.parseInt(value));
                        break;
                    case "--min-savings":
                        builder.minSavingsPct(Double.parseDouble(value));
                        break;
                    case "--state-file":
                        builder.stateFile(value);
                        break;
                    case "--strategies":
                        builder.strategiesFile(value);
                        break;
                    case "--jdbc-url":
                        builder.connectionString(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --settings <file>                 YAML settings file
              --jdbc-url <url>                  JDBC connection string of the target database
              --strategies <file>               YAML strategy definitions (default: built-in)
              --state-file <file>               Advisor state file (default: compadvisor-state.json)
              --parallelism <num>               Analysis worker threads
              --object-timeout <seconds>        Per-object analysis timeout
              --sample-size <rows>              Rows sampled by ratio estimation
              --execution-parallelism <num>     Concurrent storage changes in a batch
              --execution-timeout <minutes>     Default statement timeout
              --min-savings <pct>               Minimum savings percentage for listings

            Environment Variables:
              COMPADVISOR_JDBC_URL                   Same as --jdbc-url
              COMPADVISOR_STRATEGIES_FILE            Same as --strategies
              COMPADVISOR_STATE_FILE                 Same as --state-file
              COMPADVISOR_PARALLELISM                Same as --parallelism
              COMPADVISOR_OBJECT_TIMEOUT_SECONDS     Same as --object-timeout
              COMPADVISOR_SAMPLE_SIZE                Same as --sample-size
              COMPADVISOR_EXECUTION_PARALLELISM      Same as --execution-parallelism
              COMPADVISOR_EXECUTION_TIMEOUT_MINUTES  Same as --execution-timeout
              COMPADVISOR_MIN_SAVINGS_PCT            Same as --min-savings

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
