package io.replicapacker.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import static io.replicapacker.config.Constants.*;

/**
 * Configuration for the replica packer.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Keys Spring Boot consumes from the same file (server, logging, management) are skipped.
 */
@Slf4j
@Getter
public class PackerConfig {
    
    private final String packerId;
    private final String searchStrategy;
    private final int sampleBudget;
    private final long seed;
    private final int maxTrials;
    private final int parallelism;
    private final String outputFile;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "PACKER_CONFIG_FILE";

    public PackerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR), DEFAULT_CONFIG_FILE_CLASSPATH);
    }
    
    PackerConfig(String externalConfigPath, String classpathResource) {
        ConfigModel config = loadYamlConfig(externalConfigPath, classpathResource);
        Packer packer = config.getPacker() != null ? config.getPacker() : new Packer();
        Search search = packer.getSearch() != null ? packer.getSearch() : new Search();
        
        // Parse configuration values with null-safe defaults
        this.packerId = nonBlankOrDefault(packer.getId(), DEFAULT_PACKER_ID);
        this.searchStrategy = parseSearchStrategy(search);
        this.sampleBudget = positiveOrDefault("sampleBudget", search.getSampleBudget(), DEFAULT_SAMPLE_BUDGET, true);
        this.seed = search.getSeed() != null ? search.getSeed() : DEFAULT_SEED;
        this.maxTrials = positiveOrDefault("maxTrials", search.getMaxTrials(), DEFAULT_MAX_TRIALS, false);
        this.parallelism = positiveOrDefault("parallelism", search.getParallelism(), DEFAULT_PARALLELISM, false);
        this.outputFile = packer.getOutput() != null 
            ? nonBlankOrDefault(packer.getOutput().getFile(), DEFAULT_OUTPUT_FILE) 
            : DEFAULT_OUTPUT_FILE;
        
        log.info("Loaded packer config - strategy: {}, sample budget: {}, seed: {}, max trials: {}, parallelism: {}", 
                searchStrategy, sampleBudget, seed, maxTrials, parallelism);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check external config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = getClass().getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }
    
    private String parseSearchStrategy(Search search) {
        String strategy = search.getStrategy();
        if (strategy == null || strategy.isBlank()) {
            return DEFAULT_SEARCH_STRATEGY;
        }
        String normalized = strategy.trim().toLowerCase();
        if (!SEARCH_STRATEGY_RANDOM.equals(normalized) && !SEARCH_STRATEGY_EXHAUSTIVE.equals(normalized)) {
            log.warn("Unknown search strategy '{}', using default '{}'", strategy, DEFAULT_SEARCH_STRATEGY);
            return DEFAULT_SEARCH_STRATEGY;
        }
        return normalized;
    }
    
    private static int positiveOrDefault(String name, Integer value, int defaultValue, boolean allowZero) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0 || (value == 0 && !allowZero)) {
            log.warn("Invalid value {} for {}, using default {}", value, name, defaultValue);
            return defaultValue;
        }
        return value;
    }
    
    private static String nonBlankOrDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value : defaultValue;
    }
    
    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Packer packer;
    }
    
    @Data
    public static class Packer {
        private String id; // Also read by Spring @Value for metric tags
        private Search search;
        private Output output;
    }
    
    @Data
    public static class Search {
        private String strategy;
        private Integer sampleBudget;
        private Long seed;
        private Integer maxTrials;
        private Integer parallelism;
    }
    
    @Data
    public static class Output {
        private String file;
    }
}
