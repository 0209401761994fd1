package de.mirkosertic.docconsolidator.config;

import de.mirkosertic.docconsolidator.fs.DuplicateCheck;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the document consolidator.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. Config file given on the command line
 * 4. User config file (~/.docconsolidator/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_ENTITY_TABLE = "CONSOLIDATOR_ENTITY_TABLE";
    private static final String ENV_SOURCE_STORE = "CONSOLIDATOR_SOURCE_STORE";
    private static final String ENV_REFERENCE_INDEX = "CONSOLIDATOR_REFERENCE_INDEX";
    private static final String ENV_MASTER_DOCUMENT = "CONSOLIDATOR_MASTER_DOCUMENT";
    private static final String ENV_DESTINATION_ROOT = "CONSOLIDATOR_DESTINATION_ROOT";
    private static final String ENV_LOG_DIR = "CONSOLIDATOR_LOG_DIR";
    private static final String CONFIG_DIR = ".docconsolidator";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Input and output locations
    private @Nullable Path entityTable;
    private @Nullable Path sourceStore;
    private @Nullable Path referenceIndex;
    private @Nullable Path masterDocument;
    private @Nullable Path destinationRoot;
    private Path logDirectory = Paths.get(System.getProperty("user.dir"));

    // File naming conventions inside each entity folder
    private String candidateTableName = "output.xlsx";
    private String mergedOutputName = "Combined.pdf";
    private String backupMarker = "_FRI";
    private String cacheSidecarName = ".merge-cache.yaml";

    private DuplicateCheck duplicateCheck = DuplicateCheck.SIZE;

    private ApplicationConfig() {
    }

    /**
     * Configuration with built-in defaults only. No file or environment is consulted.
     */
    public static ApplicationConfig defaults() {
        return new ApplicationConfig();
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param explicitConfigFile optional config file passed on the command line
     */
    public static ApplicationConfig load(final @Nullable Path explicitConfigFile) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(getUserConfigPath());

        // Step 3: Config file named on the command line
        if (explicitConfigFile != null) {
            if (!Files.exists(explicitConfigFile)) {
                logger.warn("Config file does not exist: {}", explicitConfigFile);
            }
            config.loadFromFile(explicitConfigFile);
        }

        // Step 4: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: destinationRoot={}, entityTable={}, duplicateCheck={}",
                config.destinationRoot, config.entityTable, config.duplicateCheck);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded config from: {}", configPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load config from: {}", configPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("consolidator");
        if (root == null) {
            return;
        }

        final Map<String, Object> paths = (Map<String, Object>) root.get("paths");
        if (paths != null) {
            entityTable = pathOrKeep(paths.get("entity-table"), entityTable);
            sourceStore = pathOrKeep(paths.get("source-store"), sourceStore);
            referenceIndex = pathOrKeep(paths.get("reference-index"), referenceIndex);
            masterDocument = pathOrKeep(paths.get("master-document"), masterDocument);
            destinationRoot = pathOrKeep(paths.get("destination-root"), destinationRoot);
            final Path logDir = pathOrKeep(paths.get("log-dir"), logDirectory);
            if (logDir != null) {
                logDirectory = logDir;
            }
        }

        final Map<String, Object> naming = (Map<String, Object>) root.get("naming");
        if (naming != null) {
            candidateTableName = stringOrKeep(naming.get("candidate-table"), candidateTableName);
            mergedOutputName = stringOrKeep(naming.get("merged-output"), mergedOutputName);
            backupMarker = stringOrKeep(naming.get("backup-marker"), backupMarker);
            cacheSidecarName = stringOrKeep(naming.get("cache-sidecar"), cacheSidecarName);
        }

        final Map<String, Object> copy = (Map<String, Object>) root.get("copy");
        if (copy != null && copy.get("duplicate-check") != null) {
            duplicateCheck = DuplicateCheck.valueOf(copy.get("duplicate-check").toString().trim().toUpperCase(Locale.ROOT));
        }
    }

    private void applyEnvironmentOverrides() {
        entityTable = overridePath(ENV_ENTITY_TABLE, "consolidator.entity-table", entityTable);
        sourceStore = overridePath(ENV_SOURCE_STORE, "consolidator.source-store", sourceStore);
        referenceIndex = overridePath(ENV_REFERENCE_INDEX, "consolidator.reference-index", referenceIndex);
        masterDocument = overridePath(ENV_MASTER_DOCUMENT, "consolidator.master-document", masterDocument);
        destinationRoot = overridePath(ENV_DESTINATION_ROOT, "consolidator.destination-root", destinationRoot);
        final Path logDir = overridePath(ENV_LOG_DIR, "consolidator.log-dir", logDirectory);
        if (logDir != null) {
            logDirectory = logDir;
        }
    }

    private static @Nullable Path overridePath(final String envName, final String propertyName, final @Nullable Path current) {
        final String envValue = System.getenv(envName);
        if (envValue != null && !envValue.trim().isEmpty()) {
            logger.info("{} from environment: {}", envName, envValue.trim());
            return Paths.get(envValue.trim());
        }
        final String propValue = System.getProperty(propertyName);
        if (propValue != null && !propValue.trim().isEmpty()) {
            return Paths.get(propValue.trim());
        }
        return current;
    }

    private @Nullable Path pathOrKeep(final @Nullable Object value, final @Nullable Path current) {
        if (value == null) {
            return current;
        }
        final String resolved = resolveVariables(value.toString().trim());
        return resolved.isBlank() ? current : Paths.get(resolved);
    }

    private String stringOrKeep(final @Nullable Object value, final String current) {
        if (value == null) {
            return current;
        }
        final String resolved = resolveVariables(value.toString().trim());
        return resolved.isBlank() ? current : resolved;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public @Nullable Path getEntityTable() {
        return entityTable;
    }

    public @Nullable Path getSourceStore() {
        return sourceStore;
    }

    public @Nullable Path getReferenceIndex() {
        return referenceIndex;
    }

    public @Nullable Path getMasterDocument() {
        return masterDocument;
    }

    public @Nullable Path getDestinationRoot() {
        return destinationRoot;
    }

    public Path getLogDirectory() {
        return logDirectory;
    }

    public String getCandidateTableName() {
        return candidateTableName;
    }

    public String getMergedOutputName() {
        return mergedOutputName;
    }

    public String getBackupMarker() {
        return backupMarker;
    }

    public String getCacheSidecarName() {
        return cacheSidecarName;
    }

    public DuplicateCheck getDuplicateCheck() {
        return duplicateCheck;
    }

    // Setters, used when the configuration is assembled programmatically
    public void setEntityTable(final Path entityTable) {
        this.entityTable = entityTable;
    }

    public void setSourceStore(final Path sourceStore) {
        this.sourceStore = sourceStore;
    }

    public void setReferenceIndex(final Path referenceIndex) {
        this.referenceIndex = referenceIndex;
    }

    public void setMasterDocument(final Path masterDocument) {
        this.masterDocument = masterDocument;
    }

    public void setDestinationRoot(final Path destinationRoot) {
        this.destinationRoot = destinationRoot;
    }

    public void setLogDirectory(final Path logDirectory) {
        this.logDirectory = logDirectory;
    }

    public void setCandidateTableName(final String candidateTableName) {
        this.candidateTableName = candidateTableName;
    }

    public void setMergedOutputName(final String mergedOutputName) {
        this.mergedOutputName = mergedOutputName;
    }

    public void setBackupMarker(final String backupMarker) {
        this.backupMarker = backupMarker;
    }

    public void setCacheSidecarName(final String cacheSidecarName) {
        this.cacheSidecarName = cacheSidecarName;
    }

    public void setDuplicateCheck(final DuplicateCheck duplicateCheck) {
        this.duplicateCheck = duplicateCheck;
    }
}
