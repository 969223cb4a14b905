package migrator;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Migration configuration. The bundled {@code config.default.json} provides every setting but the source and
 * destination folders; a user's configuration file only needs to override what differs.
 */
public class Config {
    public static final int MAX_PAGE_SIZE = 1000;
    public static final int TIMEOUT = 1000 * 60;    // 1 minute

    private static final String DEFAULT_CONFIG_RESOURCE = "/config.default.json";
    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    private final JsonObject configuration;

    private Config(JsonObject configuration) throws ConfigException {
        this.configuration = configuration;
        validate();
    }

    /**
     * Load a configuration file on top of the default configuration.
     *
     * @param configFile    Path to the user's configuration file.
     * @return              The loaded configuration.
     * @throws ConfigException If the file doesn't exist, isn't valid JSON or lacks required settings.
     */
    public static Config load(Path configFile) throws ConfigException {
        if (!Files.exists(configFile)) {
            throw new ConfigException("Configuration file " + configFile.toAbsolutePath() + " not found");
        }
        JsonObject configuration = loadDefaults();
        try (Reader configReader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            JsonObject userConfig = new Gson().fromJson(configReader, JsonObject.class);
            if (userConfig == null) {
                throw new ConfigException("Configuration file " + configFile + " is empty");
            }
            merge(configuration, userConfig);
            logger.debug("Loaded configuration file {}", configFile);
        } catch (IOException | JsonParseException e) {
            throw new ConfigException("Couldn't read configuration file " + configFile + ": " + e.getMessage(), e);
        }
        return new Config(configuration);
    }

    /**
     * Parse a configuration on top of the default configuration.
     *
     * @param json  Configuration, as JSON.
     * @return      The parsed configuration.
     * @throws ConfigException If {@code json} is invalid or lacks required settings.
     */
    public static Config fromJson(String json) throws ConfigException {
        JsonObject configuration = loadDefaults();
        try {
            merge(configuration, JsonParser.parseString(json).getAsJsonObject());
        } catch (JsonParseException | IllegalStateException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
        return new Config(configuration);
    }

    private static JsonObject loadDefaults() throws ConfigException {
        // Bundled with the application, can only fail if the build is broken
        try (InputStream in = Config.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Default configuration " + DEFAULT_CONFIG_RESOURCE + " not found in classpath");
            }
            return new Gson().fromJson(new InputStreamReader(in, StandardCharsets.UTF_8), JsonObject.class);
        } catch (IOException | JsonParseException e) {
            throw new ConfigException("Couldn't load default configuration", e);
        }
    }

    /**
     * Deep-merge {@code overrides} into {@code base}. Objects are merged key by key, anything else is replaced.
     */
    private static void merge(JsonObject base, JsonObject overrides) {
        for (Map.Entry<String, JsonElement> entry : overrides.entrySet()) {
            JsonElement current = base.get(entry.getKey());
            if (current != null && current.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(current.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                base.add(entry.getKey(), entry.getValue());
            }
        }
    }

    private void validate() throws ConfigException {
        for (String[] required : new String[][]{{"source", "folderId"}, {"destination", "folderId"}}) {
            String value = getString(required[0], required[1]);
            if (value == null || value.trim().isEmpty()) {
                throw new ConfigException("Missing required configuration field: " + required[0] + "." + required[1]);
            }
        }
        if (getSourceFolderId().equals(getDestinationFolderId())) {
            throw new ConfigException("Source and destination folders must differ");
        }
        requirePositive("performance", "rateLimit");
        requirePositive("performance", "timeWindow");
        requirePositive("migration", "batchSize");
        if (getMaxRetries() < 0) {
            throw new ConfigException("migration.maxRetries can't be negative");
        }
    }

    private void requirePositive(String section, String key) throws ConfigException {
        if (getInt(section, key) <= 0) {
            throw new ConfigException(section + "." + key + " must be positive");
        }
    }

    private JsonElement get(String section, String key) {
        JsonElement sectionElement = configuration.get(section);
        if (sectionElement == null || !sectionElement.isJsonObject()) {
            return null;
        }
        JsonElement value = sectionElement.getAsJsonObject().get(key);
        return value == null || value.isJsonNull() ? null : value;
    }

    private String getString(String section, String key) {
        JsonElement value = get(section, key);
        return value == null ? null : value.getAsString();
    }

    private int getInt(String section, String key) throws ConfigException {
        JsonElement value = get(section, key);
        try {
            if (value == null) {
                throw new ConfigException("Missing configuration field: " + section + "." + key);
            }
            return value.getAsInt();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new ConfigException(section + "." + key + " must be an integer, got " + value, e);
        }
    }

    private boolean getBoolean(String section, String key) {
        JsonElement value = get(section, key);
        return value != null && value.getAsBoolean();
    }

    public String getSourceFolderId() {
        return getString("source", "folderId");
    }

    public String getDestinationFolderId() {
        return getString("destination", "folderId");
    }

    public Path getClientSecretsPath() {
        return Paths.get(getString("credentials", "clientSecretsPath")).toAbsolutePath();
    }

    public Path getTokenDirectory() {
        return Paths.get(getString("credentials", "tokenDirectory").replaceFirst("^~", Matcher.quoteReplacement(System.getProperty("user.home")))).toAbsolutePath();
    }

    /**
     * @return Maximum number of requests per {@link #getTimeWindow() time window}.
     */
    public int getRateLimit() {
        return getIntUnchecked("performance", "rateLimit");
    }

    /**
     * @return Length of the rate limit window, in seconds.
     */
    public int getTimeWindow() {
        return getIntUnchecked("performance", "timeWindow");
    }

    /**
     * @return Number of copied files between two progress reports.
     */
    public int getBatchSize() {
        return getIntUnchecked("migration", "batchSize");
    }

    public int getMaxRetries() {
        return getIntUnchecked("migration", "maxRetries");
    }

    /**
     * @return Whether files found missing by the final validation should be copied again.
     */
    public boolean isAutoFixMissing() {
        return getBoolean("migration", "autoFixMissing");
    }

    public boolean isFinalValidation() {
        return getBoolean("migration", "finalValidation");
    }

    public String getLogLevel() {
        return getString("logging", "level");
    }

    /**
     * Settings are validated on construction, so this can't fail after that.
     */
    private int getIntUnchecked(String section, String key) {
        try {
            return getInt(section, key);
        } catch (ConfigException e) {
            throw new IllegalStateException("Configuration changed after validation", e);
        }
    }

    @Override
    public String toString() {
        return configuration.toString();
    }
}
