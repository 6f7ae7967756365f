package im.arun.pdftranslator.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.pdftranslator.error.ConfigurationException;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link TranslatorConfig} from {@code config.yaml} and merges per-run overrides on top of it.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final List<String> ignoredFileKeys = new ArrayList<>();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .addHandler(new DeserializationProblemHandler() {
                @Override
                public boolean handleUnknownProperty(DeserializationContext ctxt, JsonParser p,
                                                     JsonDeserializer<?> deserializer, Object beanOrClass,
                                                     String propertyName) throws IOException {
                    logger.warn("Unknown configuration key in config file: {}", propertyName);
                    ignoredFileKeys.add(propertyName);
                    p.skipChildren();
                    return true;
                }
            });
    private final TranslatorConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TranslatorConfig loadDefaultConfig(String configPath) {
        // An explicit file wins over the bundled one
        if (configPath != null) {
            Path path = Paths.get(configPath);
            if (!Files.exists(path)) {
                throw new ConfigurationException("Config file not found: " + configPath);
            }
            try {
                return yamlMapper.readValue(path.toFile(), TranslatorConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to parse config file " + configPath + ": " + e.getMessage(), e);
            }
        }

        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
            if (resourceStream != null) {
                return yamlMapper.readValue(resourceStream, TranslatorConfig.class);
            }
        } catch (IOException e) {
            logger.warn("Failed to load bundled configuration, using defaults: {}", e.getMessage());
            return new TranslatorConfig();
        }

        logger.warn("No config.yaml found, using default configuration");
        return new TranslatorConfig();
    }

    /**
     * Keys of the loaded config file that did not match any setting.
     */
    List<String> getIgnoredFileKeys() {
        return List.copyOf(ignoredFileKeys);
    }

    public TranslatorConfig getDefaultConfig() {
        return defaultConfig.copy();
    }

    /**
     * Merge user options into a copy of the default configuration and validate the result.
     * Keys are accepted in snake_case (as sent by form fields) or camelCase.
     *
     * @throws ConfigurationException if a value cannot be parsed or is out of range
     */
    public TranslatorConfig load(Map<String, Object> userOptions) {
        TranslatorConfig config = defaultConfig.copy();

        if (userOptions != null) {
            userOptions.forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                switch (key) {
                    case "dpi":
                        config.setDpi(parseInt(key, value));
                        break;
                    case "ocr_lang":
                    case "ocrLanguage":
                        config.setOcrLanguage(value.toString());
                        break;
                    case "source":
                    case "sourceLanguage":
                        config.setSourceLanguage(value.toString());
                        break;
                    case "target":
                    case "targetLanguage":
                        config.setTargetLanguage(value.toString());
                        break;
                    case "max_chunk_length":
                    case "maxChunkLength":
                        config.setMaxChunkLength(parseInt(key, value));
                        break;
                    case "ocr_threshold":
                    case "ocrThreshold":
                        config.setOcrThreshold(parseInt(key, value));
                        break;
                    case "page_failure_policy":
                    case "pageFailurePolicy":
                        config.setPageFailurePolicy(parsePolicy(key, value));
                        break;
                    case "extraction_concurrency":
                    case "extractionConcurrency":
                        config.setExtractionConcurrency(parseInt(key, value));
                        break;
                    case "translation_concurrency":
                    case "translationConcurrency":
                        config.setTranslationConcurrency(parseInt(key, value));
                        break;
                    case "translation_max_retries":
                    case "translationMaxRetries":
                        config.setTranslationMaxRetries(parseInt(key, value));
                        break;
                    case "timeout_seconds":
                    case "timeoutSeconds":
                        config.setTimeoutSeconds(parseInt(key, value));
                        break;
                    case "tessdata_path":
                    case "tessdataPath":
                        config.setTessdataPath(value.toString());
                        break;
                    case "translate_base_url":
                    case "translateBaseUrl":
                        config.setTranslateBaseUrl(value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            });
        }

        validate(config);
        return config;
    }

    /**
     * @throws ConfigurationException on the first out-of-range value
     */
    public static void validate(TranslatorConfig config) {
        if (config.getDpi() <= 0) {
            throw new ConfigurationException("Invalid dpi (must be a positive integer): " + config.getDpi());
        }
        if (config.getMaxChunkLength() <= 0) {
            throw new ConfigurationException("Invalid max chunk length (must be positive): " + config.getMaxChunkLength());
        }
        if (config.getOcrThreshold() < 0) {
            throw new ConfigurationException("Invalid OCR threshold (must not be negative): " + config.getOcrThreshold());
        }
        if (config.getExtractionConcurrency() < 1 || config.getTranslationConcurrency() < 1) {
            throw new ConfigurationException("Concurrency must be at least 1");
        }
        if (config.getTranslationMaxRetries() < 0) {
            throw new ConfigurationException("Invalid max retries (must not be negative): " + config.getTranslationMaxRetries());
        }
        if (config.getTimeoutSeconds() < 0) {
            throw new ConfigurationException("Invalid timeout (must not be negative): " + config.getTimeoutSeconds());
        }
        requireText("ocr language", config.getOcrLanguage());
        requireText("source language", config.getSourceLanguage());
        requireText("target language", config.getTargetLanguage());
        if (config.getPageFailurePolicy() == null) {
            throw new ConfigurationException("Page failure policy must be set");
        }
        if (config.getTranslateBaseUrl() == null || HttpUrl.parse(config.getTranslateBaseUrl()) == null) {
            throw new ConfigurationException("Invalid translate base URL (must be an http or https URL): "
                    + config.getTranslateBaseUrl());
        }
    }

    private static void requireText(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Invalid " + name + " (must not be blank)");
        }
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " (must be an integer): " + value, e);
        }
    }

    private PageFailurePolicy parsePolicy(String key, Object value) {
        if (value instanceof PageFailurePolicy) {
            return (PageFailurePolicy) value;
        }
        try {
            return PageFailurePolicy.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + key + " (expected ISOLATE or ABORT): " + value, e);
        }
    }
}
