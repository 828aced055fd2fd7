/*
 * USLM-Tree - Legal Code Hierarchy Parser
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uslm.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.uslm.rules.CitationResolver;
import net.boyechko.uslm.rules.ReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parser settings, loaded from YAML. Keys use the same snake_case names as the fields; keys that
 * are left out keep their defaults.
 */
public final class ParserConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/uslm-parser.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    /** Maximum number of section nodes to build; null or 0 means no limit. */
    public Integer max_sections;

    public Integer max_depth = 64;

    /** Citation prefix; null derives it from the root title's identifier. */
    public String code_label;

    /** Citation prefix used when none is configured and none can be derived. */
    public String default_code_label = CitationResolver.DEFAULT_CODE_LABEL;

    public String jurisdiction = CitationResolver.DEFAULT_JURISDICTION;
    public String collection = CitationResolver.DEFAULT_COLLECTION;
    public Integer context_window = ReferenceExtractor.DEFAULT_CONTEXT_WINDOW;
    public Integer context_max_length = ReferenceExtractor.DEFAULT_CONTEXT_MAX_LENGTH;
    public Integer batch_size = 100;

    public ParserConfig() {}

    public Integer getMaxSections() {
        return max_sections;
    }

    public int getMaxDepth() {
        return max_depth;
    }

    public String getCodeLabel() {
        return code_label;
    }

    public String getDefaultCodeLabel() {
        return default_code_label;
    }

    public String getJurisdiction() {
        return jurisdiction;
    }

    public String getCollection() {
        return collection;
    }

    public int getContextWindow() {
        return context_window;
    }

    public int getContextMaxLength() {
        return context_max_length;
    }

    public int getBatchSize() {
        return batch_size;
    }

    /** Returns a copy with the section cutoff replaced; null removes the cutoff. */
    public ParserConfig withMaxSections(Integer maxSections) {
        ParserConfig copy = copy();
        copy.max_sections = maxSections;
        return copy.validate();
    }

    /** Returns a copy with a fixed citation prefix. */
    public ParserConfig withCodeLabel(String codeLabel) {
        ParserConfig copy = copy();
        copy.code_label = codeLabel;
        return copy.validate();
    }

    private ParserConfig copy() {
        ParserConfig c = new ParserConfig();
        c.max_sections = max_sections;
        c.max_depth = max_depth;
        c.code_label = code_label;
        c.default_code_label = default_code_label;
        c.jurisdiction = jurisdiction;
        c.collection = collection;
        c.context_window = context_window;
        c.context_max_length = context_max_length;
        c.batch_size = batch_size;
        return c;
    }

    /**
     * Checks every setting and returns this config.
     *
     * @throws IllegalArgumentException if a setting is missing or out of range
     */
    public ParserConfig validate() {
        if (max_sections != null && max_sections < 0) {
            throw new IllegalArgumentException(
                    "max_sections must not be negative: " + max_sections);
        }
        requirePositive("max_depth", max_depth);
        requirePositive("context_max_length", context_max_length);
        requirePositive("batch_size", batch_size);
        if (context_window == null || context_window < 0) {
            throw new IllegalArgumentException(
                    "context_window must not be negative: " + context_window);
        }
        requireText("default_code_label", default_code_label);
        requireText("jurisdiction", jurisdiction);
        requireText("collection", collection);
        if (code_label != null && code_label.isBlank()) {
            throw new IllegalArgumentException("code_label must not be blank");
        }
        return this;
    }

    private static void requirePositive(String key, Integer value) {
        if (value == null || value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
    }

    /** Built-in defaults, without reading any resource. */
    public static ParserConfig defaults() {
        return new ParserConfig();
    }

    /**
     * Load config from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ParserConfig fromResource(String resourcePath) {
        try (InputStream inputStream = ParserConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to load config from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load config from a YAML file on disk. */
    public static ParserConfig fromFile(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream, path.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    /** Load default config from standard location */
    public static ParserConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static ParserConfig load(InputStream inputStream, String source) {
        var yaml = new Yaml(new Constructor(ParserConfig.class, new LoaderOptions()));
        ParserConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new IllegalArgumentException(
                    "Invalid parser config in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            logger.debug("Config {} is empty; using defaults", source);
            config = new ParserConfig();
        }
        logger.debug(
                "Loaded parser config from {} (max_sections={}, code_label={})",
                source,
                config.max_sections,
                config.code_label);
        return config.validate();
    }
}
