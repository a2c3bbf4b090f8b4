// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import grafter.datum.Delimiter;
import grafter.util.Trace;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.UnhandledErrorError;
import grafter.util.condition.exception.IOExceptionCondition;

/**
 * Reads configurations written in the {@link Properties} format.
 * <p>
 * Recognized keys are {@code delimiters}, {@code application-delimiter}, {@code struct-delimiter},
 * {@code binary-delimiter}, {@code prefix-glue.<name>}, {@code suffix-glue.<name>}, {@code type-tag}, {@code infix},
 * {@code associative.left}, {@code associative.right}, {@code section}, {@code structure}, {@code effect},
 * {@code separators}, {@code sequences}, {@code strings.escaped}, {@code strings.raw}, {@code strings.binary},
 * {@code comment-prefix}, {@code directive-prefix} and {@code sibling-group.<name>}. List values are separated by
 * whitespace. Any other key, and any malformed value, is signaled as a fatal {@link ConfigurationErrorCondition}.
 */
public final class ConfigurationLoader {
    private ConfigurationLoader() {
    }

    /**
     * Loads a configuration from the properties file at {@code path}.
     * <p>
     * If an I/O error occurs, the {@link IOException} is caught and signaled as a fatal {@link IOExceptionCondition}.
     */
    public static Configuration load(final Path path) {
        try (final var trace = new Trace(() -> "Loading configuration from " + path)) {
            trace.use();
            try (final var stream = Files.newInputStream(path)) {
                return load(stream, path.toString());
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    /**
     * Loads a configuration from the UTF-8 properties text in {@code stream}. The stream is not closed.
     *
     * @param name A user-readable name of the stream, used in traces and log messages.
     */
    public static Configuration load(final InputStream stream, final String name) {
        try (final var trace = new Trace(() -> "Reading configuration " + name)) {
            trace.use();
            final var properties = new Properties();
            try {
                properties.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            logger.log(Level.FINE, "Read {0} configuration entries from {1}", new Object[]{properties.size(), name});
            return fromProperties(properties);
        }
    }

    /**
     * Builds a configuration from already loaded properties.
     */
    public static Configuration fromProperties(final Properties properties) {
        final var builder = Configuration.builder();
        // Sorted, so that named entries are declared in a reproducible order.
        for (final var key : new TreeSet<>(properties.stringPropertyNames())) {
            final var value = properties.getProperty(key).strip();
            logger.log(Level.FINER, "Configuration entry {0} = {1}", new Object[]{key, value});
            applyEntry(builder, key, value);
        }
        applyStrings(builder, properties);
        return builder.build();
    }

    static Configuration loadResource(final String resourceName) {
        final var loader = ConfigurationLoader.class.getClassLoader();
        try (final var stream = loader.getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw signalError("Configuration resource " + resourceName + " not found");
            }
            return load(stream, resourceName);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static void applyEntry(final Configuration.Builder builder, final String key, final String value) {
        if (key.startsWith(prefixGlueKey)) {
            builder.prefixGlue(nameOf(key, prefixGlueKey), value);
            return;
        } else if (key.startsWith(suffixGlueKey)) {
            builder.suffixGlue(nameOf(key, suffixGlueKey), value);
            return;
        } else if (key.startsWith(siblingGroupKey)) {
            builder.siblingGroup(nameOf(key, siblingGroupKey), words(key, value).toArray(String[]::new));
            return;
        }
        switch (key) {
            case "delimiters" -> {
                for (final var pair : words(key, value)) {
                    builder.delimiter(delimiter(key, pair));
                }
            }
            case "application-delimiter" -> builder.applicationDelimiter(delimiter(key, value));
            case "struct-delimiter" -> builder.structDelimiter(value.isEmpty() ? null : delimiter(key, value));
            case "binary-delimiter" -> builder.binaryDelimiter(value.isEmpty() ? null : delimiter(key, value));
            case "type-tag" -> builder.typeTag(value.isEmpty() ? null : value);
            case "infix" -> builder.infix(words(key, value).toArray(String[]::new));
            case "associative.left" -> builder.associativeLeft(words(key, value).toArray(String[]::new));
            case "associative.right" -> builder.associativeRight(words(key, value).toArray(String[]::new));
            case "section" -> trigger(builder, TriggerKind.SECTION, key, value);
            case "structure" -> trigger(builder, TriggerKind.STRUCTURE, key, value);
            case "effect" -> trigger(builder, TriggerKind.EFFECT, key, value);
            case "separators" -> builder.separators(withoutWhitespace(value));
            case "sequences" -> builder.sequences(withoutWhitespace(value));
            case stringsEscapedKey, stringsRawKey, stringsBinaryKey -> {
                // Applied together by applyStrings.
            }
            case "comment-prefix" -> builder.commentPrefix(value);
            case "directive-prefix" -> builder.directivePrefix(value);
            default -> throw signalError("Unknown configuration key \"" + key + '"');
        }
    }

    private static void applyStrings(final Configuration.Builder builder, final Properties properties) {
        final var escaped = properties.getProperty(stringsEscapedKey);
        final var raw = properties.getProperty(stringsRawKey);
        final var binary = properties.getProperty(stringsBinaryKey);
        if (escaped == null && raw == null && binary == null) {
            return;
        }
        if (escaped == null || raw == null || binary == null) {
            throw signalError("Keys " + stringsEscapedKey + ", " + stringsRawKey + " and " + stringsBinaryKey
                + " must be given together");
        }
        builder.strings(
            singleCharacter(stringsEscapedKey, escaped.strip()),
            singleCharacter(stringsRawKey, raw.strip()),
            singleCharacter(stringsBinaryKey, binary.strip()));
    }

    private static void trigger(
        final Configuration.Builder builder,
        final TriggerKind kind,
        final String key,
        final String value
    ) {
        final var parts = words(key, value);
        if (parts.size() != 2) {
            throw signalError("Key \"" + key + "\" expects a trigger symbol and a delimiter pair, got \"" + value + '"');
        }
        builder.trigger(kind, parts.get(0), delimiter(key, parts.get(1)));
    }

    private static Delimiter delimiter(final String key, final String pair) {
        if (pair.length() != 2 || pair.charAt(0) == pair.charAt(1)) {
            throw signalError("Key \"" + key + "\" expects two distinct bracket characters, got \"" + pair + '"');
        }
        return Delimiter.of(pair);
    }

    private static char singleCharacter(final String key, final String value) {
        if (value.length() != 1) {
            throw signalError("Key \"" + key + "\" expects exactly one character, got \"" + value + '"');
        }
        return value.charAt(0);
    }

    private static List<String> words(final String key, final String value) {
        if (value.isEmpty()) {
            throw signalError("Key \"" + key + "\" has an empty value");
        }
        return List.of(value.split("\\s+"));
    }

    private static String withoutWhitespace(final String value) {
        return value.replaceAll("\\s+", "");
    }

    private static String nameOf(final String key, final String prefix) {
        final var name = key.substring(prefix.length());
        if (name.isEmpty()) {
            throw signalError("Key \"" + key + "\" is missing a name");
        }
        return name;
    }

    private static UnhandledErrorError signalError(final String message) {
        throw ConditionContext.error(new ConfigurationErrorCondition(message));
    }

    private static final Logger logger = Logger.getLogger(ConfigurationLoader.class.getName());

    private static final String prefixGlueKey = "prefix-glue.";
    private static final String suffixGlueKey = "suffix-glue.";
    private static final String siblingGroupKey = "sibling-group.";
    private static final String stringsEscapedKey = "strings.escaped";
    private static final String stringsRawKey = "strings.raw";
    private static final String stringsBinaryKey = "strings.binary";
}
