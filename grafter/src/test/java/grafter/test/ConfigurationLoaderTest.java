// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import grafter.config.Configuration;
import grafter.config.ConfigurationLoader;
import grafter.datum.AtomKind;
import grafter.datum.Datum;
import grafter.datum.Delimiter;
import grafter.reader.CanonicalPrinter;
import grafter.reader.Parser;
import grafter.util.condition.exception.IOExceptionCondition;
import static grafter.test.Conditions.configurationError;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ConfigurationLoaderTest {
    @Test
    void loadsBracketOnlyNotation() throws IOException {
        final var configuration = lisp();
        assertThat(configuration.delimiters()).containsExactly(Delimiter.of("()"), Delimiter.of("[]"));
        assertThat(configuration.firstSequence()).isNull();
        assertThat(configuration.triggerFor(":")).isNull();
        assertThat(configuration.commentPrefix()).isEqualTo(";");
    }

    @Test
    void bracketOnlyNotationParses() throws IOException {
        final var configuration = lisp();
        final var root = Parser.parse("(define x [1 2]) ; comment\nprint x", configuration);
        final var printer = new CanonicalPrinter(configuration);
        assertThat(root.children()).extracting(printer::print).containsExactly("(define x [1 2])", "(print x)");
        assertThat(printer.printRoot(root)).isEqualTo("(define x [1 2])\n(print x)\n");
    }

    @Test
    void bracketOnlyNotationUsesItsStringDelimiters() throws IOException {
        final var atom = (Datum.Atom) Parser.parse("|it||s|", lisp()).get(0);
        assertThat(atom.kind()).isEqualTo(AtomKind.RAW_STRING);
        assertThat(atom.text()).isEqualTo("it|s");
    }

    @Test
    void loadsFromPath(@TempDir final Path directory) throws IOException {
        final var file = directory.resolve("minimal.properties");
        Files.writeString(file, minimal, StandardCharsets.UTF_8);
        final var configuration = ConfigurationLoader.load(file);
        assertThat(configuration.applicationDelimiter()).isEqualTo(Delimiter.of("()"));
        assertThat(configuration.stringDelimiters().raw()).isEqualTo('\'');
    }

    @Test
    void missingFileIsSignaled(@TempDir final Path directory) {
        final var condition = Conditions.captureFatal(() -> ConfigurationLoader.load(directory.resolve("absent")));
        assertThat(condition).isInstanceOf(IOExceptionCondition.class);
    }

    @Test
    void unknownKeyIsRejected() {
        final var error = configurationError(() -> fromText(minimal + "sequence = ;\n"));
        assertThat(error.message()).isEqualTo("Unknown configuration key \"sequence\"");
    }

    @Test
    void stringKeysGoTogether() {
        final var error = configurationError(() -> fromText(
            "delimiters = ()\napplication-delimiter = ()\nstrings.escaped = \"\n"
                + "comment-prefix = #\ndirective-prefix = #\n"));
        assertThat(error.message()).contains("must be given together");
    }

    @Test
    void malformedValuesAreRejected() {
        assertThat(configurationError(() -> fromText(minimal + "binary-delimiter = <<\n")).message())
            .contains("two distinct bracket characters");
        assertThat(configurationError(() -> fromText(minimal + "section = :\n")).message())
            .contains("expects a trigger symbol and a delimiter pair");
        assertThat(configurationError(() -> fromText(minimal + "infix =\n")).message())
            .contains("empty value");
        assertThat(configurationError(() -> fromText(minimal + "prefix-glue. = &\n")).message())
            .contains("missing a name");
    }

    @Test
    void loadedEntriesAreValidated() {
        assertThat(configurationError(() -> fromText(minimal + "binary-delimiter = []\n")).message())
            .contains("not a configured pair");
    }

    private static Configuration lisp() throws IOException {
        try (final var stream = ConfigurationLoaderTest.class.getResourceAsStream("lisp.properties")) {
            assertThat(stream).isNotNull();
            return ConfigurationLoader.load(stream, "lisp.properties");
        }
    }

    private static Configuration fromText(final String text) {
        final var properties = new Properties();
        try {
            properties.load(new StringReader(text));
        } catch (final IOException e) {
            throw new AssertionError(e);
        }
        return ConfigurationLoader.fromProperties(properties);
    }

    private static final String minimal = """
        delimiters = ()
        application-delimiter = ()
        strings.escaped = "
        strings.raw = '
        strings.binary = `
        comment-prefix = #
        directive-prefix = #
        """;
}
