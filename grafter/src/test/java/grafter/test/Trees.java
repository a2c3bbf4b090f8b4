// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.test;

import java.util.ArrayList;
import java.util.List;
import grafter.config.Configuration;
import grafter.datum.Datum;
import grafter.reader.CanonicalPrinter;
import grafter.reader.Parser;
import static org.assertj.core.api.Assertions.assertThat;

final class Trees {
    private Trees() {
    }

    static Datum.List parse(final String source) {
        return Parser.parse(source, standard);
    }

    /**
     * Parses {@code source}, which must hold exactly one top-level item, and returns that item.
     */
    static Datum single(final String source) {
        final var root = parse(source);
        assertThat(root.children()).hasSize(1);
        return root.get(0);
    }

    /**
     * Parses {@code source}, which must hold exactly one top-level item, and returns its canonical form.
     */
    static String read(final String source) {
        return printer.print(single(source));
    }

    /**
     * Parses {@code source} and returns the canonical form of every top-level item.
     */
    static List<String> readAll(final String source) {
        final var printed = new ArrayList<String>();
        for (final var item : parse(source).children()) {
            printed.add(printer.print(item));
        }
        return printed;
    }

    static String print(final Datum datum) {
        return printer.print(datum);
    }

    static final Configuration standard = Configuration.standard();
    static final CanonicalPrinter printer = new CanonicalPrinter(standard);
}
