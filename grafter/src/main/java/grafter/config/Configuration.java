// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import grafter.datum.Delimiter;
import grafter.datum.Shape;
import grafter.util.annotation.Nullable;
import grafter.util.condition.ConditionContext;
import grafter.util.condition.UnhandledErrorError;

/**
 * The frozen mapping from syntactic category to symbols that drives every parse.
 * <p>
 * Instances are created with {@link #builder()}, which validates the whole table once; a successfully built
 * configuration is immutable and safe to share between threads without synchronization. Lookups used by the reader
 * are resolved into hash tables and longest-first symbol lists at build time.
 */
public final class Configuration {
    private Configuration(final Builder builder) {
        delimiters = List.copyOf(builder.delimiters);
        final var opening = new HashMap<Character, Delimiter>();
        final var closing = new HashMap<Character, Delimiter>();
        for (final var delimiter : delimiters) {
            opening.put(delimiter.open(), delimiter);
            closing.put(delimiter.close(), delimiter);
        }
        delimitersByOpen = Map.copyOf(opening);
        delimitersByClose = Map.copyOf(closing);
        applicationDelimiter = builder.applicationDelimiter;
        structDelimiter = builder.structDelimiter;
        binaryDelimiter = builder.binaryDelimiter;
        prefixGlue = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prefixGlue));
        suffixGlue = Collections.unmodifiableMap(new LinkedHashMap<>(builder.suffixGlue));
        prefixSymbols = longestFirst(prefixGlue.values());
        suffixSymbols = longestFirst(suffixGlue.values());
        typeTagSymbol = builder.typeTagSymbol;
        infixSymbols = Set.copyOf(builder.infixSymbols);
        final var associativity = new HashMap<String, Associativity>();
        for (final var symbol : builder.leftAssociativeSymbols) {
            associativity.put(symbol, Associativity.LEFT);
        }
        for (final var symbol : builder.rightAssociativeSymbols) {
            associativity.put(symbol, Associativity.RIGHT);
        }
        associativeSymbols = Map.copyOf(associativity);
        triggers = Collections.unmodifiableMap(new EnumMap<>(builder.triggers));
        final var bySymbol = new HashMap<String, TriggerRule>();
        for (final var rule : triggers.values()) {
            bySymbol.put(rule.symbol(), rule);
        }
        triggersBySymbol = Map.copyOf(bySymbol);
        separators = Set.copyOf(builder.separators);
        sequences = Set.copyOf(builder.sequences);
        firstSequence = builder.sequences.isEmpty() ? null : builder.sequences.iterator().next();
        stringDelimiters = builder.stringDelimiters;
        commentPrefix = builder.commentPrefix;
        directivePrefix = builder.directivePrefix;
        siblingGroups = List.copyOf(builder.siblingGroups.values());
        final var byOpener = new HashMap<String, SiblingGroup>();
        for (final var group : siblingGroups) {
            byOpener.put(group.opener(), group);
        }
        siblingGroupsByOpener = Map.copyOf(byOpener);
    }

    /**
     * Creates a builder for a new configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the standard notation, loaded from the {@code grafter/config/standard.properties} resource.
     * <p>
     * Every call loads a fresh, independent value.
     */
    public static Configuration standard() {
        return ConfigurationLoader.loadResource(STANDARD_RESOURCE);
    }

    /**
     * Retrieves all configured delimiter pairs, in declaration order.
     */
    public List<Delimiter> delimiters() {
        return delimiters;
    }

    /**
     * Returns the delimiter opened by {@code c}, or {@code null} if {@code c} doesn't open one.
     */
    public @Nullable Delimiter delimiterOpenedBy(final char c) {
        return delimitersByOpen.get(c);
    }

    /**
     * Returns the delimiter closed by {@code c}, or {@code null} if {@code c} doesn't close one.
     */
    public @Nullable Delimiter delimiterClosedBy(final char c) {
        return delimitersByClose.get(c);
    }

    /**
     * Retrieves the delimiter of synthetic application lists.
     */
    public Delimiter applicationDelimiter() {
        return applicationDelimiter;
    }

    /**
     * Returns the shape tag of lists using the given delimiter: {@link Shape#STRUCT} for the struct delimiter,
     * {@link Shape#BINARY} for the binary delimiter, {@code null} for any other.
     */
    public @Nullable Shape shapeOf(final Delimiter delimiter) {
        if (delimiter.equals(structDelimiter)) {
            return Shape.STRUCT;
        } else if (delimiter.equals(binaryDelimiter)) {
            return Shape.BINARY;
        } else {
            return null;
        }
    }

    /**
     * Retrieves the prefix glue symbols keyed by name.
     */
    public Map<String, String> prefixGlue() {
        return prefixGlue;
    }

    /**
     * Retrieves the suffix glue symbols keyed by name.
     */
    public Map<String, String> suffixGlue() {
        return suffixGlue;
    }

    /**
     * Returns the longest prefix glue symbol occurring in {@code text} at {@code index}, or {@code null}.
     */
    public @Nullable String matchPrefixGlue(final CharSequence text, final int index) {
        return longestMatch(prefixSymbols, text, index);
    }

    /**
     * Returns the longest suffix glue symbol occurring in {@code text} at {@code index}, or {@code null}.
     */
    public @Nullable String matchSuffixGlue(final CharSequence text, final int index) {
        return longestMatch(suffixSymbols, text, index);
    }

    /**
     * Returns {@code true} iff {@code c} is the first character of some suffix glue symbol.
     */
    public boolean startsSuffixGlue(final char c) {
        for (final var symbol : suffixSymbols) {
            if (symbol.charAt(0) == c) {
                return true;
            }
        }
        return false;
    }

    /**
     * Retrieves the suffix glue symbol used for bare type tags, or {@code null} if tags are disabled.
     */
    public @Nullable String typeTagSymbol() {
        return typeTagSymbol;
    }

    /**
     * Returns {@code true} iff {@code symbol} is an infix symbol.
     */
    public boolean isInfix(final String symbol) {
        return infixSymbols.contains(symbol);
    }

    /**
     * Retrieves the infix symbols.
     */
    public Set<String> infixSymbols() {
        return infixSymbols;
    }

    /**
     * Returns the associativity of {@code symbol}, or {@code null} if it's not an associative symbol.
     */
    public @Nullable Associativity associativityOf(final String symbol) {
        return associativeSymbols.get(symbol);
    }

    /**
     * Retrieves the associative symbols with their fold directions.
     */
    public Map<String, Associativity> associativeSymbols() {
        return associativeSymbols;
    }

    /**
     * Returns the trigger rule of the given kind, or {@code null} if that kind is not configured.
     */
    public @Nullable TriggerRule trigger(final TriggerKind kind) {
        return triggers.get(kind);
    }

    /**
     * Returns the trigger rule whose symbol is {@code symbol}, or {@code null}.
     */
    public @Nullable TriggerRule triggerFor(final String symbol) {
        return triggersBySymbol.get(symbol);
    }

    /**
     * Retrieves the delimiter used for the root list and for associative chain sections: the section materializer if
     * sections are configured, the application delimiter otherwise.
     */
    public Delimiter sectionMaterializer() {
        final var section = triggers.get(TriggerKind.SECTION);
        return (section != null) ? section.materializer() : applicationDelimiter;
    }

    /**
     * Returns {@code true} iff {@code c} is a separator character.
     */
    public boolean isSeparator(final char c) {
        return separators.contains(c);
    }

    /**
     * Returns {@code true} iff {@code c} is a sequence character.
     */
    public boolean isSequence(final char c) {
        return sequences.contains(c);
    }

    /**
     * Retrieves the first declared sequence character, or {@code null} if there are none.
     */
    public @Nullable Character firstSequence() {
        return firstSequence;
    }

    /**
     * Retrieves the string literal delimiters.
     */
    public StringDelimiters stringDelimiters() {
        return stringDelimiters;
    }

    /**
     * Retrieves the comment prefix. A comment is this prefix followed by a space, a line break or end of input.
     */
    public String commentPrefix() {
        return commentPrefix;
    }

    /**
     * Retrieves the directive prefix.
     */
    public String directivePrefix() {
        return directivePrefix;
    }

    /**
     * Retrieves the sibling keyword groups, in declaration order.
     */
    public List<SiblingGroup> siblingGroups() {
        return siblingGroups;
    }

    /**
     * Returns the sibling group opened by {@code keyword}, or {@code null}.
     */
    public @Nullable SiblingGroup siblingGroupOpenedBy(final String keyword) {
        return siblingGroupsByOpener.get(keyword);
    }

    /**
     * Returns {@code true} iff {@code c} ends a word: whitespace, a delimiter, a string opener, a separator or a
     * sequence character.
     */
    public boolean breaksWord(final char c) {
        return Character.isWhitespace(c)
            || delimitersByOpen.containsKey(c)
            || delimitersByClose.containsKey(c)
            || stringDelimiters.kindOpenedBy(c) != null
            || separators.contains(c)
            || sequences.contains(c);
    }

    /**
     * Returns every category {@code symbol} is configured in.
     */
    public Set<SymbolCategory> categoriesOf(final String symbol) {
        final var categories = EnumSet.noneOf(SymbolCategory.class);
        if (prefixGlue.containsValue(symbol)) {
            categories.add(SymbolCategory.PREFIX_GLUE);
        }
        if (suffixGlue.containsValue(symbol)) {
            categories.add(SymbolCategory.SUFFIX_GLUE);
        }
        if (infixSymbols.contains(symbol)) {
            categories.add(SymbolCategory.INFIX);
        }
        final var associativity = associativeSymbols.get(symbol);
        if (associativity != null) {
            categories.add(
                (associativity == Associativity.LEFT) ? SymbolCategory.ASSOCIATIVE_LEFT : SymbolCategory.ASSOCIATIVE_RIGHT);
        }
        if (triggersBySymbol.containsKey(symbol)) {
            categories.add(SymbolCategory.TRIGGER);
        }
        if (symbol.length() == 1 && separators.contains(symbol.charAt(0))) {
            categories.add(SymbolCategory.SEPARATOR);
        }
        if (symbol.length() == 1 && sequences.contains(symbol.charAt(0))) {
            categories.add(SymbolCategory.SEQUENCE);
        }
        return categories;
    }

    private static List<String> longestFirst(final Iterable<String> symbols) {
        final var list = new ArrayList<String>();
        for (final var symbol : symbols) {
            if (!list.contains(symbol)) {
                list.add(symbol);
            }
        }
        list.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(list);
    }

    private static @Nullable String longestMatch(final List<String> symbols, final CharSequence text, final int index) {
        for (final var symbol : symbols) {
            if (regionMatches(text, index, symbol)) {
                return symbol;
            }
        }
        return null;
    }

    private static boolean regionMatches(final CharSequence text, final int index, final String symbol) {
        if (index + symbol.length() > text.length()) {
            return false;
        }
        for (int i = 0; i < symbol.length(); i += 1) {
            if (text.charAt(index + i) != symbol.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static final String STANDARD_RESOURCE = "grafter/config/standard.properties";

    private final List<Delimiter> delimiters;
    private final Map<Character, Delimiter> delimitersByOpen;
    private final Map<Character, Delimiter> delimitersByClose;
    private final Delimiter applicationDelimiter;
    private final @Nullable Delimiter structDelimiter;
    private final @Nullable Delimiter binaryDelimiter;
    private final Map<String, String> prefixGlue;
    private final Map<String, String> suffixGlue;
    private final List<String> prefixSymbols;
    private final List<String> suffixSymbols;
    private final @Nullable String typeTagSymbol;
    private final Set<String> infixSymbols;
    private final Map<String, Associativity> associativeSymbols;
    private final Map<TriggerKind, TriggerRule> triggers;
    private final Map<String, TriggerRule> triggersBySymbol;
    private final Set<Character> separators;
    private final Set<Character> sequences;
    private final @Nullable Character firstSequence;
    private final StringDelimiters stringDelimiters;
    private final String commentPrefix;
    private final String directivePrefix;
    private final List<SiblingGroup> siblingGroups;
    private final Map<String, SiblingGroup> siblingGroupsByOpener;

    /**
     * A mutable accumulator for configuration entries. Not thread-safe; {@link #build()} validates and freezes.
     */
    public static final class Builder {
        private Builder() {
        }

        /**
         * Adds a bracket pair.
         */
        public Builder delimiter(final Delimiter delimiter) {
            delimiters.add(delimiter);
            return this;
        }

        /**
         * Sets the delimiter of synthetic application lists. Must also be added with {@link #delimiter(Delimiter)}.
         */
        public Builder applicationDelimiter(final Delimiter delimiter) {
            applicationDelimiter = delimiter;
            return this;
        }

        /**
         * Sets the delimiter whose lists are tagged {@link Shape#STRUCT}, or {@code null} for none.
         */
        public Builder structDelimiter(final @Nullable Delimiter delimiter) {
            structDelimiter = delimiter;
            return this;
        }

        /**
         * Sets the delimiter whose lists are tagged {@link Shape#BINARY}, or {@code null} for none.
         */
        public Builder binaryDelimiter(final @Nullable Delimiter delimiter) {
            binaryDelimiter = delimiter;
            return this;
        }

        /**
         * Adds a named prefix glue symbol.
         */
        public Builder prefixGlue(final String name, final String symbol) {
            putNamed(prefixGlue, "prefix glue", name, symbol);
            return this;
        }

        /**
         * Adds a named suffix glue symbol.
         */
        public Builder suffixGlue(final String name, final String symbol) {
            putNamed(suffixGlue, "suffix glue", name, symbol);
            return this;
        }

        /**
         * Sets the suffix glue symbol whose bare form {@code <symbol>Type} tags materialized contexts, or {@code null}.
         */
        public Builder typeTag(final @Nullable String symbol) {
            typeTagSymbol = symbol;
            return this;
        }

        /**
         * Adds infix symbols.
         */
        public Builder infix(final String... symbols) {
            Collections.addAll(infixSymbols, symbols);
            return this;
        }

        /**
         * Adds left-associative symbols.
         */
        public Builder associativeLeft(final String... symbols) {
            Collections.addAll(leftAssociativeSymbols, symbols);
            return this;
        }

        /**
         * Adds right-associative symbols.
         */
        public Builder associativeRight(final String... symbols) {
            Collections.addAll(rightAssociativeSymbols, symbols);
            return this;
        }

        /**
         * Sets the trigger symbol and materializer delimiter of one context kind.
         */
        public Builder trigger(final TriggerKind kind, final String symbol, final Delimiter materializer) {
            triggers.put(kind, new TriggerRule(kind, symbol, materializer));
            return this;
        }

        /**
         * Adds separator characters.
         */
        public Builder separators(final String characters) {
            for (int i = 0; i < characters.length(); i += 1) {
                separators.add(characters.charAt(i));
            }
            return this;
        }

        /**
         * Adds sequence characters.
         */
        public Builder sequences(final String characters) {
            for (int i = 0; i < characters.length(); i += 1) {
                sequences.add(characters.charAt(i));
            }
            return this;
        }

        /**
         * Sets the string literal delimiters.
         */
        public Builder strings(final char escaped, final char raw, final char binary) {
            stringDelimiters = new StringDelimiters(escaped, raw, binary);
            return this;
        }

        /**
         * Sets the comment prefix.
         */
        public Builder commentPrefix(final String prefix) {
            commentPrefix = prefix;
            return this;
        }

        /**
         * Sets the directive prefix.
         */
        public Builder directivePrefix(final String prefix) {
            directivePrefix = prefix;
            return this;
        }

        /**
         * Adds a sibling keyword group; the first keyword opens it.
         */
        public Builder siblingGroup(final String name, final String... keywords) {
            if (siblingGroups.containsKey(name)) {
                throw signalError("Sibling group \"" + name + "\" is declared twice");
            }
            siblingGroups.put(name, new SiblingGroup(name, List.of(keywords)));
            return this;
        }

        /**
         * Validates the accumulated entries and freezes them into a {@link Configuration}.
         * <p>
         * Any conflict or malformed entry is signaled as a fatal {@link ConfigurationErrorCondition}.
         */
        public Configuration build() {
            validateDelimiters();
            validateStrings();
            validateSymbols();
            validateTriggers();
            validatePrefixes();
            validateSiblingGroups();
            return new Configuration(this);
        }

        private void validateDelimiters() {
            if (delimiters.isEmpty()) {
                throw signalError("At least one delimiter pair is required");
            }
            final var seen = new HashSet<Character>();
            for (final var delimiter : delimiters) {
                for (final var c : new char[]{delimiter.open(), delimiter.close()}) {
                    if (Character.isWhitespace(c)) {
                        throw signalError("Delimiter " + delimiter + " uses a whitespace character");
                    }
                    if (!seen.add(c)) {
                        throw signalError("Delimiter character '" + c + "' is used by more than one pair");
                    }
                }
            }
            if (applicationDelimiter == null) {
                throw signalError("The application delimiter is not set");
            }
            requireConfigured(applicationDelimiter, "application");
            if (structDelimiter != null) {
                requireConfigured(structDelimiter, "struct");
            }
            if (binaryDelimiter != null) {
                requireConfigured(binaryDelimiter, "binary");
                if (binaryDelimiter.equals(structDelimiter)) {
                    throw signalError("The struct and binary delimiters must differ");
                }
            }
        }

        private void validateStrings() {
            final var strings = stringDelimiters;
            if (strings == null) {
                throw signalError("String delimiters are not set");
            }
            final var openers = new char[]{strings.escaped(), strings.raw(), strings.binary()};
            final var seen = new HashSet<Character>();
            for (final var c : openers) {
                if (!seen.add(c)) {
                    throw signalError("String delimiter '" + c + "' is used for more than one string kind");
                }
                if (Character.isWhitespace(c) || isDelimiterCharacter(c)) {
                    throw signalError("String delimiter '" + c + "' is whitespace or a bracket character");
                }
            }
            for (final var c : separators) {
                checkStructuralCharacter(c, "Separator");
            }
            for (final var c : sequences) {
                checkStructuralCharacter(c, "Sequence");
                if (separators.contains(c)) {
                    throw signalError("Character '" + c + "' is both a separator and a sequence character");
                }
            }
        }

        private void checkStructuralCharacter(final char c, final String role) {
            if (Character.isWhitespace(c) || isDelimiterCharacter(c) || isStringOpener(c)) {
                throw signalError(role + " character '" + c + "' is whitespace, a bracket or a string delimiter");
            }
        }

        private void validateSymbols() {
            final var categories = new HashMap<String, EnumSet<SymbolCategory>>();
            for (final var symbol : prefixGlue.values()) {
                assign(categories, symbol, SymbolCategory.PREFIX_GLUE);
            }
            for (final var symbol : suffixGlue.values()) {
                assign(categories, symbol, SymbolCategory.SUFFIX_GLUE);
            }
            for (final var symbol : infixSymbols) {
                assign(categories, symbol, SymbolCategory.INFIX);
            }
            for (final var symbol : leftAssociativeSymbols) {
                assign(categories, symbol, SymbolCategory.ASSOCIATIVE_LEFT);
            }
            for (final var symbol : rightAssociativeSymbols) {
                assign(categories, symbol, SymbolCategory.ASSOCIATIVE_RIGHT);
            }
            for (final var rule : triggers.values()) {
                assign(categories, rule.symbol(), SymbolCategory.TRIGGER);
            }
            for (final var c : separators) {
                assign(categories, String.valueOf(c), SymbolCategory.SEPARATOR);
            }
            for (final var c : sequences) {
                assign(categories, String.valueOf(c), SymbolCategory.SEQUENCE);
            }
            for (final var entry : categories.entrySet()) {
                final var symbol = entry.getKey();
                final var assigned = entry.getValue();
                if (assigned.contains(SymbolCategory.SEPARATOR) || assigned.contains(SymbolCategory.SEQUENCE)) {
                    continue;
                }
                checkSymbolText(symbol);
            }
            if (typeTagSymbol != null && !suffixGlue.containsValue(typeTagSymbol)) {
                throw signalError("Type tag symbol \"" + typeTagSymbol + "\" is not a suffix glue symbol");
            }
        }

        private void assign(
            final Map<String, EnumSet<SymbolCategory>> categories,
            final String symbol,
            final SymbolCategory category
        ) {
            final var assigned = categories.computeIfAbsent(symbol, key -> EnumSet.noneOf(SymbolCategory.class));
            for (final var existing : assigned) {
                if (!existing.compatibleWith(category)) {
                    throw signalError(
                        "Symbol \"" + symbol + "\" is configured both as " + existing.displayName()
                            + " and as " + category.displayName());
                }
            }
            assigned.add(category);
        }

        private void checkSymbolText(final String symbol) {
            if (symbol.isEmpty()) {
                throw signalError("Empty symbols are not allowed");
            }
            for (int i = 0; i < symbol.length(); i += 1) {
                final var c = symbol.charAt(i);
                if (Character.isWhitespace(c) || isDelimiterCharacter(c) || isStringOpener(c)
                    || separators.contains(c) || sequences.contains(c)) {
                    throw signalError("Symbol \"" + symbol + "\" contains the word-breaking character '" + c + "'");
                }
            }
        }

        private void validateTriggers() {
            final var symbols = new HashSet<String>();
            for (final var rule : triggers.values()) {
                if (!symbols.add(rule.symbol())) {
                    throw signalError("Trigger symbol \"" + rule.symbol() + "\" is used by more than one context kind");
                }
                requireConfigured(rule.materializer(), rule.kind().name().toLowerCase() + " materializer");
            }
        }

        private void validatePrefixes() {
            if (commentPrefix == null || commentPrefix.isEmpty()) {
                throw signalError("The comment prefix is not set");
            }
            if (directivePrefix == null || directivePrefix.isEmpty()) {
                throw signalError("The directive prefix is not set");
            }
            for (final var prefix : List.of(commentPrefix, directivePrefix)) {
                for (int i = 0; i < prefix.length(); i += 1) {
                    if (configuredBreak(prefix.charAt(i))) {
                        throw signalError("Prefix \"" + prefix + "\" contains a word-breaking character");
                    }
                }
            }
        }

        private void validateSiblingGroups() {
            final var openers = new HashSet<String>();
            for (final var group : siblingGroups.values()) {
                final var keywords = group.keywords();
                if (keywords.size() < 2) {
                    throw signalError("Sibling group \"" + group.name() + "\" needs at least two keywords");
                }
                if (new LinkedHashSet<>(keywords).size() != keywords.size()) {
                    throw signalError("Sibling group \"" + group.name() + "\" repeats a keyword");
                }
                if (!openers.add(group.opener())) {
                    throw signalError("Keyword \"" + group.opener() + "\" opens more than one sibling group");
                }
                for (final var keyword : keywords) {
                    checkSymbolText(keyword);
                    if (isConfiguredSymbol(keyword)) {
                        throw signalError("Sibling keyword \"" + keyword + "\" is also a configured symbol");
                    }
                }
            }
        }

        private boolean isConfiguredSymbol(final String text) {
            if (prefixGlue.containsValue(text) || suffixGlue.containsValue(text) || infixSymbols.contains(text)
                || leftAssociativeSymbols.contains(text) || rightAssociativeSymbols.contains(text)) {
                return true;
            }
            for (final var rule : triggers.values()) {
                if (rule.symbol().equals(text)) {
                    return true;
                }
            }
            return false;
        }

        private void requireConfigured(final Delimiter delimiter, final String role) {
            if (!delimiters.contains(delimiter)) {
                throw signalError("The " + role + " delimiter " + delimiter + " is not a configured pair");
            }
        }

        private boolean isDelimiterCharacter(final char c) {
            for (final var delimiter : delimiters) {
                if (delimiter.open() == c || delimiter.close() == c) {
                    return true;
                }
            }
            return false;
        }

        private boolean isStringOpener(final char c) {
            return stringDelimiters != null && stringDelimiters.kindOpenedBy(c) != null;
        }

        private boolean configuredBreak(final char c) {
            return Character.isWhitespace(c) || isDelimiterCharacter(c) || isStringOpener(c)
                || separators.contains(c) || sequences.contains(c);
        }

        private static void putNamed(
            final Map<String, String> map,
            final String category,
            final String name,
            final String symbol
        ) {
            if (map.containsKey(name)) {
                throw signalError("The " + category + " name \"" + name + "\" is declared twice");
            }
            map.put(name, symbol);
        }

        private static UnhandledErrorError signalError(final String message) {
            throw ConditionContext.error(new ConfigurationErrorCondition(message));
        }

        private final List<Delimiter> delimiters = new ArrayList<>();
        private @Nullable Delimiter applicationDelimiter = null;
        private @Nullable Delimiter structDelimiter = null;
        private @Nullable Delimiter binaryDelimiter = null;
        private final Map<String, String> prefixGlue = new LinkedHashMap<>();
        private final Map<String, String> suffixGlue = new LinkedHashMap<>();
        private @Nullable String typeTagSymbol = null;
        private final Set<String> infixSymbols = new LinkedHashSet<>();
        private final Set<String> leftAssociativeSymbols = new LinkedHashSet<>();
        private final Set<String> rightAssociativeSymbols = new LinkedHashSet<>();
        private final EnumMap<TriggerKind, TriggerRule> triggers = new EnumMap<>(TriggerKind.class);
        private final Set<Character> separators = new LinkedHashSet<>();
        private final Set<Character> sequences = new LinkedHashSet<>();
        private @Nullable StringDelimiters stringDelimiters = null;
        private @Nullable String commentPrefix = null;
        private @Nullable String directivePrefix = null;
        private final Map<String, SiblingGroup> siblingGroups = new LinkedHashMap<>();
    }
}
