package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.ClassificationGroup;

import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A single step of the classification table: when {@code predicate} accepts the
 * trimmed classification string, the meteorite belongs to {@code group}.
 *
 * @param description human-readable form of the predicate, used in logs and tests
 * @param predicate   test applied to a non-blank, trimmed classification
 * @param group       group assigned on match
 */
public record ClassificationRule(String description,
                                 Predicate<String> predicate,
                                 ClassificationGroup group) {

    public boolean matches(final String classification) {
        return predicate.test(classification);
    }

    static ClassificationRule prefix(final String prefix, final ClassificationGroup group) {
        return new ClassificationRule("prefix '" + prefix + "'", value -> value.startsWith(prefix), group);
    }

    /**
     * Matches a bare type letter (or letter pair) that is not the start of a longer word,
     * e.g. {@code L} accepts "L6", "L/LL4" and "L-imp melt" but not "Lunar" or "Lodranite".
     */
    static ClassificationRule typeSymbol(final String symbol, final ClassificationGroup group) {
        final var pattern = Pattern.compile("^" + Pattern.quote(symbol) + "(?![a-z])");
        return new ClassificationRule("type symbol '" + symbol + "'", value -> pattern.matcher(value).find(), group);
    }

    static ClassificationRule exact(final Set<String> tokens, final ClassificationGroup group) {
        return new ClassificationRule("one of " + tokens, tokens::contains, group);
    }
}
