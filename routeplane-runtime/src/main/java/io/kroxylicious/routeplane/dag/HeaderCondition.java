/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.kroxylicious.routeplane.api.HeaderMatchSpec;

/**
 * A condition on a request header that a route requires.
 *
 * @param name header name
 * @param matchType how the value is compared
 * @param value value to compare against, empty for {@link MatchType#PRESENT}
 * @param invert negate the condition
 */
public record HeaderCondition(String name, MatchType matchType, String value, boolean invert) implements Comparable<HeaderCondition> {

    /**
     * Declared in the lexical order of their names, which is the order conditions sort in.
     */
    public enum MatchType {
        CONTAINS,
        EXACT,
        PRESENT
    }

    static final String DUPLICATE_EXACT_MATCH = "cannot specify duplicate header 'exact match' conditions in the same route";

    private static final Comparator<HeaderCondition> ORDER = Comparator.comparing(HeaderCondition::name)
            .thenComparing(HeaderCondition::matchType)
            .thenComparing(HeaderCondition::value);

    public HeaderCondition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(matchType, "matchType cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public int compareTo(HeaderCondition o) {
        return ORDER.compare(this, o);
    }

    /**
     * Checks that no header name carries more than one exact match, ignoring case.
     *
     * @param matches the header matches of one route
     * @return the error, if any
     */
    static Optional<String> validate(List<HeaderMatchSpec> matches) {
        Set<String> exactNames = new HashSet<>();
        for (HeaderMatchSpec match : matches) {
            if (notEmpty(match.exact()) && !exactNames.add(match.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(DUPLICATE_EXACT_MATCH);
            }
        }
        return Optional.empty();
    }

    /**
     * Converts header matches into conditions. A match that sets no field is dropped; a match that
     * sets several uses the first of present, contains, notContains, exact, notExact.
     */
    static List<HeaderCondition> merge(List<HeaderMatchSpec> matches) {
        List<HeaderCondition> conditions = new ArrayList<>();
        for (HeaderMatchSpec match : matches) {
            if (match.present()) {
                conditions.add(new HeaderCondition(match.name(), MatchType.PRESENT, "", false));
            }
            else if (notEmpty(match.contains())) {
                conditions.add(new HeaderCondition(match.name(), MatchType.CONTAINS, match.contains(), false));
            }
            else if (notEmpty(match.notContains())) {
                conditions.add(new HeaderCondition(match.name(), MatchType.CONTAINS, match.notContains(), true));
            }
            else if (notEmpty(match.exact())) {
                conditions.add(new HeaderCondition(match.name(), MatchType.EXACT, match.exact(), false));
            }
            else if (notEmpty(match.notExact())) {
                conditions.add(new HeaderCondition(match.name(), MatchType.EXACT, match.notExact(), true));
            }
        }
        return List.copyOf(conditions);
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
