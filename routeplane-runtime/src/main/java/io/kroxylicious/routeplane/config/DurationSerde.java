/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

/**
 * Reads and writes durations in the compact {@code 1h30m} form used by configuration files and
 * by the timeout fields of routing resources.
 */
public class DurationSerde {

    // note that micros is special, allowing μs or us
    private static final Pattern PATTERN = Pattern.compile("(?<sign>-)?(?:(?<days>\\d+)d)?(?:(?<hours>\\d+)h)?(?:(?<minutes>\\d+)m)?"
            + "(?:(?<seconds>\\d+)s)?(?:(?<millis>\\d+)ms)?(?:(?<micros>\\d+)[μu]s)?(?:(?<nanos>\\d+)ns)?");

    static final String USAGE = "Expected a string time duration such as \"1h30m\", or \"120s\"; supported units are d, h, m, s, ms, μs (or us) and ns.";

    private static final List<Unit> UNITS = List.of(new Unit(ChronoUnit.DAYS, "days", "d"),
            new Unit(ChronoUnit.HOURS, "hours", "h"),
            new Unit(ChronoUnit.MINUTES, "minutes", "m"),
            new Unit(ChronoUnit.SECONDS, "seconds", "s"),
            new Unit(ChronoUnit.MILLIS, "millis", "ms"),
            new Unit(ChronoUnit.MICROS, "micros", "μs"),
            new Unit(ChronoUnit.NANOS, "nanos", "ns"));

    private DurationSerde() {
        // prevent construction
    }

    private record Unit(ChronoUnit unit, String groupName, String serializedUnit) {

        Duration duration(long amount) {
            try {
                return Duration.of(amount, unit);
            }
            catch (ArithmeticException e) {
                throw new DurationArithmeticException(amount + " " + unit + " could not be converted to a Duration", e);
            }
        }
    }

    /**
     * Parses a duration string.
     *
     * @param text the duration, for example {@code 1h30m}, {@code 250ms} or {@code -5s}
     * @return the duration
     * @throws IllegalArgumentException if the text is not a valid duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank() || text.equals("-")) {
            throw new IllegalArgumentException("Invalid duration string: '" + text + "'. " + USAGE);
        }
        Matcher matcher = PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration string: '" + text + "'. " + USAGE);
        }
        boolean negated = matcher.group("sign") != null;
        try {
            return UNITS.stream().flatMap(unit -> Optional.ofNullable(matcher.group(unit.groupName()))
                    .stream()
                    .map(amount -> unit.duration(parseAmount(amount))))
                    .reduce(Duration.ZERO, negated ? DurationSerde::minus : DurationSerde::plus);
        }
        catch (DurationArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration string: '" + text + "'. Likely it is too large to be converted to Duration: " + e.getMessage(), e);
        }
    }

    /**
     * Formats a duration in the form accepted by {@link #parse(String)}.
     *
     * @param value the duration
     * @return the formatted duration
     */
    public static String format(Duration value) {
        if (value.isZero()) {
            return "0ms";
        }
        StringBuilder result = new StringBuilder();
        Duration temp = value;
        if (temp.isNegative()) {
            result.append("-");
        }
        for (Unit unit : UNITS) {
            long wholeUnits = temp.dividedBy(unit.duration(1));
            temp = temp.minus(wholeUnits, unit.unit());
            if (wholeUnits != 0) {
                result.append(Math.abs(wholeUnits));
                result.append(unit.serializedUnit());
            }
        }
        return result.toString();
    }

    private static long parseAmount(String amount) {
        try {
            return Long.parseLong(amount);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration string: '" + amount + "', could not be parsed as long", e);
        }
    }

    private static Duration minus(Duration a, Duration b) {
        try {
            return a.minus(b);
        }
        catch (ArithmeticException e) {
            throw new DurationArithmeticException(a + " minus " + b + " failed", e);
        }
    }

    private static Duration plus(Duration a, Duration b) {
        try {
            return a.plus(b);
        }
        catch (ArithmeticException e) {
            throw new DurationArithmeticException(a + " plus " + b + " failed", e);
        }
    }

    private static class DurationArithmeticException extends RuntimeException {
        DurationArithmeticException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class Deserializer extends StdScalarDeserializer<Duration> {

        public Deserializer() {
            super(Duration.class);
        }

        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                throw new JsonParseException(p, "Invalid serialized duration. Expected a string value, but was " + p.currentToken());
            }
            try {
                return parse(p.getText());
            }
            catch (IllegalArgumentException e) {
                throw new JsonParseException(p, e.getMessage(), e);
            }
        }
    }

    public static class Serializer extends StdScalarSerializer<Duration> {

        public Serializer() {
            super(Duration.class);
        }

        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }
}
