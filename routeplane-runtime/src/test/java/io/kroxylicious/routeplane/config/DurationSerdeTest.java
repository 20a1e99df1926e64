/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class DurationSerdeTest {

    private static final Duration ONE_OF_EACH_UNIT = Duration.ofDays(1).plusHours(1).plusMinutes(1).plusSeconds(1).plusMillis(1).plus(1, ChronoUnit.MICROS).plusNanos(1);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private record Holdoff(@JsonDeserialize(using = DurationSerde.Deserializer.class) @JsonSerialize(using = DurationSerde.Serializer.class) Duration delay) {

    }

    static Stream<Arguments> parse() {
        return Stream.of(argumentSet("milliseconds", "100ms", Duration.ofMillis(100)),
                argumentSet("seconds", "120s", Duration.ofSeconds(120)),
                argumentSet("hours and minutes", "1h30m", Duration.ofMinutes(90)),
                argumentSet("microseconds", "5us", Duration.of(5, ChronoUnit.MICROS)),
                argumentSet("microseconds (alternate)", "5μs", Duration.of(5, ChronoUnit.MICROS)),
                argumentSet("one of each", "1d1h1m1s1ms1us1ns", ONE_OF_EACH_UNIT),
                argumentSet("negative", "-5s", Duration.ofSeconds(-5)),
                argumentSet("zeros", "0h0m0s", Duration.ZERO));
    }

    @MethodSource
    @ParameterizedTest
    void parse(String text, Duration expected) {
        assertThat(DurationSerde.parse(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "", " ", "-", "5", "1s1h", "1 s", "infinity", "106751991167301d" })
    void parseInvalid(String text) {
        assertThatThrownBy(() -> DurationSerde.parse(text))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid duration string: '" + text + "'");
    }

    static Stream<Arguments> format() {
        return Stream.of(argumentSet("zero", Duration.ZERO, "0ms"),
                argumentSet("uses largest units", Duration.ofSeconds(60), "1m"),
                argumentSet("holdoff", Duration.ofMillis(500), "500ms"),
                argumentSet("one of each", ONE_OF_EACH_UNIT, "1d1h1m1s1ms1μs1ns"),
                argumentSet("negative", Duration.ofSeconds(-90), "-1m30s"));
    }

    @MethodSource
    @ParameterizedTest
    void format(Duration duration, String expected) {
        assertThat(DurationSerde.format(duration)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "250ms", "1h30m", "-1d1h", "7μs" })
    void serializedFormParsesBack(String text) throws IOException {
        Holdoff holdoff = MAPPER.readValue("{\"delay\": \"" + text + "\"}", Holdoff.class);
        String serialized = MAPPER.writeValueAsString(holdoff);
        assertThat(MAPPER.readValue(serialized, Holdoff.class)).isEqualTo(holdoff);
    }

    static Stream<Arguments> deserializeInvalid() {
        return Stream.of(argumentSet("number", "55", "Invalid serialized duration. Expected a string value, but was VALUE_NUMBER_INT"),
                argumentSet("array", "[]", "Invalid serialized duration. Expected a string value, but was START_ARRAY"),
                argumentSet("unit out of order", "\"1s1h\"", "Invalid duration string: '1s1h'. " + DurationSerde.USAGE));
    }

    @MethodSource
    @ParameterizedTest
    void deserializeInvalid(String json, String expectedMessage) {
        String input = "{\"delay\": " + json + "}";
        assertThatThrownBy(() -> MAPPER.readValue(input, Holdoff.class))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining(expectedMessage);
    }
}
