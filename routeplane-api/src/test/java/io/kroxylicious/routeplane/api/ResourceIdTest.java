/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class ResourceIdTest {

    static Stream<Arguments> parse() {
        return Stream.of(argumentSet("bare name", "secret", ResourceId.of("default", "secret")),
                argumentSet("qualified", "kube-system/secret", ResourceId.of("kube-system", "secret")),
                argumentSet("only first slash splits", "a/b/c", ResourceId.of("a", "b/c")));
    }

    @ParameterizedTest
    @MethodSource
    void parse(String reference, ResourceId expected) {
        assertThat(ResourceId.parse(reference, "default")).isEqualTo(expected);
    }

    @Test
    void rendersNamespaceSlashName() {
        assertThat(ResourceId.of("roots", "example")).hasToString("roots/example");
    }

    @Test
    void ordersByNamespaceThenName() {
        // given
        var ids = List.of(ResourceId.of("b", "a"), ResourceId.of("a", "z"), ResourceId.of("a", "b"));

        // when
        var sorted = ids.stream().sorted().toList();

        // then
        assertThat(sorted).containsExactly(ResourceId.of("a", "b"), ResourceId.of("a", "z"), ResourceId.of("b", "a"));
    }

    @Test
    void rejectsNullName() {
        assertThatThrownBy(() -> new ResourceId("ns", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("name cannot be null");
    }
}
