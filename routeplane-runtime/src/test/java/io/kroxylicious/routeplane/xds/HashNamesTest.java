/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.HealthCheckPolicy;
import io.kroxylicious.routeplane.dag.Service;

import static org.assertj.core.api.Assertions.assertThat;

class HashNamesTest {

    private static final Service KUARD = new Service(ResourceId.of("default", "kuard"), 8080, "http", "", Service.CircuitBreakers.NONE);

    @Test
    void shortNamesAreJoined() {
        assertThat(HashNames.hashname(60, "default", "kuard", "8080")).isEqualTo("default/kuard/8080");
    }

    @Test
    void longNamesAreTruncatedFromTheLastPart() {
        // when
        String name = HashNames.hashname(20, "a".repeat(30), "b");

        // then
        assertThat(name).hasSizeLessThan(20).matches("aaaa[0-9a-f]{6}/b");
    }

    @Test
    void nameThatCannotFitBecomesTheHash() {
        // when
        String name = HashNames.hashname(5, "abcdefgh", "ijklmnop");

        // then
        assertThat(name).matches("[0-9a-f]{5}");
    }

    @Test
    void truncationIsStable() {
        String name = "x".repeat(100);
        assertThat(HashNames.hashname(60, name)).isEqualTo(HashNames.hashname(60, name));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0s",
            "5, 5s",
            "90, 1m30s",
            "3600, 1h0m0s",
            "3725, 1h2m5s"
    })
    void goDuration(long seconds, String expected) {
        assertThat(HashNames.goDuration(seconds)).isEqualTo(expected);
    }

    @Test
    void clusterNameOfPlainCluster() {
        // given
        Cluster cluster = new Cluster(KUARD, 0, null, null, null, "", null);

        // when
        String name = HashNames.clusterName(cluster);

        // then
        // the hash of no settings is the hash of the empty string
        assertThat(name).isEqualTo("default/kuard/8080/da39a3ee5e");
    }

    @Test
    void weightDoesNotChangeClusterName() {
        assertThat(HashNames.clusterName(new Cluster(KUARD, 10, null, null, null, "", null)))
                .isEqualTo(HashNames.clusterName(new Cluster(KUARD, 90, null, null, null, "", null)));
    }

    @Test
    void settingsChangeClusterName() {
        // given
        Cluster plain = new Cluster(KUARD, 0, null, null, null, "", null);
        Cluster random = new Cluster(KUARD, 0, "Random", null, null, "", null);
        Cluster checked = new Cluster(KUARD, 0, null,
                new HealthCheckPolicy("/healthz", null, Duration.ofSeconds(5), Duration.ofSeconds(2), 3, 2), null, "", null);

        // when
        String plainName = HashNames.clusterName(plain);
        String randomName = HashNames.clusterName(random);
        String checkedName = HashNames.clusterName(checked);

        // then
        assertThat(plainName).isNotEqualTo(randomName).isNotEqualTo(checkedName);
        assertThat(randomName).startsWith("default/kuard/8080/").isNotEqualTo(checkedName);
    }

    @Test
    void altStatName() {
        assertThat(HashNames.altStatName(KUARD)).isEqualTo("default_kuard_8080");
    }

    @Test
    void virtualHostName() {
        assertThat(HashNames.virtualHostName("example.com")).isEqualTo("example.com");
        assertThat(HashNames.virtualHostName("a".repeat(80))).hasSizeLessThan(60);
    }
}
