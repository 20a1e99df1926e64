/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEntitySnapshotTest {

    @Test
    void ingressRoutesAreOrderedById() {
        // given
        var b = new IngressRoute(ResourceId.of("ns", "b"), null, List.of(), null);
        var a = new IngressRoute(ResourceId.of("ns", "a"), null, List.of(), null);

        // when
        var snapshot = InMemoryEntitySnapshot.builder().addIngressRoutes(b, a).build();

        // then
        assertThat(snapshot.ingressRoutes()).containsExactly(a, b);
        assertThat(snapshot.ingressRoute(a.id())).contains(a);
    }

    @Test
    void builderChangesDoNotLeakIntoEarlierSnapshots() {
        // given
        var route = new IngressRoute(ResourceId.of("ns", "a"), null, List.of(), null);
        var first = InMemoryEntitySnapshot.builder().addIngressRoutes(route).build();

        // when
        var second = first.toBuilder().removeIngressRoute(route.id())
                .addServices(new BackendService(ResourceId.of("ns", "svc"), List.of(ServicePort.of("http", 80)), Map.of()))
                .build();

        // then
        assertThat(first.ingressRoutes()).containsExactly(route);
        assertThat(first.service(ResourceId.of("ns", "svc"))).isEmpty();
        assertThat(second.ingressRoutes()).isEmpty();
        assertThat(second.service(ResourceId.of("ns", "svc"))).isPresent();
    }
}
