/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.kroxylicious.routeplane.Fixtures;
import io.kroxylicious.routeplane.api.ClientValidationSpec;
import io.kroxylicious.routeplane.api.InMemoryEntitySnapshot;
import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.RouteSpec;
import io.kroxylicious.routeplane.api.ServiceSpec;
import io.kroxylicious.routeplane.api.TlsSecret;
import io.kroxylicious.routeplane.api.TlsSpec;
import io.kroxylicious.routeplane.dag.BuilderOptions;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.DagBuilder;
import io.kroxylicious.routeplane.dag.Secret;
import io.kroxylicious.routeplane.xds.SecretResource;

import static io.kroxylicious.routeplane.Fixtures.caSecret;
import static io.kroxylicious.routeplane.Fixtures.secureRoot;
import static io.kroxylicious.routeplane.Fixtures.service;
import static io.kroxylicious.routeplane.Fixtures.servingSecret;
import static org.assertj.core.api.Assertions.assertThat;

class SecretVisitorTest {

    @Test
    void servingAndCaSecretsOfSecureHost() {
        // given
        TlsSpec tls = new TlsSpec("cert", null, null, false, false, new ClientValidationSpec("ca"));
        Dag dag = new DagBuilder(BuilderOptions.defaults()).build(InMemoryEntitySnapshot.builder()
                .addIngressRoutes(secureRoot("roots", "example", "example.com", tls, RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))))
                .addServices(service("roots", "kuard", 8080))
                .addSecrets(servingSecret("roots", "cert"), caSecret("roots", "ca"), servingSecret("roots", "unused"))
                .build()).dag();

        // when
        Map<String, SecretResource> secrets = SecretVisitor.visit(dag);

        // then
        assertThat(secrets).hasSize(2);
        assertThat(secrets.values()).filteredOn(SecretResource::isValidationContext).singleElement().satisfies(ca -> {
            assertThat(ca.name()).startsWith("roots/ca/");
            assertThat(ca.trustedCa()).isEqualTo(Fixtures.CA);
            assertThat(ca.certificateChain()).isNull();
        });
        assertThat(secrets.values()).filteredOn(s -> !s.isValidationContext()).singleElement().satisfies(cert -> {
            assertThat(cert.name()).startsWith("roots/cert/");
            assertThat(cert.certificateChain()).isEqualTo(Fixtures.CERTIFICATE);
            assertThat(cert.privateKey()).isEqualTo(Fixtures.PRIVATE_KEY);
        });
    }

    @Test
    void changedContentChangesName() {
        // given
        Secret before = new Secret(ResourceId.of("roots", "cert"), Map.of(TlsSecret.CERTIFICATE_KEY, "a", TlsSecret.PRIVATE_KEY_KEY, "b"));
        Secret after = new Secret(ResourceId.of("roots", "cert"), Map.of(TlsSecret.CERTIFICATE_KEY, "c", TlsSecret.PRIVATE_KEY_KEY, "b"));

        // when
        SecretResource first = SecretVisitor.toResource(before);
        SecretResource second = SecretVisitor.toResource(after);

        // then
        assertThat(first.name()).isNotEqualTo(second.name());
    }

    @Test
    void toStringOmitsKeyMaterial() {
        // given
        SecretResource resource = SecretVisitor.toResource(new Secret(ResourceId.of("roots", "cert"),
                Map.of(TlsSecret.CERTIFICATE_KEY, Fixtures.CERTIFICATE, TlsSecret.PRIVATE_KEY_KEY, Fixtures.PRIVATE_KEY)));

        // when
        String text = resource.toString();

        // then
        assertThat(text).doesNotContain(Fixtures.PRIVATE_KEY).contains(resource.name());
    }

    @Test
    void emptyGraphHasNoSecrets() {
        assertThat(SecretVisitor.visit(Dag.empty())).isEmpty();
    }
}
