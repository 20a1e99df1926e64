/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.annotation.concurrent.ThreadSafe;

/**
 * An {@link EntitySnapshot} backed by immutable maps.
 */
@ThreadSafe
public final class InMemoryEntitySnapshot implements EntitySnapshot, EntityStore {

    private static final InMemoryEntitySnapshot EMPTY = builder().build();

    private final Map<ResourceId, IngressRoute> ingressRoutes;
    private final Map<ResourceId, BackendService> services;
    private final Map<ResourceId, ServiceEndpoints> endpoints;
    private final Map<ResourceId, TlsSecret> secrets;
    private final Map<ResourceId, CertificateDelegation> certificateDelegations;

    private InMemoryEntitySnapshot(Builder builder) {
        this.ingressRoutes = Collections.unmodifiableMap(new TreeMap<>(builder.ingressRoutes));
        this.services = Map.copyOf(builder.services);
        this.endpoints = Map.copyOf(builder.endpoints);
        this.secrets = Map.copyOf(builder.secrets);
        this.certificateDelegations = Collections.unmodifiableMap(new TreeMap<>(builder.certificateDelegations));
    }

    public static InMemoryEntitySnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder seeded with the contents of this snapshot
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.ingressRoutes.putAll(ingressRoutes);
        builder.services.putAll(services);
        builder.endpoints.putAll(endpoints);
        builder.secrets.putAll(secrets);
        builder.certificateDelegations.putAll(certificateDelegations);
        return builder;
    }

    @Override
    public EntitySnapshot snapshot() {
        return this;
    }

    @Override
    public Collection<IngressRoute> ingressRoutes() {
        return ingressRoutes.values();
    }

    @Override
    public Optional<IngressRoute> ingressRoute(ResourceId id) {
        return Optional.ofNullable(ingressRoutes.get(id));
    }

    @Override
    public Optional<BackendService> service(ResourceId id) {
        return Optional.ofNullable(services.get(id));
    }

    @Override
    public Optional<ServiceEndpoints> endpoints(ResourceId id) {
        return Optional.ofNullable(endpoints.get(id));
    }

    @Override
    public Optional<TlsSecret> secret(ResourceId id) {
        return Optional.ofNullable(secrets.get(id));
    }

    @Override
    public Collection<CertificateDelegation> certificateDelegations() {
        return certificateDelegations.values();
    }

    public static final class Builder {
        private final Map<ResourceId, IngressRoute> ingressRoutes = new TreeMap<>();
        private final Map<ResourceId, BackendService> services = new TreeMap<>();
        private final Map<ResourceId, ServiceEndpoints> endpoints = new TreeMap<>();
        private final Map<ResourceId, TlsSecret> secrets = new TreeMap<>();
        private final Map<ResourceId, CertificateDelegation> certificateDelegations = new TreeMap<>();

        private Builder() {
        }

        public Builder addIngressRoutes(IngressRoute... routes) {
            for (IngressRoute route : routes) {
                ingressRoutes.put(route.id(), route);
            }
            return this;
        }

        public Builder removeIngressRoute(ResourceId id) {
            ingressRoutes.remove(id);
            return this;
        }

        public Builder addServices(BackendService... backends) {
            services.putAll(index(backends, BackendService::id));
            return this;
        }

        public Builder addEndpoints(ServiceEndpoints... eps) {
            endpoints.putAll(index(eps, ServiceEndpoints::id));
            return this;
        }

        public Builder addSecrets(TlsSecret... tlsSecrets) {
            secrets.putAll(index(tlsSecrets, TlsSecret::id));
            return this;
        }

        public Builder addCertificateDelegations(CertificateDelegation... delegations) {
            certificateDelegations.putAll(index(delegations, CertificateDelegation::id));
            return this;
        }

        public InMemoryEntitySnapshot build() {
            return new InMemoryEntitySnapshot(this);
        }

        private static <T> Map<ResourceId, T> index(T[] items, Function<T, ResourceId> id) {
            return Arrays.stream(items).collect(Collectors.toMap(id, Function.identity(), (a, b) -> b));
        }
    }
}
