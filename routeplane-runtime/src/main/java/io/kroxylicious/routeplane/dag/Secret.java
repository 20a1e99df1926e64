/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.TlsSecret;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Certificate material referenced from the graph, either a serving certificate or a CA bundle.
 */
public record Secret(ResourceId id, Map<String, String> data) implements Vertex {

    public Secret {
        Objects.requireNonNull(id, "id cannot be null");
        data = Map.copyOf(data);
    }

    static Secret of(TlsSecret secret) {
        return new Secret(secret.id(), secret.data());
    }

    @Nullable
    public String certificateChain() {
        return data.get(TlsSecret.CERTIFICATE_KEY);
    }

    @Nullable
    public String privateKey() {
        return data.get(TlsSecret.PRIVATE_KEY_KEY);
    }

    @Nullable
    public String caBundle() {
        return data.get(TlsSecret.CA_KEY);
    }

    /**
     * @return the secret's entries concatenated in key order, the input to its content hash
     */
    public byte[] contentBytes() {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(data).forEach((k, v) -> sb.append(v));
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public VertexKind kind() {
        return VertexKind.SECRET;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        // leaf
    }
}
