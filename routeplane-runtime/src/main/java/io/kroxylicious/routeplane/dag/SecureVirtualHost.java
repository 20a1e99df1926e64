/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Objects;
import java.util.function.Consumer;

import javax.annotation.concurrent.NotThreadSafe;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The TLS routing table of a fully qualified domain name, together with what is needed to terminate
 * or pass through TLS for it.
 */
@NotThreadSafe
public final class SecureVirtualHost implements Vertex {

    private final VirtualHost virtualHost;
    private @Nullable Secret secret;
    private TlsVersion minTlsVersion = TlsVersion.TLS_1_1;
    private TlsVersion maxTlsVersion = TlsVersion.TLS_1_3;
    private @Nullable Secret fallbackCertificate;
    private @Nullable PeerValidationContext downstreamValidation;
    private @Nullable TcpProxy tcpProxy;

    public SecureVirtualHost(String name) {
        this.virtualHost = new VirtualHost(name);
    }

    public String name() {
        return virtualHost.name();
    }

    public VirtualHost virtualHost() {
        return virtualHost;
    }

    public void addRoute(Route route) {
        virtualHost.addRoute(route);
    }

    /**
     * @return the serving certificate, {@code null} when TLS is passed through
     */
    public @Nullable Secret secret() {
        return secret;
    }

    void setSecret(Secret secret) {
        this.secret = Objects.requireNonNull(secret);
    }

    public TlsVersion minTlsVersion() {
        return minTlsVersion;
    }

    void setMinTlsVersion(TlsVersion minTlsVersion) {
        this.minTlsVersion = minTlsVersion;
    }

    public TlsVersion maxTlsVersion() {
        return maxTlsVersion;
    }

    void setMaxTlsVersion(TlsVersion maxTlsVersion) {
        this.maxTlsVersion = maxTlsVersion;
    }

    /**
     * @return the certificate served to clients that send no SNI, {@code null} if not enabled
     */
    public @Nullable Secret fallbackCertificate() {
        return fallbackCertificate;
    }

    void setFallbackCertificate(Secret fallbackCertificate) {
        this.fallbackCertificate = fallbackCertificate;
    }

    public @Nullable PeerValidationContext downstreamValidation() {
        return downstreamValidation;
    }

    void setDownstreamValidation(PeerValidationContext downstreamValidation) {
        this.downstreamValidation = downstreamValidation;
    }

    public @Nullable TcpProxy tcpProxy() {
        return tcpProxy;
    }

    void setTcpProxy(TcpProxy tcpProxy) {
        this.tcpProxy = tcpProxy;
    }

    /**
     * A secure virtual host is served if it terminates TLS for some routes, or if it proxies TCP.
     */
    public boolean isValid() {
        return (secret != null && virtualHost.isValid()) || tcpProxy != null;
    }

    @Override
    public VertexKind kind() {
        return VertexKind.SECURE_VIRTUAL_HOST;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        virtualHost.visitChildren(consumer);
        if (tcpProxy != null) {
            consumer.accept(tcpProxy);
        }
        if (secret != null) {
            consumer.accept(secret);
        }
        if (fallbackCertificate != null) {
            consumer.accept(fallbackCertificate);
        }
        if (downstreamValidation != null) {
            consumer.accept(downstreamValidation.caCertificate());
        }
    }

    @Override
    public String toString() {
        return "SecureVirtualHost[" + name() + ", passthrough=" + (secret == null) + ", tcpProxy=" + (tcpProxy != null) + "]";
    }
}
