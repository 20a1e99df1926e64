/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.routeplane.api.BackendService;
import io.kroxylicious.routeplane.api.CertificateDelegation;
import io.kroxylicious.routeplane.api.EntitySnapshot;
import io.kroxylicious.routeplane.api.IngressRoute;
import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.ResourceStatus;
import io.kroxylicious.routeplane.api.RouteSpec;
import io.kroxylicious.routeplane.api.ServicePort;
import io.kroxylicious.routeplane.api.ServiceSpec;
import io.kroxylicious.routeplane.api.TcpProxySpec;
import io.kroxylicious.routeplane.api.TlsSecret;
import io.kroxylicious.routeplane.api.TlsSpec;
import io.kroxylicious.routeplane.api.TracingSpec;
import io.kroxylicious.routeplane.api.UpstreamValidationSpec;
import io.kroxylicious.routeplane.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds the routing graph from a snapshot of resources.
 * <p>
 * Root resources (those that declare a virtual host) are processed in id order. Routes are followed
 * depth first through delegation edges; the chain of resources from the root to the one being
 * processed is carried explicitly so that an edge back into the chain is reported as a cycle instead
 * of being followed. Delegates that no root reaches are reported as orphaned.
 * </p>
 * <p>
 * A build is a pure function of the snapshot and the {@link BuilderOptions}. A problem with one
 * resource is recorded as that resource's status and never stops the pass.
 * </p>
 */
public class DagBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DagBuilder.class);

    @VisibleForTesting
    static final Duration MAX_IDLE_TIMEOUT = Duration.ofHours(1);

    private final BuilderOptions options;

    public DagBuilder(BuilderOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public BuildResult build(EntitySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        BuildResult result = new Pass(snapshot).run();
        result.statuses().stream()
                .filter(ResourceStatus::isInvalid)
                .forEach(status -> LOGGER.atDebug()
                        .setMessage("IngressRoute rejected")
                        .addKeyValue("resource", status.id())
                        .addKeyValue("vhost", status.vhost())
                        .addKeyValue("reason", status.description())
                        .log());
        return result;
    }

    /**
     * Tests whether a route's path extends the prefix inherited from the delegating route,
     * comparing whole path segments.
     */
    @VisibleForTesting
    static boolean matchesPathPrefix(String path, String prefix) {
        if (prefix.isEmpty()) {
            return true;
        }
        if (path.isEmpty()) {
            return false;
        }
        String p = path.endsWith("/") ? path : path + "/";
        String pre = prefix.endsWith("/") ? prefix : prefix + "/";
        return p.startsWith(pre);
    }

    private static String quote(@Nullable String s) {
        return "\"" + (s == null ? "" : s) + "\"";
    }

    private static String cycle(List<ResourceId> path, ResourceId target) {
        List<ResourceId> ids = new ArrayList<>(path);
        ids.add(target);
        return ids.stream().map(ResourceId::toString).collect(Collectors.joining(" -> "));
    }

    private static List<ResourceId> descend(List<ResourceId> ancestors, ResourceId id) {
        List<ResourceId> path = new ArrayList<>(ancestors.size() + 1);
        path.addAll(ancestors);
        path.add(id);
        return List.copyOf(path);
    }

    /**
     * The mutable state of a single build pass.
     */
    private final class Pass {
        private final EntitySnapshot snapshot;
        private final StatusRecorder recorder = new StatusRecorder();
        private final Map<ResourceId, IngressRoute> ingressRoutes = new TreeMap<>();
        private final Map<String, VirtualHost> virtualHosts = new TreeMap<>();
        private final Map<String, SecureVirtualHost> secureVirtualHosts = new TreeMap<>();
        private final Set<ResourceId> orphaned = new TreeSet<>();

        Pass(EntitySnapshot snapshot) {
            this.snapshot = snapshot;
            snapshot.ingressRoutes().forEach(ir -> ingressRoutes.put(ir.id(), ir));
        }

        BuildResult run() {
            for (IngressRoute ir : ingressRoutes.values()) {
                if (!ir.isRoot()) {
                    orphaned.add(ir.id());
                }
            }
            for (IngressRoute root : validRoots()) {
                computeRoot(root);
            }
            orphaned.forEach(recorder::orphaned);
            return new BuildResult(new Dag(List.copyOf(virtualHosts.values()), List.copyOf(secureVirtualHosts.values())),
                    recorder.statuses());
        }

        /**
         * Roots whose fqdn no other root claims. Every claimant of a shared fqdn is invalid.
         */
        private List<IngressRoute> validRoots() {
            Map<String, List<IngressRoute>> byFqdn = new TreeMap<>();
            for (IngressRoute ir : ingressRoutes.values()) {
                if (ir.isRoot()) {
                    byFqdn.computeIfAbsent(ir.virtualHost().fqdn(), k -> new ArrayList<>()).add(ir);
                }
            }
            List<IngressRoute> valid = new ArrayList<>();
            byFqdn.forEach((fqdn, claimants) -> {
                if (claimants.size() == 1) {
                    valid.add(claimants.get(0));
                    return;
                }
                String conflicting = claimants.stream()
                        .map(ir -> ir.id().toString())
                        .sorted()
                        .collect(Collectors.joining(", "));
                String message = "fqdn " + quote(fqdn) + " is used in multiple IngressRoutes: " + conflicting;
                claimants.forEach(ir -> recorder.invalid(ir.id(), message, fqdn));
            });
            valid.sort(Comparator.comparing(IngressRoute::id));
            return valid;
        }

        private void computeRoot(IngressRoute ir) {
            ResourceId id = ir.id();
            if (!options.rootAllowed(id.namespace())) {
                recorder.invalid(id, "root IngressRoute cannot be defined in this namespace", null);
                return;
            }
            String host = ir.virtualHost().fqdn();
            if (host.isBlank()) {
                recorder.invalid(id, "Spec.VirtualHost.Fqdn must be specified", null);
                return;
            }

            boolean enforceTls = false;
            boolean passthrough = false;
            TlsSpec tls = ir.virtualHost().tls();
            if (tls != null) {
                passthrough = !tls.hasSecretName() && tls.passthrough();
                if (!passthrough) {
                    try {
                        configureTls(ir, tls, host);
                    }
                    catch (InvalidResourceException e) {
                        recorder.invalid(id, e.getMessage(), host);
                        return;
                    }
                    enforceTls = true;
                }
            }

            if (ir.tcpProxy() != null && (passthrough || enforceTls)) {
                processTcpProxy(ir, List.of(), host);
            }
            processRoutes(ir, "", List.of(), host, ir.tcpProxy() == null && enforceTls);
        }

        private void configureTls(IngressRoute ir, TlsSpec tls, String host) {
            String namespace = ir.id().namespace();
            String secretName = tls.secretName() == null ? "" : tls.secretName();
            ResourceId secretId = ResourceId.parse(secretName, namespace);
            Secret secret;
            try {
                secret = servingSecret(secretId);
            }
            catch (InvalidResourceException e) {
                throw new InvalidResourceException("Spec.VirtualHost.TLS Secret " + quote(secretName) + " is invalid: " + e.getMessage());
            }
            if (!delegationPermitted(secretId, namespace)) {
                throw new InvalidResourceException("Spec.VirtualHost.TLS Secret " + quote(secretName) + " certificate delegation not permitted");
            }

            Secret fallback = null;
            if (tls.enableFallbackCertificate()) {
                if (tls.clientValidation() != null) {
                    throw new InvalidResourceException("Spec.VirtualHost.TLS fallback & client validation are incompatible");
                }
                ResourceId fallbackId = options.fallbackCertificate();
                if (fallbackId == null) {
                    throw new InvalidResourceException(
                            "Spec.VirtualHost.TLS enabled fallback but the fallback Certificate Secret is not configured in the control plane configuration");
                }
                try {
                    fallback = servingSecret(fallbackId);
                }
                catch (InvalidResourceException e) {
                    throw new InvalidResourceException("Spec.VirtualHost.TLS Secret " + quote(fallbackId.toString()) + " fallback certificate is invalid: " + e.getMessage());
                }
            }

            PeerValidationContext downstreamValidation = null;
            if (tls.clientValidation() != null) {
                String caName = tls.clientValidation().caSecret();
                try {
                    downstreamValidation = new PeerValidationContext(caSecret(ResourceId.of(namespace, caName)), null);
                }
                catch (InvalidResourceException e) {
                    throw new InvalidResourceException("Spec.VirtualHost.TLS client validation is invalid: invalid CA Secret " + quote(caName) + ": " + e.getMessage());
                }
            }

            SecureVirtualHost svh = secureVirtualHost(host);
            svh.setSecret(secret);
            svh.setMinTlsVersion(TlsVersion.max(options.minimumTlsVersion(), TlsVersion.minimumOf(tls.minimumProtocolVersion())));
            svh.setMaxTlsVersion(TlsVersion.maximumOf(tls.maximumProtocolVersion()).asMaximum());
            if (fallback != null) {
                svh.setFallbackCertificate(fallback);
            }
            if (downstreamValidation != null) {
                svh.setDownstreamValidation(downstreamValidation);
            }
        }

        private void processRoutes(IngressRoute ir, String inheritedPrefix, List<ResourceId> ancestors, String host, boolean enforceTls) {
            List<ResourceId> path = descend(ancestors, ir.id());
            for (RouteSpec route : ir.routes()) {
                if (route.hasServices() && route.delegates()) {
                    recorder.invalid(ir.id(), "route " + quote(route.match()) + ": cannot specify services and delegate in the same route", host);
                    return;
                }

                if (route.hasServices()) {
                    Route r;
                    try {
                        r = route(ir, route, inheritedPrefix, enforceTls);
                    }
                    catch (InvalidResourceException e) {
                        recorder.invalid(ir.id(), e.getMessage(), host);
                        return;
                    }
                    virtualHost(host).addRoute(r);
                    if (enforceTls) {
                        secureVirtualHost(host).addRoute(r);
                    }
                    continue;
                }

                if (!route.delegates()) {
                    continue;
                }

                ResourceId targetId = route.delegate().resolve(ir.id().namespace());
                IngressRoute target = ingressRoutes.get(targetId);
                if (target == null) {
                    continue;
                }
                orphaned.remove(targetId);
                if (path.contains(targetId)) {
                    // only this edge is abandoned, sibling routes are still processed
                    recorder.invalid(ir.id(), "route creates a delegation cycle: " + cycle(path, targetId), host);
                    continue;
                }
                processRoutes(target, route.match(), path, host, enforceTls);
            }
            recorder.valid(ir.id(), host);
        }

        private Route route(IngressRoute ir, RouteSpec route, String inheritedPrefix, boolean enforceTls) {
            String match = route.match();
            if (!matchesPathPrefix(match, inheritedPrefix)) {
                throw new InvalidResourceException("the path prefix " + quote(match) + " does not match the parent's path prefix " + quote(inheritedPrefix));
            }

            HeadersPolicy requestHeaders = route.requestHeadersPolicy() == null ? null : HeadersPolicy.of(route.requestHeadersPolicy(), true);
            HeadersPolicy responseHeaders = route.responseHeadersPolicy() == null ? null : HeadersPolicy.of(route.responseHeadersPolicy(), false);

            Duration idleTimeout = idleTimeout(route.idleTimeout(), "route " + quote(match) + ": idle timeout can not be disabled");

            Duration timeout = route.timeout();
            if (timeout != null && timeout.isNegative()) {
                throw new InvalidResourceException("route " + quote(match) + ": timeout value must be >= 0");
            }

            TracingSpec tracing = route.tracing();
            if (tracing != null) {
                if (outOfPercentRange(tracing.clientSampling())) {
                    throw new InvalidResourceException("route " + quote(match) + ": tracing clientSampling must be in the range [0,100]");
                }
                if (outOfPercentRange(tracing.randomSampling())) {
                    throw new InvalidResourceException("route " + quote(match) + ": tracing randomSampling must be in the range [0,100]");
                }
            }

            HeaderCondition.validate(route.headerMatch()).ifPresent(error -> {
                throw new InvalidResourceException(error);
            });

            List<Cluster> clusters = new ArrayList<>();
            for (ServiceSpec service : route.services()) {
                clusters.add(cluster(ir, match, service));
            }

            boolean permitInsecure = route.permitInsecure() && !options.disablePermitInsecure();
            return new Route(match,
                    HeaderCondition.merge(route.headerMatch()),
                    clusters,
                    route.enableWebsockets(),
                    enforceTls && !permitInsecure,
                    route.prefixRewrite(),
                    TimeoutPolicy.of(route.timeoutPolicy()),
                    idleTimeout,
                    timeout,
                    RetryPolicy.of(route.retryPolicy()),
                    route.hashPolicy(),
                    tracing,
                    requestHeaders,
                    responseHeaders);
        }

        private Cluster cluster(IngressRoute ir, String match, ServiceSpec service) {
            if (service.port() < 1 || service.port() > 65535) {
                throw new InvalidResourceException("route " + quote(match) + ": service " + quote(service.name()) + ": port must be in the range 1-65535");
            }
            if (service.weight() < 0) {
                throw new InvalidResourceException("route " + quote(match) + ": service " + quote(service.name()) + ": weight must be >= 0");
            }
            Service upstream = service(ResourceId.of(ir.id().namespace(), service.name()), service.port());
            if (upstream == null) {
                throw new InvalidResourceException("Service [" + service.name() + ":" + service.port() + "] is invalid or missing");
            }

            PeerValidationContext upstreamValidation = null;
            // only backends that speak TLS can be validated
            if ("tls".equals(upstream.protocol())) {
                try {
                    upstreamValidation = upstreamValidation(service.upstreamValidation(), ir.id().namespace());
                }
                catch (InvalidResourceException e) {
                    throw new InvalidResourceException("Service [" + service.name() + ":" + service.port() + "] TLS upstream validation policy error: " + e.getMessage());
                }
            }

            Duration idleTimeout = idleTimeout(service.idleTimeout(),
                    "route: " + quote(match) + " service " + quote(service.name()) + ": idle timeout can not be disabled");

            return new Cluster(upstream,
                    service.weight(),
                    service.strategy(),
                    HealthCheckPolicy.of(service.healthCheck()),
                    upstreamValidation,
                    upstream.protocol(),
                    idleTimeout);
        }

        private void processTcpProxy(IngressRoute ir, List<ResourceId> ancestors, String host) {
            List<ResourceId> path = descend(ancestors, ir.id());
            TcpProxySpec tcpProxy = ir.tcpProxy();
            if (tcpProxy == null) {
                recorder.invalid(ir.id(), "tcpproxy: delegated IngressRoute does not define a tcpproxy", host);
                return;
            }
            if (!tcpProxy.services().isEmpty() && tcpProxy.delegate() != null) {
                recorder.invalid(ir.id(), "tcpproxy: cannot specify services and delegate in the same tcpproxy", host);
                return;
            }

            if (!tcpProxy.services().isEmpty()) {
                List<Cluster> clusters = new ArrayList<>();
                for (ServiceSpec service : tcpProxy.services()) {
                    if (service.weight() < 0) {
                        recorder.invalid(ir.id(), "tcpproxy: service " + quote(service.name()) + ": weight must be >= 0", host);
                        return;
                    }
                    Service upstream = service(ResourceId.of(ir.id().namespace(), service.name()), service.port());
                    if (upstream == null) {
                        recorder.invalid(ir.id(), "tcpproxy: service " + ir.id().namespace() + "/" + service.name() + "/" + service.port() + ": not found", host);
                        return;
                    }
                    clusters.add(new Cluster(upstream, service.weight(), service.strategy(), null, null, upstream.protocol(), null));
                }
                secureVirtualHost(host).setTcpProxy(new TcpProxy(clusters));
                recorder.valid(ir.id(), host);
                return;
            }

            // an empty tcpproxy is permitted
            if (tcpProxy.delegate() == null) {
                recorder.valid(ir.id(), host);
                return;
            }

            ResourceId targetId = tcpProxy.delegate().resolve(ir.id().namespace());
            IngressRoute target = ingressRoutes.get(targetId);
            if (target == null) {
                recorder.valid(ir.id(), host);
                return;
            }
            orphaned.remove(targetId);
            if (path.contains(targetId)) {
                recorder.invalid(ir.id(), "tcpproxy creates a delegation cycle: " + cycle(path, targetId), host);
                return;
            }
            processTcpProxy(target, path, host);
            recorder.valid(ir.id(), host);
        }

        @Nullable
        private Duration idleTimeout(@Nullable Duration requested, String disabledMessage) {
            if (requested == null) {
                return null;
            }
            if (requested.isZero() || requested.isNegative()) {
                throw new InvalidResourceException(disabledMessage);
            }
            return requested.compareTo(MAX_IDLE_TIMEOUT) > 0 ? MAX_IDLE_TIMEOUT : requested;
        }

        private boolean outOfPercentRange(double value) {
            // NaN falls outside
            return !(value >= 0 && value <= 100);
        }

        @Nullable
        private Service service(ResourceId id, int port) {
            BackendService backend = snapshot.service(id).orElse(null);
            if (backend == null) {
                return null;
            }
            ServicePort servicePort = backend.port(port).orElse(null);
            if (servicePort == null) {
                return null;
            }
            return new Service(id,
                    servicePort.port(),
                    servicePort.name(),
                    ServiceAnnotations.upstreamProtocol(backend, servicePort),
                    ServiceAnnotations.circuitBreakers(backend));
        }

        @Nullable
        private PeerValidationContext upstreamValidation(@Nullable UpstreamValidationSpec spec, String namespace) {
            if (spec == null) {
                return null;
            }
            Secret ca;
            try {
                ca = caSecret(ResourceId.of(namespace, spec.caSecret()));
            }
            catch (InvalidResourceException e) {
                throw new InvalidResourceException("upstreamValidation requested but secret not found or misconfigured");
            }
            if (spec.subjectName().isEmpty()) {
                throw new InvalidResourceException("missing subject alternative name");
            }
            return new PeerValidationContext(ca, spec.subjectName());
        }

        private Secret servingSecret(ResourceId id) {
            TlsSecret secret = snapshot.secret(id).orElseThrow(() -> new InvalidResourceException("Secret not found"));
            if (isEmpty(secret.data().get(TlsSecret.CERTIFICATE_KEY))) {
                throw new InvalidResourceException("missing TLS certificate");
            }
            if (isEmpty(secret.data().get(TlsSecret.PRIVATE_KEY_KEY))) {
                throw new InvalidResourceException("missing TLS private key");
            }
            return Secret.of(secret);
        }

        private Secret caSecret(ResourceId id) {
            TlsSecret secret = snapshot.secret(id).orElseThrow(() -> new InvalidResourceException("Secret not found"));
            if (!secret.isCaBundle()) {
                throw new InvalidResourceException("empty " + quote(TlsSecret.CA_KEY) + " key");
            }
            return Secret.of(secret);
        }

        /**
         * A secret may be used from its own namespace, or from any namespace a certificate
         * delegation in the secret's namespace grants it to.
         */
        private boolean delegationPermitted(ResourceId secret, String targetNamespace) {
            if (secret.namespace().equals(targetNamespace)) {
                return true;
            }
            for (CertificateDelegation delegation : snapshot.certificateDelegations()) {
                if (delegation.permits(secret, targetNamespace)) {
                    return true;
                }
            }
            return false;
        }

        private VirtualHost virtualHost(String name) {
            return virtualHosts.computeIfAbsent(name, VirtualHost::new);
        }

        private SecureVirtualHost secureVirtualHost(String name) {
            return secureVirtualHosts.computeIfAbsent(name, SecureVirtualHost::new);
        }

        private boolean isEmpty(@Nullable String s) {
            return s == null || s.isEmpty();
        }
    }
}
