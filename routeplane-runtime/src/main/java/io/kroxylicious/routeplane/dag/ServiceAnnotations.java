/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.kroxylicious.routeplane.api.BackendService;
import io.kroxylicious.routeplane.api.ServicePort;

/**
 * Reads per service settings from the annotations of a {@link BackendService}. Each annotation is
 * accepted under the current {@code projectcontour.io/} prefix and the legacy {@code contour.heptio.com/} one.
 */
final class ServiceAnnotations {

    private static final List<String> PREFIXES = List.of("projectcontour.io/", "contour.heptio.com/");
    private static final List<String> UPSTREAM_PROTOCOLS = List.of("h2", "h2c", "tls");

    private ServiceAnnotations() {
    }

    /**
     * The {@code upstream-protocol.<protocol>} annotations list the names or numbers of the ports
     * that speak that protocol, comma separated. A port's name takes precedence over its number.
     *
     * @return the protocol, empty for plain HTTP/1.1
     */
    static String upstreamProtocol(BackendService service, ServicePort port) {
        Map<String, String> protocolByPort = new HashMap<>();
        for (String protocol : UPSTREAM_PROTOCOLS) {
            for (String prefix : PREFIXES) {
                String ports = service.annotations().get(prefix + "upstream-protocol." + protocol);
                if (ports == null) {
                    continue;
                }
                for (String p : ports.split(",")) {
                    String trimmed = p.trim();
                    if (!trimmed.isEmpty()) {
                        protocolByPort.put(trimmed, protocol);
                    }
                }
            }
        }
        String protocol = port.name() == null ? null : protocolByPort.get(port.name());
        if (protocol == null) {
            protocol = protocolByPort.get(Integer.toString(port.port()));
        }
        return protocol == null ? "" : protocol;
    }

    static Service.CircuitBreakers circuitBreakers(BackendService service) {
        return new Service.CircuitBreakers(intAnnotation(service, "max-connections"),
                intAnnotation(service, "max-pending-requests"),
                intAnnotation(service, "max-requests"),
                intAnnotation(service, "max-retries"));
    }

    // unparseable or negative values mean the default
    private static int intAnnotation(BackendService service, String name) {
        for (String prefix : PREFIXES) {
            String value = service.annotations().get(prefix + name);
            if (value != null) {
                try {
                    return Math.max(0, Integer.parseInt(value.trim()));
                }
                catch (NumberFormatException e) {
                    return 0;
                }
            }
        }
        return 0;
    }
}
