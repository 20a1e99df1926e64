/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

/**
 * Signals that the static configuration of the control plane cannot be used, for example because
 * a port is out of range or the CIDR list file cannot be read. Raised while the control plane is
 * being assembled, so that a misconfigured process never starts serving.
 */
public class IllegalConfigurationException extends RuntimeException {
    public IllegalConfigurationException(String message) {
        super(message);
    }

    public IllegalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
