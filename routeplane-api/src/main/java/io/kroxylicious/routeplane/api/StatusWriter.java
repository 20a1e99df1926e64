/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

/**
 * Receives the outcome of processing each resource. Called once per resource per build pass.
 */
@FunctionalInterface
public interface StatusWriter {

    void setStatus(ResourceStatus status);
}
