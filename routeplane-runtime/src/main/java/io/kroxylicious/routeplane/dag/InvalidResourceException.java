/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

/**
 * Thrown while a resource is being turned into graph vertices when the resource cannot be used.
 * Never escapes the builder: it is recorded as the resource's invalid status.
 */
class InvalidResourceException extends RuntimeException {
    InvalidResourceException(String message) {
        super(message);
    }
}
