/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

/**
 * What a route does with a matched request: forward it to clusters, or redirect it.
 */
public sealed interface Action permits ForwardAction, RedirectAction {
}
