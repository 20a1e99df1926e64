/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

/**
 * A filter of a filter chain. A chain terminates either in HTTP routing or in raw TCP forwarding.
 */
public sealed interface NetworkFilter permits HttpConnectionManager, TcpProxyFilter {

    String name();
}
