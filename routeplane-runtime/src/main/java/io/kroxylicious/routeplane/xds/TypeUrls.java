/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

/**
 * Type URLs of the resources served by the discovery service.
 */
public final class TypeUrls {

    public static final String LISTENER = "type.googleapis.com/envoy.api.v2.Listener";
    public static final String ROUTE = "type.googleapis.com/envoy.api.v2.RouteConfiguration";
    public static final String CLUSTER = "type.googleapis.com/envoy.api.v2.Cluster";
    public static final String ENDPOINT = "type.googleapis.com/envoy.api.v2.ClusterLoadAssignment";
    public static final String SECRET = "type.googleapis.com/envoy.api.v2.auth.Secret";

    private TypeUrls() {
    }
}
