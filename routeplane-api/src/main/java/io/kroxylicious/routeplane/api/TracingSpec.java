/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

/**
 * Tracing sample rates, as percentages in {@code [0,100]}.
 *
 * @param clientSampling percentage of requests traced when the client forces tracing
 * @param randomSampling percentage of requests randomly traced
 */
public record TracingSpec(double clientSampling, double randomSampling) {}
