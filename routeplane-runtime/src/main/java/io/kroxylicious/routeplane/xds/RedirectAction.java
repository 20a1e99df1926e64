/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

/**
 * Redirects to the same URL using {@code https}.
 */
public record RedirectAction(boolean httpsRedirect) implements Action {

    public static final RedirectAction HTTPS = new RedirectAction(true);
}
