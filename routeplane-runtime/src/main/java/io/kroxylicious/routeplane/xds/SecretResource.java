/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A secret served to proxies: either a serving certificate with its key, or a CA bundle.
 */
public record SecretResource(String name,
                             @Nullable String certificateChain,
                             @Nullable String privateKey,
                             @Nullable String trustedCa) {

    public SecretResource {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public boolean isValidationContext() {
        return trustedCa != null;
    }

    @Override
    public String toString() {
        // key material stays out of logs
        return "SecretResource[name=" + name + ", validationContext=" + isValidationContext() + "]";
    }
}
