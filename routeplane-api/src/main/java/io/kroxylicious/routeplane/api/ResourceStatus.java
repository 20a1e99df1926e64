/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Locale;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The outcome of processing a single resource during one build pass.
 * A status produced by a pass replaces any status produced by an earlier pass.
 *
 * @param id the resource
 * @param state the outcome
 * @param description human readable detail, for an invalid resource the reason it was rejected
 * @param vhost the fully qualified domain name the resource was processed for, if known
 */
public record ResourceStatus(ResourceId id,
                             State state,
                             String description,
                             @Nullable String vhost) {

    public static final String VALID_DESCRIPTION = "valid IngressRoute";
    public static final String ORPHANED_DESCRIPTION = "this IngressRoute is not part of a delegation chain from a root IngressRoute";

    public enum State {
        VALID,
        INVALID,
        ORPHANED;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ResourceStatus {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
    }

    public static ResourceStatus valid(ResourceId id, @Nullable String vhost) {
        return new ResourceStatus(id, State.VALID, VALID_DESCRIPTION, vhost);
    }

    public static ResourceStatus invalid(ResourceId id, String reason, @Nullable String vhost) {
        return new ResourceStatus(id, State.INVALID, reason, vhost);
    }

    public static ResourceStatus orphaned(ResourceId id) {
        return new ResourceStatus(id, State.ORPHANED, ORPHANED_DESCRIPTION, null);
    }

    public boolean isValid() {
        return state == State.VALID;
    }

    public boolean isInvalid() {
        return state == State.INVALID;
    }

    public boolean isOrphaned() {
        return state == State.ORPHANED;
    }
}
