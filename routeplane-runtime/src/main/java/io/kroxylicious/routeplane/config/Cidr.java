/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An address range of the IP allow/deny list.
 *
 * @param addressPrefix the network address
 * @param prefixLen number of significant bits
 */
public record Cidr(@JsonProperty("address_prefix") String addressPrefix,
                   @JsonProperty("prefix_len") int prefixLen) {

    public Cidr {
        if (addressPrefix == null || addressPrefix.isBlank()) {
            throw new IllegalConfigurationException("cidr address_prefix must be specified");
        }
        if (prefixLen < 0 || prefixLen > 128) {
            throw new IllegalConfigurationException("cidr prefix_len must be in the range 0-128, was " + prefixLen);
        }
    }

    @Override
    public String toString() {
        return addressPrefix + "/" + prefixLen;
    }
}
