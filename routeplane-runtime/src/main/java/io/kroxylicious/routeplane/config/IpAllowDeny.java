/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Address ranges that are allowed or denied on every listener, as read from the
 * file named by {@code cidrListPath}:
 * <pre>{@code
 * {"allow_cidrs": [{"address_prefix": "10.0.0.0", "prefix_len": 8}], "deny_cidrs": []}
 * }</pre>
 * A list that is absent from the file is {@code null}, which is distinct from an empty list.
 *
 * @param allowCidrs allowed ranges
 * @param denyCidrs denied ranges
 */
public record IpAllowDeny(@JsonProperty("allow_cidrs") @Nullable List<Cidr> allowCidrs,
                          @JsonProperty("deny_cidrs") @Nullable List<Cidr> denyCidrs) {

    private static final Logger LOGGER = LoggerFactory.getLogger(IpAllowDeny.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public IpAllowDeny {
        allowCidrs = allowCidrs == null ? null : List.copyOf(allowCidrs);
        denyCidrs = denyCidrs == null ? null : List.copyOf(denyCidrs);
    }

    public boolean isEmpty() {
        return allowCidrs == null && denyCidrs == null;
    }

    /**
     * Loads the allow/deny list.
     *
     * @param cidrListPath path of the file, {@code null} when none is configured
     * @return the list, or empty when no file is configured or it names no ranges
     * @throws IllegalConfigurationException if the file cannot be read or parsed
     */
    public static Optional<IpAllowDeny> load(@Nullable String cidrListPath) {
        if (cidrListPath == null || cidrListPath.isEmpty()) {
            return Optional.empty();
        }
        Path path = Path.of(cidrListPath);
        if (!Files.isReadable(path)) {
            throw new IllegalConfigurationException("cidrListPath was provided but " + cidrListPath + " cannot be read");
        }
        try {
            IpAllowDeny allowDeny = MAPPER.readValue(path.toFile(), IpAllowDeny.class);
            LOGGER.atInfo()
                    .setMessage("Loaded IP allow/deny list")
                    .addKeyValue("path", cidrListPath)
                    .addKeyValue("allow", allowDeny.allowCidrs() == null ? 0 : allowDeny.allowCidrs().size())
                    .addKeyValue("deny", allowDeny.denyCidrs() == null ? 0 : allowDeny.denyCidrs().size())
                    .log();
            return allowDeny.isEmpty() ? Optional.empty() : Optional.of(allowDeny);
        }
        catch (IOException e) {
            throw new IllegalConfigurationException("could not deserialize cidrs in cidrListPath " + cidrListPath, e);
        }
    }
}
