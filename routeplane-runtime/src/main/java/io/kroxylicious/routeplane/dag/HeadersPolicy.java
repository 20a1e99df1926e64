/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import io.kroxylicious.routeplane.api.HeaderValue;
import io.kroxylicious.routeplane.api.HeadersPolicySpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Header manipulation on a request or a response. Header names are held in canonical form.
 *
 * @param set headers to set, replacing existing values
 * @param hostRewrite value the {@code Host} header is rewritten to, {@code null} for none
 * @param remove headers to remove, sorted
 */
public record HeadersPolicy(Map<String, String> set, @Nullable String hostRewrite, List<String> remove) {

    private static final Pattern HEADER_NAME = Pattern.compile("[-A-Za-z0-9]+");
    private static final Pattern TOKEN = Pattern.compile("[-A-Za-z0-9!#$%&'*+.^_`|~]+");
    private static final String HEADER_NAME_RULE = "a valid HTTP header must consist of alphanumeric characters or '-'";
    private static final String HOST = "Host";

    public HeadersPolicy {
        set = Map.copyOf(set);
        remove = List.copyOf(remove);
    }

    /**
     * Validates a policy and puts it in canonical form.
     *
     * @param spec the policy
     * @param allowHostRewrite whether {@code Host} may be set; only requests may rewrite it
     * @return the policy
     * @throws InvalidResourceException describing the first problem found
     */
    static HeadersPolicy of(HeadersPolicySpec spec, boolean allowHostRewrite) {
        Map<String, String> set = new TreeMap<>();
        String hostRewrite = null;
        for (HeaderValue entry : spec.set()) {
            String key = canonicalHeaderKey(entry.name());
            if (set.containsKey(key) || (HOST.equals(key) && hostRewrite != null)) {
                throw new InvalidResourceException("duplicate header addition: \"" + key + "\"");
            }
            if (HOST.equals(key)) {
                if (!allowHostRewrite) {
                    throw new InvalidResourceException("rewriting \"" + key + "\" header is not supported");
                }
                hostRewrite = entry.value();
                continue;
            }
            if (!HEADER_NAME.matcher(key).matches()) {
                throw new InvalidResourceException("invalid set header \"" + key + "\": " + HEADER_NAME_RULE);
            }
            set.put(key, entry.value());
        }
        TreeSet<String> remove = new TreeSet<>();
        for (String name : spec.remove()) {
            String key = canonicalHeaderKey(name);
            if (!remove.add(key)) {
                throw new InvalidResourceException("duplicate header removal: \"" + key + "\"");
            }
            if (!HEADER_NAME.matcher(key).matches()) {
                throw new InvalidResourceException("invalid remove header \"" + key + "\": " + HEADER_NAME_RULE);
            }
        }
        return new HeadersPolicy(set, hostRewrite, List.copyOf(remove));
    }

    /**
     * Upper-cases the first letter and every letter following a hyphen, lower-cases the rest.
     * Names containing characters outside the token set are returned unchanged.
     */
    static String canonicalHeaderKey(String name) {
        if (!TOKEN.matcher(name).matches()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = true;
        for (char c : name.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = c == '-';
        }
        return sb.toString();
    }
}
