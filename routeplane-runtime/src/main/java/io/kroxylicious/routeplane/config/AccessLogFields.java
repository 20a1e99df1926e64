/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fields that may appear in JSON access logs, and the command operator each one is rendered from.
 */
public final class AccessLogFields {

    private static final Map<String, String> FIELDS = knownFields();

    /** Fields logged when none are configured. */
    public static final List<String> DEFAULT_FIELDS = List.of(
            "@timestamp",
            "authority",
            "bytes_received",
            "bytes_sent",
            "downstream_local_address",
            "downstream_remote_address",
            "duration",
            "method",
            "path",
            "protocol",
            "request_id",
            "requested_server_name",
            "response_code",
            "response_flags",
            "uber_trace_id",
            "upstream_cluster",
            "upstream_host",
            "upstream_local_address",
            "upstream_service_time",
            "user_agent",
            "x_forwarded_for");

    private AccessLogFields() {
    }

    private static Map<String, String> knownFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("@timestamp", "%START_TIME%");
        fields.put("ts", "%START_TIME%");
        fields.put("authority", "%REQ(:AUTHORITY)%");
        fields.put("bytes_received", "%BYTES_RECEIVED%");
        fields.put("bytes_sent", "%BYTES_SENT%");
        fields.put("downstream_local_address", "%DOWNSTREAM_LOCAL_ADDRESS%");
        fields.put("downstream_remote_address", "%DOWNSTREAM_REMOTE_ADDRESS%");
        fields.put("duration", "%DURATION%");
        fields.put("method", "%REQ(:METHOD)%");
        fields.put("path", "%REQ(X-ENVOY-ORIGINAL-PATH?:PATH)%");
        fields.put("protocol", "%PROTOCOL%");
        fields.put("request_id", "%REQ(X-REQUEST-ID)%");
        fields.put("requested_server_name", "%REQUESTED_SERVER_NAME%");
        fields.put("response_code", "%RESPONSE_CODE%");
        fields.put("response_flags", "%RESPONSE_FLAGS%");
        fields.put("uber_trace_id", "%REQ(UBER-TRACE-ID)%");
        fields.put("upstream_cluster", "%UPSTREAM_CLUSTER%");
        fields.put("upstream_host", "%UPSTREAM_HOST%");
        fields.put("upstream_local_address", "%UPSTREAM_LOCAL_ADDRESS%");
        fields.put("upstream_service_time", "%RESP(X-ENVOY-UPSTREAM-SERVICE-TIME)%");
        fields.put("user_agent", "%REQ(USER-AGENT)%");
        fields.put("x_forwarded_for", "%REQ(X-FORWARDED-FOR)%");
        return Map.copyOf(fields);
    }

    /**
     * Maps field names to their command operators, preserving the given order.
     *
     * @param fields field names
     * @return field name to command operator
     * @throws IllegalConfigurationException if any field is unknown
     */
    public static Map<String, String> resolve(List<String> fields) {
        List<String> unknown = new ArrayList<>();
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String field : fields) {
            String operator = FIELDS.get(field);
            if (operator == null) {
                unknown.add(field);
            }
            else {
                resolved.put(field, operator);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalConfigurationException("unknown access log fields " + unknown);
        }
        return resolved;
    }
}
