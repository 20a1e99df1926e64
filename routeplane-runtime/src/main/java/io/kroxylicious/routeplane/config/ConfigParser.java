/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.kroxylicious.routeplane.tag.VisibleForTesting;

/**
 * Parses the control plane's YAML configuration. Unknown properties and duplicate keys are rejected.
 */
public class ConfigParser {

    private static final ObjectMapper MAPPER = createObjectMapper();

    public ControlPlaneConfiguration parseConfiguration(String configuration) {
        try {
            return MAPPER.readValue(configuration, ControlPlaneConfiguration.class);
        }
        catch (IOException e) {
            throw toConfigurationException(e);
        }
    }

    public ControlPlaneConfiguration parseConfiguration(InputStream configuration) {
        try {
            return MAPPER.readValue(configuration, ControlPlaneConfiguration.class);
        }
        catch (IOException e) {
            throw toConfigurationException(e);
        }
    }

    public String toYaml(ControlPlaneConfiguration configuration) {
        try {
            return MAPPER.writeValueAsString(configuration);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode configuration as YAML", e);
        }
    }

    // validation in the config records surfaces wrapped in a mapping exception
    private static IllegalConfigurationException toConfigurationException(IOException e) {
        if (e instanceof JsonMappingException jme && jme.getCause() instanceof IllegalConfigurationException ice) {
            return ice;
        }
        return new IllegalConfigurationException("Couldn't parse configuration: " + e.getMessage(), e);
    }

    @VisibleForTesting
    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_DEFAULT);
    }
}
