package org.carball.jobcluster.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Level of the INFORMATION_SCHEMA jobs view used to find referenced tables.
 */
public enum InformationSchemaScope {
    PROJECT,
    ORGANIZATION;

    @JsonCreator
    public static InformationSchemaScope fromName(String name) {
        for (InformationSchemaScope scope : values()) {
            if (scope.name().equalsIgnoreCase(name.trim())) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope type: " + name + ". Use: " +
                Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(" or ")));
    }
}
