package com.indigententerprises.telemetry.common.domain;

import java.util.List;
import java.util.Map;

/**
 * @param argv        resolved executable followed by its arguments
 * @param environment variables added to the inherited environment of the child
 */
public record ChildCommand(List<String> argv, Map<String, String> environment) {

    public ChildCommand {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("argv must name an executable");
        }
        argv = List.copyOf(argv);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
