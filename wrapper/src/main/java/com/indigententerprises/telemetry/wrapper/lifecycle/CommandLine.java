package com.indigententerprises.telemetry.wrapper.lifecycle;

import java.util.Arrays;
import java.util.List;

public final class CommandLine {

    public static final String USAGE = "usage: wrapper command [args ...]";

    private CommandLine() {}

    /**
     * @return the child command and its arguments, untouched
     * @throws IllegalArgumentException carrying the usage line when no command is given
     */
    public static List<String> parse(final String... args) {
        if (args == null || args.length < 1 || args[0].isEmpty()) {
            throw new IllegalArgumentException(USAGE);
        } else {
            return List.copyOf(Arrays.asList(args));
        }
    }
}
