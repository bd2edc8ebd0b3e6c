package com.indigententerprises.telemetry.common.serviceimplementations;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds the file a command name refers to: a name containing a separator is taken as a
 * path, anything else is looked up along the search path.
 */
public final class ExecutableResolver {

    private final String searchPath;

    public ExecutableResolver(final String searchPath) {
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    public static ExecutableResolver fromEnvironment() {
        return new ExecutableResolver(System.getenv("PATH"));
    }

    public Path resolve(final String command) throws FileNotFoundException {
        if (command == null || command.isEmpty()) {
            throw new FileNotFoundException("empty command");
        } else if (command.contains(File.separator)) {
            final Path path = Path.of(command);

            if (Files.isRegularFile(path)) {
                return path;
            } else {
                throw new FileNotFoundException(command);
            }
        } else {
            for (final String directory : searchPath.split(File.pathSeparator)) {
                final Path candidate = Path.of(directory.isEmpty() ? "." : directory, command);

                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate;
                }
            }

            throw new FileNotFoundException(command + ": executable file not found in search path");
        }
    }
}
