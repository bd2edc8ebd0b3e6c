package com.indigententerprises.telemetry.common.domain;

import java.util.Optional;

/**
 * POSIX signals a child is commonly terminated by, with the names reported on the wire.
 */
public enum TerminationSignal {
    SIGHUP(1, "hangup"),
    SIGINT(2, "interrupt"),
    SIGQUIT(3, "quit"),
    SIGILL(4, "illegal instruction"),
    SIGTRAP(5, "trace/breakpoint trap"),
    SIGABRT(6, "aborted"),
    SIGBUS(7, "bus error"),
    SIGFPE(8, "floating point exception"),
    SIGKILL(9, "killed"),
    SIGUSR1(10, "user defined signal 1"),
    SIGSEGV(11, "segmentation fault"),
    SIGUSR2(12, "user defined signal 2"),
    SIGPIPE(13, "broken pipe"),
    SIGALRM(14, "alarm clock"),
    SIGTERM(15, "terminated");

    // the JVM reports death by signal n as exit value 128 + n
    private static final int SIGNALLED_OFFSET = 128;

    private final int number;
    private final String description;

    TerminationSignal(final int number, final String description) {
        this.number = number;
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<TerminationSignal> fromExitValue(final int exitValue) {
        final int number = exitValue - SIGNALLED_OFFSET;

        for (final TerminationSignal signal : values()) {
            if (signal.number == number) {
                return Optional.of(signal);
            }
        }

        return Optional.empty();
    }
}
