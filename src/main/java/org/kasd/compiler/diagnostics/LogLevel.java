package org.kasd.compiler.diagnostics;

/**
 * The numeric verbosity levels accepted on the command line and by the embedding API.
 * Levels: 0=NONE, 1=ERROR, 2=WARNING, 3=INFO, 4=DEBUG.
 */
public enum LogLevel {
    /** No log output at all. */
    NONE(0),
    /** Errors only. */
    ERROR(1),
    /** Errors and warnings. */
    WARNING(2),
    /** Informational messages. */
    INFO(3),
    /** Everything, including token and AST dumps. */
    DEBUG(4);

    private final int number;

    LogLevel(int number) {
        this.number = number;
    }

    /**
     * @return The numeric form of this level.
     */
    public int number() {
        return number;
    }

    /**
     * Checks whether messages of the given level are shown at this level.
     * @param level The level of a message.
     * @return {@code true} if this level is at least as verbose as {@code level}.
     */
    public boolean includes(LogLevel level) {
        return level != NONE && number >= level.number;
    }

    /**
     * Converts a numeric level.
     * @param number A number between 0 and 4.
     * @return The level.
     * @throws IllegalArgumentException if the number is out of range.
     */
    public static LogLevel fromNumber(int number) {
        for (LogLevel level : values()) {
            if (level.number == number) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid log level: " + number);
    }
}
