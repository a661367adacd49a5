package com.astdump.cli;

/**
 * Process exit statuses of the astdump command.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    /** Invalid command line, or the input is missing or unreadable. */
    public static final int USAGE = 1;
    /** Configuration or option values are invalid. */
    public static final int INVALID_OPTIONS = 2;
    /** The input could not be parsed. */
    public static final int PARSE_FAILURE = 3;
    /** The JSON document could not be rendered or written. */
    public static final int OUTPUT_FAILURE = 4;
    /** The syntax tree is cyclic or deeper than allowed. */
    public static final int MALFORMED_TREE = 5;

    private ExitCodes() {
    }
}
