package com.astdump.javaparser;

import com.astdump.AstDumpException;

import java.util.List;

/**
 * Thrown when the front end cannot produce a complete syntax tree. No partial tree is handed on.
 */
public class UpstreamParseException extends AstDumpException {

    private final String sourceName;
    private final List<String> problems;

    public UpstreamParseException(String sourceName, List<String> problems) {
        this(sourceName, problems, null);
    }

    public UpstreamParseException(String sourceName, List<String> problems, Throwable cause) {
        super(describe(sourceName, problems), cause);
        this.sourceName = sourceName;
        this.problems = List.copyOf(problems);
    }

    private static String describe(String sourceName, List<String> problems) {
        return "Failed to parse " + sourceName + ": " + problems.size() + " problem(s)"
            + (problems.isEmpty() ? "" : ", first: " + problems.get(0));
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getProblems() {
        return problems;
    }
}
