package com.astdump.javaparser;

import com.astdump.syntax.SourceText;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Java compilation units with JavaParser and exposes them as {@link JavaSyntaxNode} trees.
 *
 * <p>Instances are not thread-safe.</p>
 */
public class JavaSourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceParser.class);

    public static final LanguageLevel DEFAULT_LANGUAGE_LEVEL = LanguageLevel.JAVA_17;

    static final String NESTING_TOO_DEEP = "Source nests too deeply for the parser";

    // JAVA_1_0 to JAVA_1_4 exist, later releases are JAVA_5, JAVA_6, ...
    private static final Pattern LEGACY_VERSION = Pattern.compile("JAVA_1_(\\d+)");

    private final JavaParser parser;
    private final boolean includeComments;

    public JavaSourceParser(LanguageLevel languageLevel, boolean includeComments) {
        ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(languageLevel)
            .setTabSize(1)
            .setAttributeComments(includeComments);
        this.parser = new JavaParser(configuration);
        this.includeComments = includeComments;
    }

    public JavaSourceParser() {
        this(DEFAULT_LANGUAGE_LEVEL, false);
    }

    /**
     * Resolves a language level name such as {@code JAVA_17}, {@code 17}, {@code 1.8} or {@code current}.
     * Versions from 1.5 on may be written either way; {@code 1.8} means {@code JAVA_8}.
     *
     * @throws IllegalArgumentException if JavaParser knows no such level
     */
    public static LanguageLevel languageLevel(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('.', '_');
        if (!normalized.isEmpty() && Character.isDigit(normalized.charAt(0))) {
            normalized = "JAVA_" + normalized;
        }
        Matcher legacy = LEGACY_VERSION.matcher(normalized);
        if (legacy.matches() && Integer.parseInt(legacy.group(1)) >= 5) {
            normalized = "JAVA_" + legacy.group(1);
        }
        try {
            return LanguageLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown Java language level: " + name, e);
        }
    }

    /**
     * Reads and parses a UTF-8 source file.
     */
    public ParsedUnit parse(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return parse(new SourceText(file.toString(), content));
    }

    /**
     * Parses a compilation unit.
     *
     * @throws UpstreamParseException if JavaParser reports any problem, or the input nests too deeply
     *                                for its recursive descent to finish
     */
    public ParsedUnit parse(SourceText source) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(source.content());
        } catch (StackOverflowError e) {
            logger.debug("Parser ran out of stack on {}", source.name());
            throw new UpstreamParseException(source.name(), List.of(NESTING_TOO_DEEP), e);
        }
        Optional<CompilationUnit> unit = result.getResult();

        if (!result.isSuccessful() || unit.isEmpty()) {
            List<String> problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .toList();
            problems.forEach(problem -> logger.debug("{}: {}", source.name(), problem));
            throw new UpstreamParseException(source.name(), problems);
        }

        logger.debug("Parsed {} ({} lines)", source.name(), source.lineCount());
        return new ParsedUnit(source, new JavaSyntaxNode(unit.get(), source, includeComments));
    }
}
