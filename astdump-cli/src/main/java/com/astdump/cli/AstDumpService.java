package com.astdump.cli;

import com.astdump.document.DocumentNode;
import com.astdump.javaparser.JavaSourceParser;
import com.astdump.javaparser.JavaSyntaxNode;
import com.astdump.javaparser.ParsedUnit;
import com.astdump.json.DocumentJsonProvider;
import com.astdump.json.DocumentRenderer;
import com.astdump.syntax.SourceText;
import com.astdump.walk.SerializationOptions;
import com.astdump.walk.TreeWalker;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Parses Java sources, serializes their syntax trees and writes the JSON documents.
 */
public class AstDumpService {
    private static final Logger logger = LoggerFactory.getLogger(AstDumpService.class);

    private final JavaSourceParser parser;
    private final SerializationOptions options;
    private final DocumentRenderer renderer;
    private final boolean pretty;

    /**
     * @throws InvalidOptionsException if the language level or the depth limit is unusable
     */
    public AstDumpService(AstDumpConfig config, DocumentRenderer renderer) {
        LanguageLevel languageLevel;
        try {
            languageLevel = JavaSourceParser.languageLevel(config.getLanguageLevel());
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }

        Set<String> literalKinds = config.getLiteralKinds().isEmpty()
            ? JavaSyntaxNode.LITERAL_KINDS
            : Set.copyOf(config.getLiteralKinds());
        try {
            this.options = new SerializationOptions(literalKinds, config.getMaxDepth());
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }

        this.parser = new JavaSourceParser(languageLevel, config.isIncludeComments());
        this.renderer = renderer;
        this.pretty = config.isPretty();
    }

    public AstDumpService(AstDumpConfig config) {
        this(config, DocumentJsonProvider.getProvider().getRenderer());
    }

    public SerializationOptions getOptions() {
        return options;
    }

    public DocumentNode serialize(ParsedUnit unit) {
        return new TreeWalker(unit.tokenExtractor(), options).serializeNode(unit.root());
    }

    public DocumentNode serialize(SourceText source) {
        return serialize(parser.parse(source));
    }

    /**
     * Serializes one source file into {@code output}. Nothing is written when parsing or
     * serialization fails.
     *
     * @return the document that was written
     * @throws IOException if the input cannot be read
     */
    public DocumentNode dumpFile(Path input, Path output) throws IOException {
        logger.info("Parsing {}", input);
        ParsedUnit unit = parser.parse(input);

        DocumentNode document = serialize(unit);
        logger.debug("Serialized {} into {} nodes", input, document.nodeCount());

        renderer.writeFile(document, pretty, output);
        logger.info("Wrote {}", output);
        return document;
    }
}
