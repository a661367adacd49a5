package com.astdump.javaparser;

import com.astdump.document.DocumentNode;
import com.astdump.syntax.SourceText;
import com.astdump.walk.SerializationOptions;
import com.astdump.walk.TreeWalker;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaSourceParserTest {

    private final JavaSourceParser parser = new JavaSourceParser();

    private static DocumentNode serialize(ParsedUnit unit) {
        SerializationOptions options = SerializationOptions.defaults().withLiteralKinds(JavaSyntaxNode.LITERAL_KINDS);
        return new TreeWalker(unit.tokenExtractor(), options).serializeNode(unit.root());
    }

    // Pre-order list of every node of the given kind
    private static List<DocumentNode> findAll(DocumentNode root, String kind) {
        List<DocumentNode> found = new ArrayList<>();
        Deque<DocumentNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DocumentNode node = pending.pop();
            if (node.kind().equals(kind)) {
                found.add(node);
            }
            List<DocumentNode> children = node.childList();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return found;
    }

    @Test
    void testIntegerLiteralsCarrySourceSpelling() {
        ParsedUnit unit = parser.parse(SourceText.of("class A { int x = 0x1F + 2; long y = 10L; int z = -3; }"));

        DocumentNode document = serialize(unit);

        assertEquals("CompilationUnit", document.kind());
        DocumentNode plus = findAll(document, "BinaryExpr").get(0);
        assertEquals("+", plus.name());
        assertEquals(List.of("0x1F", "2"), plus.children().stream().map(DocumentNode::value).toList());
        assertEquals("10L", findAll(document, "LongLiteralExpr").get(0).value());

        DocumentNode negate = findAll(document, "UnaryExpr").get(0);
        assertEquals("-", negate.name());
        assertEquals("3", negate.children().get(0).value());
    }

    @Test
    void testOnlyLiteralKindsHaveValues() {
        DocumentNode document = serialize(parser.parse(SourceText.of("class A { String s = \"x\"; int i = 1; }")));

        assertNull(findAll(document, "StringLiteralExpr").get(0).value());
        assertNull(findAll(document, "VariableDeclarator").get(0).value());
        assertEquals("1", findAll(document, "IntegerLiteralExpr").get(0).value());
    }

    @Test
    void testSpellings() {
        String code = """
            package demo.app;
            import java.util.List;
            public class Greeter {
                public static void main(String[] args) {
                    int count = args.length;
                    count += 1;
                }
            }
            """;
        DocumentNode document = serialize(parser.parse(SourceText.of(code)));

        assertEquals("demo.app", findAll(document, "PackageDeclaration").get(0).name());
        assertEquals("java.util.List", findAll(document, "ImportDeclaration").get(0).name());
        assertEquals("Greeter", findAll(document, "ClassOrInterfaceDeclaration").get(0).name());
        assertEquals("main", findAll(document, "MethodDeclaration").get(0).name());
        assertEquals("args", findAll(document, "Parameter").get(0).name());
        assertEquals("int", findAll(document, "PrimitiveType").get(0).name());
        assertEquals("void", findAll(document, "VoidType").get(0).name());
        assertEquals(List.of("public", "public", "static"),
            findAll(document, "Modifier").stream().map(DocumentNode::name).toList());
        assertEquals("+=", findAll(document, "AssignExpr").get(0).name());
        assertEquals("length", findAll(document, "FieldAccessExpr").get(0).name());
        assertEquals("", findAll(document, "BlockStmt").get(0).name());
    }

    @Test
    void testChildrenFollowSourceOrder() {
        ParsedUnit unit = parser.parse(SourceText.of("class A { @Deprecated public static void m() {} }"));

        DocumentNode method = findAll(serialize(unit), "MethodDeclaration").get(0);

        assertEquals(List.of("MarkerAnnotationExpr", "Modifier", "Modifier", "VoidType", "SimpleName", "BlockStmt"),
            method.children().stream().map(DocumentNode::kind).toList());
    }

    @Test
    void testChildSpansAreOrderedAndNested() {
        ParsedUnit unit = parser.parse(SourceText.of("class A { int f(int a, int b) { return a * (b + 0x10); } }"));

        Deque<JavaSyntaxNode> pending = new ArrayDeque<>();
        pending.push(unit.root());
        while (!pending.isEmpty()) {
            JavaSyntaxNode node = pending.pop();
            int previousStart = node.span().start();
            for (JavaSyntaxNode child : node.children()) {
                assertTrue(child.span().start() >= previousStart, child + " starts before its predecessor");
                assertTrue(child.span().end() <= node.span().end(), child + " ends after its parent " + node);
                previousStart = child.span().start();
                pending.push(child);
            }
        }
    }

    @Test
    void testSpanAddressesNodeText() {
        SourceText source = SourceText.of("class A {\n  long big = 0xFFFF_FFFFL;\n}\n");
        ParsedUnit unit = parser.parse(source);

        JavaSyntaxNode literal = findSyntax(unit.root(), "LongLiteralExpr");

        assertEquals("0xFFFF_FFFFL", source.slice(literal.span()).toString());
        assertSame(literal.getNode(), literal.identity());
    }

    @Test
    void testCrLfAndTabs() {
        ParsedUnit unit = parser.parse(SourceText.of("class A {\r\n\tint x = 7;\r\n\tint y = 8;\r\n}"));

        List<DocumentNode> literals = findAll(serialize(unit), "IntegerLiteralExpr");

        assertEquals(List.of("7", "8"), literals.stream().map(DocumentNode::value).toList());
    }

    @Test
    void testCommentsAreExcludedByDefault() {
        String code = "class A { /** Doc. */ int x; // trailing\n }";

        DocumentNode withoutComments = serialize(parser.parse(SourceText.of(code)));
        DocumentNode withComments = serialize(new JavaSourceParser(LanguageLevel.JAVA_17, true).parse(SourceText.of(code)));

        assertTrue(findAll(withoutComments, "JavadocComment").isEmpty());
        assertEquals(1, findAll(withComments, "JavadocComment").size());
    }

    @Test
    void testSyntaxErrorsAreReported() {
        UpstreamParseException e = assertThrows(UpstreamParseException.class,
            () -> parser.parse(new SourceText("Broken.java", "class { int x = ; ")));

        assertEquals("Broken.java", e.getSourceName());
        assertFalse(e.getProblems().isEmpty());
        assertTrue(e.getMessage().startsWith("Failed to parse Broken.java"), e.getMessage());
    }

    @Test
    void testExcessiveNestingIsAParseFailure() {
        int depth = 10_000;
        String code = "class Deep { int x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "; }";

        UpstreamParseException e = assertThrows(UpstreamParseException.class,
            () -> parser.parse(new SourceText("Deep.java", code)));

        assertEquals(List.of(JavaSourceParser.NESTING_TOO_DEEP), e.getProblems());
        assertInstanceOf(StackOverflowError.class, e.getCause());

        // the parser stays usable afterwards
        assertEquals("CompilationUnit", parser.parse(SourceText.of("class Shallow {}")).root().kind());
    }

    @Test
    void testLanguageLevelNames() {
        assertEquals(LanguageLevel.JAVA_17, JavaSourceParser.languageLevel("JAVA_17"));
        assertEquals(LanguageLevel.JAVA_11, JavaSourceParser.languageLevel("11"));
        assertEquals(LanguageLevel.JAVA_8, JavaSourceParser.languageLevel("1.8"));
        assertEquals(LanguageLevel.JAVA_8, JavaSourceParser.languageLevel("8"));
        assertEquals(LanguageLevel.JAVA_5, JavaSourceParser.languageLevel("java_1_5"));
        assertEquals(LanguageLevel.JAVA_1_4, JavaSourceParser.languageLevel("1.4"));
        assertEquals(LanguageLevel.CURRENT, JavaSourceParser.languageLevel("current"));
        assertThrows(IllegalArgumentException.class, () -> JavaSourceParser.languageLevel("JAVA_99"));
    }

    @Test
    void testParseFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("Unit.java");
        Files.writeString(file, "class Unit { int answer = 42; }");

        ParsedUnit unit = parser.parse(file);

        assertEquals(file.toString(), unit.source().name());
        assertEquals("42", findAll(serialize(unit), "IntegerLiteralExpr").get(0).value());
    }

    private static JavaSyntaxNode findSyntax(JavaSyntaxNode root, String kind) {
        Deque<JavaSyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JavaSyntaxNode node = pending.pop();
            if (node.kind().equals(kind)) {
                return node;
            }
            node.children().forEach(pending::push);
        }
        throw new AssertionError("No " + kind + " under " + root);
    }
}
