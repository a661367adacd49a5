package com.astdump.cli;

import com.astdump.document.DocumentNode;
import com.astdump.javaparser.JavaSyntaxNode;
import com.astdump.syntax.SourceText;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AstDumpServiceTest {

    @Test
    void testDefaultLiteralKindsComeFromFrontEnd() {
        AstDumpService service = new AstDumpService(new AstDumpConfig());

        assertEquals(JavaSyntaxNode.LITERAL_KINDS, service.getOptions().literalKinds());
    }

    @Test
    void testConfiguredLiteralKinds() {
        AstDumpConfig config = new AstDumpConfig();
        config.setLiteralKinds(List.of("CharLiteralExpr"));

        AstDumpService service = new AstDumpService(config);

        assertEquals(Set.of("CharLiteralExpr"), service.getOptions().literalKinds());
        DocumentNode document = service.serialize(SourceText.of("class C { char c = 'q'; }"));
        assertEquals("CompilationUnit", document.kind());
    }

    @Test
    void testInvalidSettings() {
        AstDumpConfig badDepth = new AstDumpConfig();
        badDepth.setMaxDepth(-1);
        assertThrows(InvalidOptionsException.class, () -> new AstDumpService(badDepth));

        AstDumpConfig badLevel = new AstDumpConfig();
        badLevel.setLanguageLevel("JAVA_0");
        assertThrows(InvalidOptionsException.class, () -> new AstDumpService(badLevel));
    }
}
