package com.property.knowledge.generate;

import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.kb.KnowledgeBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class JavaLookupSourceGeneratorTest {

    private static final String SUMMARY_INFORMATION = "f29f85e0-4ff9-1068-ab91-08002b27b3d9";

    private final JavaLookupSourceGenerator generator =
            new JavaLookupSourceGenerator("com.acme.shell", "ShellPropertyDefinitions");

    private String render(KnowledgeBase kb) throws IOException {
        StringWriter out = new StringWriter();
        generator.write(kb, out);
        return out.toString();
    }

    private static KnowledgeBase sized(int count) {
        KnowledgeBase.Builder builder = KnowledgeBase.builder();
        for (int pid = 0; pid < count; pid++) {
            builder.add(CanonicalEntry.builder().key(SUMMARY_INFORMATION, pid).name("System.P" + pid).build());
        }
        return builder.build();
    }

    @Test
    @DisplayName("Generated class declares its package, lookup and size")
    void testStructure() throws IOException {
        String source = render(KnowledgeBase.builder()
                .add(CanonicalEntry.builder()
                        .key(SUMMARY_INFORMATION, 2)
                        .name("System.Title")
                        .shellPropertyKey("PKEY_Title")
                        .valueType("0x001f")
                        .build())
                .build());

        assertTrue(source.contains("package com.acme.shell;"));
        assertTrue(source.contains("public final class ShellPropertyDefinitions {"));
        assertTrue(source.contains("public static Optional<Definition> lookup(String formatIdentifier, long propertyIdentifier)"));
        assertTrue(source.contains("public static int size()"));
        assertTrue(source.contains("put(definitions, new Definition(\"" + SUMMARY_INFORMATION
                + "\", 2L, \"System.Title\", \"PKEY_Title\", null, null, \"0x001f\"));"));
    }

    @Test
    @DisplayName("Registrations are split across methods to stay within the method size limit")
    void testChunking() throws IOException {
        int count = JavaLookupSourceGenerator.ENTRIES_PER_METHOD * 2 + 1;

        String source = render(sized(count));

        assertTrue(source.contains("private static void register0("));
        assertTrue(source.contains("private static void register1("));
        assertTrue(source.contains("private static void register2("));
        assertFalse(source.contains("register3"));
        assertEquals(count, source.split("put\\(definitions, new Definition", -1).length - 1);
    }

    @Test
    @DisplayName("An empty knowledge base still yields a compilable class")
    void testEmpty() throws IOException {
        String source = render(KnowledgeBase.empty());

        assertFalse(source.contains("register0"));
        assertTrue(source.contains("DEFINITIONS = Collections.unmodifiableMap(definitions);"));
    }

    @Test
    @DisplayName("Output is identical across runs")
    void testIdempotent() throws IOException {
        assertEquals(render(sized(20)), render(sized(20)));
    }

    @Test
    @DisplayName("String values are escaped as Java literals")
    void testLiteralEscaping() {
        assertEquals("null", JavaLookupSourceGenerator.literal(null));
        assertEquals("\"a\\\"b\"", JavaLookupSourceGenerator.literal("a\"b"));
        assertEquals("\"C:\\\\Windows\"", JavaLookupSourceGenerator.literal("C:\\Windows"));
        assertEquals("\"line\\nbreak\"", JavaLookupSourceGenerator.literal("line\nbreak"));
        assertEquals("\"caf\\u00e9\"", JavaLookupSourceGenerator.literal("caf\u00e9"));
    }

    @Test
    @DisplayName("Relative path mirrors the package")
    void testRelativePath() {
        assertEquals("com/acme/shell/ShellPropertyDefinitions.java", generator.relativePath());
        assertEquals("Props.java", new JavaLookupSourceGenerator("", "Props").relativePath());
        assertEquals(TargetFormat.JAVA_SOURCE, generator.getFormat());
    }

    @ParameterizedTest
    @DisplayName("Invalid class names are rejected")
    @ValueSource(strings = {"", "1Props", "class", "Shell Props"})
    void testInvalidClassName(String className) {
        assertThrows(IllegalArgumentException.class, () -> new JavaLookupSourceGenerator("com.acme", className));
    }

    @Test
    @DisplayName("Invalid package names are rejected")
    void testInvalidPackageName() {
        assertThrows(IllegalArgumentException.class, () -> new JavaLookupSourceGenerator("com..acme", "Props"));
    }
}
