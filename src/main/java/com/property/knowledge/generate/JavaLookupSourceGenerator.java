package com.property.knowledge.generate;

import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.kb.KnowledgeBase;

import javax.lang.model.SourceVersion;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Generates the Java source of a static lookup table from shell property key to
 * display metadata, for use by the property store parser without any dependency
 * on this pipeline.
 *
 * <p>The generated class exposes {@code lookup(String formatIdentifier, long propertyIdentifier)}
 * and {@code size()}. Entries are registered from several private methods of at most
 * {@value #ENTRIES_PER_METHOD} entries each, keeping every method well below the
 * class file limit of 64 KB of bytecode.</p>
 */
public class JavaLookupSourceGenerator implements ResourceGenerator {

    static final int ENTRIES_PER_METHOD = 500;
    private static final String INDENT = "    ";

    private final String packageName;
    private final String className;

    public JavaLookupSourceGenerator(String packageName, String className) {
        this.packageName = Objects.requireNonNull(packageName, "packageName is required");
        this.className = Objects.requireNonNull(className, "className is required");
        if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
            throw new IllegalArgumentException("Invalid package name: " + packageName);
        }
        if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
            throw new IllegalArgumentException("Invalid class name: " + className);
        }
    }

    public String getPackageName() {
        return packageName;
    }

    public String getClassName() {
        return className;
    }

    /**
     * File name of the generated source relative to a source root, e.g. {@code com/acme/Props.java}.
     */
    public String relativePath() {
        String directory = packageName.isEmpty() ? "" : packageName.replace('.', '/') + "/";
        return directory + className + ".java";
    }

    @Override
    public TargetFormat getFormat() {
        return TargetFormat.JAVA_SOURCE;
    }

    @Override
    public long write(KnowledgeBase knowledgeBase, Writer writer) throws IOException {
        List<CanonicalEntry> entries = knowledgeBase.entries();
        int chunks = (entries.size() + ENTRIES_PER_METHOD - 1) / ENTRIES_PER_METHOD;

        StringBuilder sb = new StringBuilder();
        sb.append("// Generated from the shell property knowledge base. Do not edit.\n");
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n");
        }
        sb.append('\n');
        sb.append("import java.util.Collections;\n");
        sb.append("import java.util.HashMap;\n");
        sb.append("import java.util.Locale;\n");
        sb.append("import java.util.Map;\n");
        sb.append("import java.util.Optional;\n");
        sb.append('\n');
        sb.append("/**\n");
        sb.append(" * Shell property key definitions, keyed by format identifier and property identifier.\n");
        sb.append(" */\n");
        sb.append("public final class ").append(className).append(" {\n\n");

        line(sb, 1, "/**");
        line(sb, 1, " * Display metadata of one shell property. Absent values are {@code null}.");
        line(sb, 1, " */");
        line(sb, 1, "public record Definition(");
        line(sb, 3, "String formatIdentifier,");
        line(sb, 3, "long propertyIdentifier,");
        line(sb, 3, "String name,");
        line(sb, 3, "String shellPropertyKey,");
        line(sb, 3, "String formatClass,");
        line(sb, 3, "String alias,");
        line(sb, 3, "String valueType) {");
        line(sb, 1, "}");
        sb.append('\n');

        line(sb, 1, "private static final Map<String, Definition> DEFINITIONS;");
        sb.append('\n');
        line(sb, 1, "static {");
        line(sb, 2, "Map<String, Definition> definitions = new HashMap<>(" + capacity(entries.size()) + ");");
        for (int chunk = 0; chunk < chunks; chunk++) {
            line(sb, 2, "register" + chunk + "(definitions);");
        }
        line(sb, 2, "DEFINITIONS = Collections.unmodifiableMap(definitions);");
        line(sb, 1, "}");
        sb.append('\n');

        line(sb, 1, "private " + className + "() {");
        line(sb, 1, "}");
        sb.append('\n');

        line(sb, 1, "/**");
        line(sb, 1, " * Looks up a property. The format identifier may be upper-case or enclosed in braces.");
        line(sb, 1, " */");
        line(sb, 1, "public static Optional<Definition> lookup(String formatIdentifier, long propertyIdentifier) {");
        line(sb, 2, "if (formatIdentifier == null) {");
        line(sb, 3, "return Optional.empty();");
        line(sb, 2, "}");
        line(sb, 2, "String guid = formatIdentifier.strip().toLowerCase(Locale.ROOT);");
        line(sb, 2, "if (guid.startsWith(\"{\") && guid.endsWith(\"}\")) {");
        line(sb, 3, "guid = guid.substring(1, guid.length() - 1);");
        line(sb, 2, "}");
        line(sb, 2, "return Optional.ofNullable(DEFINITIONS.get(guid + \"/\" + propertyIdentifier));");
        line(sb, 1, "}");
        sb.append('\n');

        line(sb, 1, "public static int size() {");
        line(sb, 2, "return DEFINITIONS.size();");
        line(sb, 1, "}");
        sb.append('\n');

        line(sb, 1, "private static void put(Map<String, Definition> definitions, Definition definition) {");
        line(sb, 2, "definitions.put(definition.formatIdentifier() + \"/\" + definition.propertyIdentifier(), definition);");
        line(sb, 1, "}");

        for (int chunk = 0; chunk < chunks; chunk++) {
            sb.append('\n');
            line(sb, 1, "private static void register" + chunk + "(Map<String, Definition> definitions) {");
            int end = Math.min(entries.size(), (chunk + 1) * ENTRIES_PER_METHOD);
            for (int i = chunk * ENTRIES_PER_METHOD; i < end; i++) {
                line(sb, 2, "put(definitions, " + definitionExpression(entries.get(i)) + ");");
            }
            line(sb, 1, "}");
        }
        sb.append("}\n");

        writer.write(sb.toString());
        writer.flush();
        return entries.size();
    }

    private static String definitionExpression(CanonicalEntry entry) {
        return "new Definition("
                + literal(entry.formatIdentifier()) + ", "
                + entry.propertyIdentifier() + "L, "
                + literal(entry.name()) + ", "
                + literal(entry.shellPropertyKey()) + ", "
                + literal(entry.formatClass()) + ", "
                + literal(entry.alias()) + ", "
                + literal(entry.valueType()) + ")";
    }

    /**
     * Renders a Java string literal; non-ASCII and control characters become unicode escapes.
     */
    static String literal(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static int capacity(int size) {
        return Math.max(16, (int) (size / 0.75f) + 1);
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
