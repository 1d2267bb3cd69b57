package com.property.knowledge.generate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.property.knowledge.core.model.CanonicalEntry;
import com.property.knowledge.core.model.RecordField;
import com.property.knowledge.kb.KnowledgeBase;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the persisted definitions file.
 *
 * <p>Output format:</p>
 * <pre>
 * # winsps-kb property definitions
 * ---
 * name: System.Title
 * shell_property_key: PKEY_Title
 * format_identifier: f29f85e0-4ff9-1068-ab91-08002b27b3d9
 * format_class: FMTID_SummaryInformation
 * property_identifier: 2
 * alias: PIDSI_TITLE
 * value_type: VT_LPWSTR
 * </pre>
 *
 * <p>Keys always appear in this order; absent fields are omitted. The file
 * reads back through {@link com.property.knowledge.source.YamlRecordReader}.</p>
 */
public class YamlKnowledgeBaseWriter implements ResourceGenerator {

    public static final String HEADER = "# winsps-kb property definitions";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
            new YAMLFactory()
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                    .disable(YAMLGenerator.Feature.SPLIT_LINES)
                    .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                    .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS));

    @Override
    public TargetFormat getFormat() {
        return TargetFormat.YAML;
    }

    @Override
    public long write(KnowledgeBase knowledgeBase, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');

        long written = 0;
        for (CanonicalEntry entry : knowledgeBase) {
            writer.write("---\n");
            writer.write(YAML_MAPPER.writeValueAsString(toDocument(entry)));
            written++;
        }
        writer.flush();
        return written;
    }

    static Map<String, Object> toDocument(CanonicalEntry entry) {
        Map<String, Object> document = new LinkedHashMap<>();
        putIfPresent(document, RecordField.NAME, entry.name());
        putIfPresent(document, RecordField.SHELL_PROPERTY_KEY, entry.shellPropertyKey());
        document.put("format_identifier", entry.formatIdentifier());
        putIfPresent(document, RecordField.FORMAT_CLASS, entry.formatClass());
        document.put("property_identifier", entry.propertyIdentifier());
        putIfPresent(document, RecordField.ALIAS, entry.alias());
        putIfPresent(document, RecordField.VALUE_TYPE, entry.valueType());
        return document;
    }

    private static void putIfPresent(Map<String, Object> document, RecordField field, String value) {
        if (value != null) {
            document.put(field.getKey(), value);
        }
    }
}
