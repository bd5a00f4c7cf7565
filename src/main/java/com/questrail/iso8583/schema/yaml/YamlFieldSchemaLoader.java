package com.questrail.iso8583.schema.yaml;

import com.questrail.iso8583.schema.FieldRule;
import com.questrail.iso8583.schema.FieldSchema;
import com.questrail.iso8583.schema.SchemaLoadException;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * YamlFieldSchemaLoader
 * =============================================================================
 * Reads a field schema document and produces an immutable {@link FieldSchema}.
 *
 * <p>Document shape:</p>
 * <pre>
 * 0:
 *   ContentType: n
 *   Label: Message Type Indicator
 *   LenType: fixed
 *   MaxLen: 4
 * 2:
 *   ContentType: n
 *   Label: Primary Account Number
 *   LenType: llvar
 *   MaxLen: 19
 * </pre>
 *
 * <p>Keys may be YAML integers or numeric strings. Every failure, from a
 * missing file to a schema that violates {@link FieldSchema}'s invariants, is
 * reported as a {@link SchemaLoadException}. Each successful load returns a
 * fresh schema; nothing is merged with earlier loads.</p>
 */
public final class YamlFieldSchemaLoader
{
    /** File name looked up in the working directory by {@link #loadDefault()}. */
    public static final String DEFAULT_SCHEMA_FILE = "isopackager.yml";

    /** Bundled ISO 8583:1987 text-encoded schema. */
    public static final String ISO87_ASCII_RESOURCE = "iso8583/iso87ascii.yml";

    static final String CONTENT_TYPE = "ContentType";
    static final String LABEL = "Label";
    static final String LEN_TYPE = "LenType";
    static final String MAX_LEN = "MaxLen";

    public FieldSchema loadDefault() throws SchemaLoadException {
        return loadDefault(Path.of(""));
    }

    /**
     * Loads {@value #DEFAULT_SCHEMA_FILE} from {@code baseDir}.
     */
    public FieldSchema loadDefault(Path baseDir) throws SchemaLoadException {
        Objects.requireNonNull(baseDir, "baseDir");
        return load(baseDir.resolve(DEFAULT_SCHEMA_FILE));
    }

    public FieldSchema load(Path path) throws SchemaLoadException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new SchemaLoadException("Field schema file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read field schema " + path, e);
        }
    }

    public FieldSchema loadResource(String resource) throws SchemaLoadException {
        Objects.requireNonNull(resource, "resource");
        InputStream in = YamlFieldSchemaLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new SchemaLoadException("Field schema resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read field schema resource " + resource, e);
        }
    }

    public FieldSchema load(Reader reader, String sourceName) throws SchemaLoadException {
        Objects.requireNonNull(reader, "reader");

        final Object root;
        try {
            root = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new SchemaLoadException("Malformed YAML in field schema " + sourceName, e);
        }

        if (!(root instanceof Map<?, ?> entries)) {
            throw new SchemaLoadException(
                    "Field schema " + sourceName + " must be a mapping of field number to field rule");
        }

        FieldSchema.Builder builder = FieldSchema.builder();
        try {
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                int field = toInt(entry.getKey(), "field number");
                builder.field(field, toRule(field, entry.getValue()));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SchemaLoadException("Invalid field schema " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private static FieldRule toRule(int field, Object node) {
        if (!(node instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("field " + field + " must be a mapping");
        }
        String contentType = requireString(map, CONTENT_TYPE, field);
        String lenType = requireString(map, LEN_TYPE, field);
        Object label = map.get(LABEL);
        Object maxLen = map.get(MAX_LEN);
        if (maxLen == null) {
            throw new IllegalArgumentException("field " + field + " is missing " + MAX_LEN);
        }
        return new FieldRule(
                contentType,
                label == null ? "" : label.toString(),
                lenType,
                toInt(maxLen, MAX_LEN + " of field " + field));
    }

    private static String requireString(Map<?, ?> map, String key, int field) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("field " + field + " is missing " + key);
        }
        return value.toString();
    }

    private static int toInt(Object value, String what) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(what + " is not an integer: '" + s + "'");
            }
        }
        throw new IllegalArgumentException(what + " is not an integer: " + value);
    }
}
