package com.example.docxschema.util.docx;

import com.example.docxschema.util.schema.aggregate.Schema;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;

/**
 * Schema 的 JSON 持久化
 *
 * 调用方保存后可直接重新加载运行，不需要重新检测。
 */
public final class SchemaJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SchemaJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Schema schema) throws IOException {
        return MAPPER.writeValueAsString(schema);
    }

    public static Schema fromJson(String json) throws IOException {
        return MAPPER.readValue(json, Schema.class);
    }

    public static void write(Schema schema, File file) throws IOException {
        MAPPER.writeValue(file, schema);
    }

    public static Schema read(File file) throws IOException {
        return MAPPER.readValue(file, Schema.class);
    }
}
