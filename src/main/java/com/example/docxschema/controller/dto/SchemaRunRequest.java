package com.example.docxschema.controller.dto;

import com.example.docxschema.util.schema.aggregate.Schema;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 运行预览请求：已保存的 Schema + 新的纯文本内容
 */
public class SchemaRunRequest {

    @JsonProperty("schema")
    private Schema schema;

    @JsonProperty("text")
    private String text;

    public Schema getSchema() { return schema; }
    public void setSchema(Schema schema) { this.schema = schema; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
}
