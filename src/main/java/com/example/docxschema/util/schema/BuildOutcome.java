package com.example.docxschema.util.schema;

import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.score.DomainSelection;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Schema 构建结果
 *
 * 无可信域时 schema 为 null，selection 中保留各域得分供调用方展示候选。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BuildOutcome {

    private final DomainSelection selection;
    private final Schema schema;

    private BuildOutcome(DomainSelection selection, Schema schema) {
        this.selection = selection;
        this.schema = schema;
    }

    public static BuildOutcome built(DomainSelection selection, Schema schema) {
        return new BuildOutcome(selection, schema);
    }

    public static BuildOutcome noConfidentDomain(DomainSelection selection) {
        return new BuildOutcome(selection, null);
    }

    @JsonProperty("selection")
    public DomainSelection getSelection() { return selection; }

    @JsonProperty("schema")
    public Schema getSchema() { return schema; }

    @JsonIgnore
    public boolean isBuilt() {
        return schema != null;
    }

    @Override
    public String toString() {
        return "BuildOutcome{" + (isBuilt() ? schema.getDomain() : selection.getOutcome()) + "}";
    }
}
