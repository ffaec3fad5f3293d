package com.example.docxschema.util.schema.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 推断出的文档 Schema：选中域 + 置信度 + 有序槽位 + 构建诊断
 *
 * 由 SchemaAggregator 产出后不可变；SchemaRunner 只读。
 */
public final class Schema {

    private final String domain;
    private final double confidence;
    private final List<SchemaSlot> slots;
    private final List<BuildDiagnostic> diagnostics;

    @JsonCreator
    public Schema(@JsonProperty("domain") String domain,
                  @JsonProperty("confidence") double confidence,
                  @JsonProperty("slots") List<SchemaSlot> slots,
                  @JsonProperty("diagnostics") List<BuildDiagnostic> diagnostics) {
        this.domain = domain;
        this.confidence = confidence;
        this.slots = slots == null ? Collections.<SchemaSlot>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(slots));
        this.diagnostics = diagnostics == null ? Collections.<BuildDiagnostic>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    @JsonProperty("domain")
    public String getDomain() { return domain; }

    @JsonProperty("confidence")
    public double getConfidence() { return confidence; }

    @JsonProperty("slots")
    public List<SchemaSlot> getSlots() { return slots; }

    @JsonProperty("diagnostics")
    public List<BuildDiagnostic> getDiagnostics() { return diagnostics; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        Schema that = (Schema) o;
        return Double.compare(that.confidence, confidence) == 0
                && Objects.equals(domain, that.domain)
                && slots.equals(that.slots)
                && diagnostics.equals(that.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, confidence, slots, diagnostics);
    }

    @Override
    public String toString() {
        return "Schema{" + domain + ", confidence=" + confidence + ", slots=" + slots + "}";
    }
}
