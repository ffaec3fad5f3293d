package com.example.docxschema.util.schema.aggregate;

import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema 槽位
 *
 * style 是匹配单元样式的原样拷贝（不是检测器的判断）；
 * placeholder 为可重新生成内容的占位标记，形如 {{role}}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SchemaSlot {

    private final String slotId;
    private final String role;
    private final String patternType;
    private final Cardinality cardinality;
    private final int realizedCount;
    private final StyleMeta style;
    private final int ordinal;
    private final List<Integer> sourceIndices;
    private final String placeholder;
    private final double confidence;
    private final Map<String, String> fields;

    @JsonCreator
    public SchemaSlot(@JsonProperty("slot_id") String slotId,
                      @JsonProperty("role") String role,
                      @JsonProperty("pattern_type") String patternType,
                      @JsonProperty("cardinality") Cardinality cardinality,
                      @JsonProperty("realized_count") int realizedCount,
                      @JsonProperty("style") StyleMeta style,
                      @JsonProperty("ordinal") int ordinal,
                      @JsonProperty("source_indices") List<Integer> sourceIndices,
                      @JsonProperty("placeholder") String placeholder,
                      @JsonProperty("confidence") double confidence,
                      @JsonProperty("fields") Map<String, String> fields) {
        this.slotId = slotId;
        this.role = role;
        this.patternType = patternType;
        this.cardinality = cardinality;
        this.realizedCount = realizedCount;
        this.style = style != null ? style : StyleMeta.UNKNOWN;
        this.ordinal = ordinal;
        this.sourceIndices = sourceIndices == null ? Collections.<Integer>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(sourceIndices));
        this.placeholder = placeholder;
        this.confidence = confidence;
        this.fields = fields == null ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static String placeholderFor(String role) {
        return "{{" + role + "}}";
    }

    @JsonProperty("slot_id")
    public String getSlotId() { return slotId; }

    @JsonProperty("role")
    public String getRole() { return role; }

    @JsonProperty("pattern_type")
    public String getPatternType() { return patternType; }

    @JsonProperty("cardinality")
    public Cardinality getCardinality() { return cardinality; }

    @JsonProperty("realized_count")
    public int getRealizedCount() { return realizedCount; }

    @JsonProperty("style")
    public StyleMeta getStyle() { return style; }

    @JsonProperty("ordinal")
    public int getOrdinal() { return ordinal; }

    @JsonProperty("source_indices")
    public List<Integer> getSourceIndices() { return sourceIndices; }

    @JsonProperty("placeholder")
    public String getPlaceholder() { return placeholder; }

    @JsonProperty("confidence")
    public double getConfidence() { return confidence; }

    @JsonProperty("fields")
    public Map<String, String> getFields() { return fields; }

    @JsonIgnore
    public boolean isRequired() {
        return cardinality != null && cardinality.isRequired();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaSlot)) return false;
        SchemaSlot that = (SchemaSlot) o;
        return realizedCount == that.realizedCount
                && ordinal == that.ordinal
                && Double.compare(that.confidence, confidence) == 0
                && Objects.equals(slotId, that.slotId)
                && Objects.equals(role, that.role)
                && Objects.equals(patternType, that.patternType)
                && cardinality == that.cardinality
                && style.equals(that.style)
                && sourceIndices.equals(that.sourceIndices)
                && Objects.equals(placeholder, that.placeholder)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slotId, role, patternType, cardinality, realizedCount, style, ordinal,
                sourceIndices, placeholder, confidence, fields);
    }

    @Override
    public String toString() {
        return slotId + "[" + role + ", " + cardinality + " x" + realizedCount + ", units=" + sourceIndices + "]";
    }
}
