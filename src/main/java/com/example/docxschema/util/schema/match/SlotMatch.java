package com.example.docxschema.util.schema.match;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 匹配结果：(单元序号, 角色, 置信度) + 检测器抽取的字段
 */
public final class SlotMatch {

    private final int unitIndex;
    private final String role;
    private final double confidence;
    private final Map<String, String> fields;

    public SlotMatch(int unitIndex, String role, double confidence) {
        this(unitIndex, role, confidence, null);
    }

    public SlotMatch(int unitIndex, String role, double confidence, Map<String, String> fields) {
        this.unitIndex = unitIndex;
        this.role = role;
        this.confidence = confidence;
        this.fields = fields == null || fields.isEmpty()
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public int getUnitIndex() { return unitIndex; }
    public String getRole() { return role; }
    public double getConfidence() { return confidence; }
    public Map<String, String> getFields() { return fields; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotMatch)) return false;
        SlotMatch that = (SlotMatch) o;
        return unitIndex == that.unitIndex
                && Double.compare(that.confidence, confidence) == 0
                && role.equals(that.role)
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unitIndex, role, confidence, fields);
    }

    @Override
    public String toString() {
        return unitIndex + ":" + role + "=" + String.format("%.2f", confidence);
    }
}
