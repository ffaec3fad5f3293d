package com.example.docxschema.util.schema.detect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 检测结果：(角色名, 置信度 [0,1], 抽取字段)
 *
 * 每个单元可有多个结果（每个检测器一个），最终由 Matcher 决出唯一角色。
 */
public final class DetectionResult {

    private final String role;
    private final double confidence;
    private final Map<String, String> fields;

    public DetectionResult(String role, double confidence, Map<String, String> fields) {
        this.role = role;
        this.confidence = clamp(confidence);
        this.fields = fields == null || fields.isEmpty()
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static DetectionResult none(String role) {
        return new DetectionResult(role, 0.0, null);
    }

    /**
     * 换成域内角色名（检测器按种类命名，DomainPack 按角色命名）
     */
    public DetectionResult withRole(String newRole) {
        return new DetectionResult(newRole, confidence, fields);
    }

    public String getRole() { return role; }
    public double getConfidence() { return confidence; }
    public Map<String, String> getFields() { return fields; }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        return role + "=" + String.format("%.2f", confidence) + (fields.isEmpty() ? "" : " " + fields);
    }
}
