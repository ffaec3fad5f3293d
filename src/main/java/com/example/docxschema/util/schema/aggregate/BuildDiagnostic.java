package com.example.docxschema.util.schema.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 构建诊断（可恢复，随 Schema 一起返回）
 */
public final class BuildDiagnostic {

    public enum Type {
        /** 必需角色没有达到阈值的候选 */
        MISSING_REQUIRED_ROLE
    }

    private final Type type;
    private final String role;
    private final String message;

    @JsonCreator
    public BuildDiagnostic(@JsonProperty("type") Type type,
                           @JsonProperty("role") String role,
                           @JsonProperty("message") String message) {
        this.type = type;
        this.role = role;
        this.message = message;
    }

    @JsonProperty("type")
    public Type getType() { return type; }

    @JsonProperty("role")
    public String getRole() { return role; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BuildDiagnostic)) return false;
        BuildDiagnostic that = (BuildDiagnostic) o;
        return type == that.type && Objects.equals(role, that.role) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, role, message);
    }

    @Override
    public String toString() {
        return type + "(" + role + "): " + message;
    }
}
