package com.example.docxschema.util.schema.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 运行诊断（非致命，随结果返回）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunDiagnostic {

    public enum Type {
        /** 内容耗尽，必需槽位以空文本渲染 */
        UNFILLED_REQUIRED_SLOT,
        /** 所有槽位用完后仍有剩余内容块，追加为溢出单元 */
        OVERFLOW,
        /** 兼容性检查未通过，跳过了可选槽位 */
        SKIPPED_OPTIONAL_SLOT
    }

    private final Type type;
    private final String slotId;
    private final String role;
    private final String message;

    @JsonCreator
    public RunDiagnostic(@JsonProperty("type") Type type,
                         @JsonProperty("slot_id") String slotId,
                         @JsonProperty("role") String role,
                         @JsonProperty("message") String message) {
        this.type = type;
        this.slotId = slotId;
        this.role = role;
        this.message = message;
    }

    @JsonProperty("type")
    public Type getType() { return type; }

    @JsonProperty("slot_id")
    public String getSlotId() { return slotId; }

    @JsonProperty("role")
    public String getRole() { return role; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunDiagnostic)) return false;
        RunDiagnostic that = (RunDiagnostic) o;
        return type == that.type && Objects.equals(slotId, that.slotId)
                && Objects.equals(role, that.role) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, slotId, role, message);
    }

    @Override
    public String toString() {
        return type + "(" + slotId + "/" + role + "): " + message;
    }
}
