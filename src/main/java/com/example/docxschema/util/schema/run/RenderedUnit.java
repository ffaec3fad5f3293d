package com.example.docxschema.util.schema.run;

import com.example.docxschema.util.schema.feature.StyleMeta;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 输出单元：内容块文本 + 槽位捕获的样式
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RenderedUnit {

    /** 溢出槽位的 slot id / role */
    public static final String OVERFLOW = "overflow";

    private final String slotId;
    private final String role;
    private final String text;
    private final StyleMeta style;
    private final int ordinal;
    private final Integer sourceBlock;
    private final boolean filled;
    private final boolean overflow;

    @JsonCreator
    public RenderedUnit(@JsonProperty("slot_id") String slotId,
                        @JsonProperty("role") String role,
                        @JsonProperty("text") String text,
                        @JsonProperty("style") StyleMeta style,
                        @JsonProperty("ordinal") int ordinal,
                        @JsonProperty("source_block") Integer sourceBlock,
                        @JsonProperty("filled") boolean filled,
                        @JsonProperty("overflow") boolean overflow) {
        this.slotId = slotId;
        this.role = role;
        this.text = text != null ? text : "";
        this.style = style != null ? style : StyleMeta.UNKNOWN;
        this.ordinal = ordinal;
        this.sourceBlock = sourceBlock;
        this.filled = filled;
        this.overflow = overflow;
    }

    @JsonProperty("slot_id")
    public String getSlotId() { return slotId; }

    @JsonProperty("role")
    public String getRole() { return role; }

    @JsonProperty("text")
    public String getText() { return text; }

    @JsonProperty("style")
    public StyleMeta getStyle() { return style; }

    @JsonProperty("ordinal")
    public int getOrdinal() { return ordinal; }

    /** 来源内容块序号；空渲染的必需槽位为 null */
    @JsonProperty("source_block")
    public Integer getSourceBlock() { return sourceBlock; }

    @JsonProperty("filled")
    public boolean isFilled() { return filled; }

    @JsonProperty("overflow")
    public boolean isOverflow() { return overflow; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderedUnit)) return false;
        RenderedUnit that = (RenderedUnit) o;
        return ordinal == that.ordinal && filled == that.filled && overflow == that.overflow
                && Objects.equals(slotId, that.slotId) && Objects.equals(role, that.role)
                && text.equals(that.text) && style.equals(that.style)
                && Objects.equals(sourceBlock, that.sourceBlock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slotId, role, text, style, ordinal, sourceBlock, filled, overflow);
    }

    @Override
    public String toString() {
        return ordinal + ":" + slotId + "/" + role + "=\"" + text + "\"" + (filled ? "" : " (unfilled)")
                + (overflow ? " (overflow)" : "");
    }
}
