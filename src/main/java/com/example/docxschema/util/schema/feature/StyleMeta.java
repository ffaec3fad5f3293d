package com.example.docxschema.util.schema.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 结构单元的样式元数据（已解析）
 *
 * 包含：
 * - 段落样式ID/样式名
 * - 字体、字号、加粗/斜体/下划线
 * - 对齐方式、缩进层级
 * - 列表层级（非列表为 null）
 * - 表格形状（非表格为 null）
 *
 * 缺失的样式数据用 null 表示，由 FeatureExtractor 统一映射为 "unknown" 哨兵值。
 * 对象不可变；SchemaSlot 逐字段原样捕获该对象。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StyleMeta {

    /** 未解析到任何样式信息 */
    public static final StyleMeta UNKNOWN = builder().build();

    @JsonProperty("style_id")
    private final String styleId;

    @JsonProperty("style_name")
    private final String styleName;

    @JsonProperty("font_name")
    private final String fontName;

    @JsonProperty("font_size")
    private final Double fontSize;

    @JsonProperty("bold")
    private final Boolean bold;

    @JsonProperty("italic")
    private final Boolean italic;

    @JsonProperty("underline")
    private final Boolean underline;

    @JsonProperty("alignment")
    private final String alignment;

    @JsonProperty("indent_level")
    private final int indentLevel;

    @JsonProperty("list_level")
    private final Integer listLevel;

    @JsonProperty("table")
    private final TableRef table;

    @JsonCreator
    public StyleMeta(@JsonProperty("style_id") String styleId,
                     @JsonProperty("style_name") String styleName,
                     @JsonProperty("font_name") String fontName,
                     @JsonProperty("font_size") Double fontSize,
                     @JsonProperty("bold") Boolean bold,
                     @JsonProperty("italic") Boolean italic,
                     @JsonProperty("underline") Boolean underline,
                     @JsonProperty("alignment") String alignment,
                     @JsonProperty("indent_level") int indentLevel,
                     @JsonProperty("list_level") Integer listLevel,
                     @JsonProperty("table") TableRef table) {
        this.styleId = styleId;
        this.styleName = styleName;
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.bold = bold;
        this.italic = italic;
        this.underline = underline;
        this.alignment = alignment;
        this.indentLevel = Math.max(0, indentLevel);
        this.listLevel = listLevel;
        this.table = table;
    }

    public String getStyleId() { return styleId; }
    public String getStyleName() { return styleName; }
    public String getFontName() { return fontName; }
    public Double getFontSize() { return fontSize; }
    public Boolean getBold() { return bold; }
    public Boolean getItalic() { return italic; }
    public Boolean getUnderline() { return underline; }
    public String getAlignment() { return alignment; }
    public int getIndentLevel() { return indentLevel; }
    public Integer getListLevel() { return listLevel; }
    public TableRef getTable() { return table; }

    /**
     * 是否解析到了任何样式信息（样式ID、字体或字号任一存在）
     */
    @JsonIgnore
    public boolean isResolved() {
        return styleId != null || fontName != null || fontSize != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .styleId(styleId).styleName(styleName)
                .fontName(fontName).fontSize(fontSize)
                .bold(bold).italic(italic).underline(underline)
                .alignment(alignment).indentLevel(indentLevel)
                .listLevel(listLevel).table(table);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StyleMeta)) return false;
        StyleMeta that = (StyleMeta) o;
        return indentLevel == that.indentLevel
                && Objects.equals(styleId, that.styleId)
                && Objects.equals(styleName, that.styleName)
                && Objects.equals(fontName, that.fontName)
                && Objects.equals(fontSize, that.fontSize)
                && Objects.equals(bold, that.bold)
                && Objects.equals(italic, that.italic)
                && Objects.equals(underline, that.underline)
                && Objects.equals(alignment, that.alignment)
                && Objects.equals(listLevel, that.listLevel)
                && Objects.equals(table, that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(styleId, styleName, fontName, fontSize, bold, italic, underline,
                alignment, indentLevel, listLevel, table);
    }

    @Override
    public String toString() {
        return "StyleMeta{styleId=" + styleId + ", font=" + fontName + "/" + fontSize
                + ", b/i/u=" + bold + "/" + italic + "/" + underline
                + ", indent=" + indentLevel + ", list=" + listLevel + ", table=" + table + "}";
    }

    public static final class Builder {
        private String styleId;
        private String styleName;
        private String fontName;
        private Double fontSize;
        private Boolean bold;
        private Boolean italic;
        private Boolean underline;
        private String alignment;
        private int indentLevel;
        private Integer listLevel;
        private TableRef table;

        public Builder styleId(String styleId) { this.styleId = styleId; return this; }
        public Builder styleName(String styleName) { this.styleName = styleName; return this; }
        public Builder fontName(String fontName) { this.fontName = fontName; return this; }
        public Builder fontSize(Double fontSize) { this.fontSize = fontSize; return this; }
        public Builder bold(Boolean bold) { this.bold = bold; return this; }
        public Builder italic(Boolean italic) { this.italic = italic; return this; }
        public Builder underline(Boolean underline) { this.underline = underline; return this; }
        public Builder alignment(String alignment) { this.alignment = alignment; return this; }
        public Builder indentLevel(int indentLevel) { this.indentLevel = indentLevel; return this; }
        public Builder listLevel(Integer listLevel) { this.listLevel = listLevel; return this; }
        public Builder table(TableRef table) { this.table = table; return this; }

        public StyleMeta build() {
            return new StyleMeta(styleId, styleName, fontName, fontSize, bold, italic, underline,
                    alignment, indentLevel, listLevel, table);
        }
    }
}
