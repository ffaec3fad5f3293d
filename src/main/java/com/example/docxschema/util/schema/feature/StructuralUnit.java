package com.example.docxschema.util.schema.feature;

/**
 * 结构单元：源文档中的一个段落、表格单元格或 run 组
 *
 * 由 intake 层按文档顺序产生，index 即稳定的源顺序；构建后不可变。
 */
public final class StructuralUnit {

    /**
     * 单元类型
     */
    public enum Kind {
        PARAGRAPH,
        TABLE_CELL,
        RUN_GROUP
    }

    private final int index;
    private final Kind kind;
    private final String text;
    private final StyleMeta style;

    public StructuralUnit(int index, Kind kind, String text, StyleMeta style) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        this.index = index;
        this.kind = kind != null ? kind : Kind.PARAGRAPH;
        this.text = text != null ? text : "";
        this.style = style != null ? style : StyleMeta.UNKNOWN;
    }

    public static StructuralUnit paragraph(int index, String text, StyleMeta style) {
        return new StructuralUnit(index, Kind.PARAGRAPH, text, style);
    }

    public int getIndex() { return index; }
    public Kind getKind() { return kind; }
    public String getText() { return text; }
    public StyleMeta getStyle() { return style; }

    public Integer getListLevel() {
        return style.getListLevel();
    }

    /**
     * 所属表格（非表格单元返回 null）
     */
    public TableRef getTableRef() {
        return style.getTable();
    }

    @Override
    public String toString() {
        String preview = text.length() > 40 ? text.substring(0, 40) + "..." : text;
        return "Unit#" + index + "[" + kind + "] '" + preview + "'";
    }
}
