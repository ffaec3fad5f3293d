package com.example.docxschema.util.schema.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 特征向量：特征名 → 标量/类别值
 *
 * 每个 StructuralUnit 对应一个，由 FeatureExtractor 生成后不可变。
 * 缺失的类别特征取 {@link #UNKNOWN}，缺失的数值特征取 {@link #UNKNOWN_NUMBER}。
 */
public final class FeatureVector {

    /** 类别特征的缺失哨兵值 */
    public static final String UNKNOWN = "unknown";

    /** 数值特征的缺失哨兵值 */
    public static final double UNKNOWN_NUMBER = -1.0;

    /** 编号前缀缺失时的取值 */
    public static final String NONE = "none";

    // ==================== 特征名 ====================

    public static final String INDEX = "index";
    public static final String REL_POSITION = "rel_position";
    public static final String IS_FIRST = "is_first";
    public static final String IS_LAST = "is_last";

    public static final String TEXT = "text_norm";
    public static final String CHAR_LEN = "char_len";
    public static final String TOKEN_COUNT = "token_count";
    public static final String SENTENCE_COUNT = "sentence_count";
    public static final String UPPERCASE_RATIO = "uppercase_ratio";
    public static final String TITLECASE_RATE = "titlecase_rate";
    public static final String DIGIT_RATIO = "digit_ratio";
    public static final String PUNCT_DENSITY = "punct_density";
    public static final String WHITESPACE_DENSITY = "whitespace_density";
    /** 原文行首空白宽度（制表符记 4） */
    public static final String LEADING_SPACES = "leading_spaces";

    public static final String ENDS_WITH_PERIOD = "ends_with_period";
    public static final String TRAILING_COLON = "trailing_colon";
    public static final String STARTS_WITH_BULLET = "starts_with_bullet";
    public static final String BULLET_GLYPH = "bullet_glyph";
    public static final String NUMBERING_PREFIX = "numbering_prefix";
    public static final String HAS_LEADER_DOTS = "has_leader_dots";
    public static final String CONTAINS_EMAIL = "contains_email";
    public static final String CONTAINS_PHONE = "contains_phone";
    public static final String CONTAINS_URL = "contains_url";
    public static final String CONTAINS_DELIMITER = "contains_delimiter";

    public static final String STYLE_ID = "style_id";
    public static final String STYLE_NAME = "style_name";
    public static final String STYLE_KNOWN = "style_known";
    public static final String FONT_NAME = "font_name";
    public static final String FONT_SIZE = "font_size";
    public static final String BOLD = "bold";
    public static final String ITALIC = "italic";
    public static final String UNDERLINE = "underline";
    public static final String ALIGNMENT = "alignment";
    public static final String INDENT_LEVEL = "indent_level";
    public static final String LIST_LEVEL = "list_level";
    public static final String IN_LIST = "in_list";
    public static final String IN_TABLE = "in_table";
    public static final String TABLE_ROW = "table_row";
    public static final String TABLE_COL = "table_col";

    public static final String FONT_SIZE_DELTA_PREV = "font_size_delta_prev";
    public static final String LARGER_THAN_CONTEXT = "larger_than_context";
    public static final String SAME_STYLE_AS_PREV = "same_style_as_prev";

    private final Map<String, Object> values;

    public FeatureVector(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * 数值特征；缺失或非数值时返回 {@link #UNKNOWN_NUMBER}
     */
    public double getNumber(String name) {
        Object v = values.get(name);
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        return UNKNOWN_NUMBER;
    }

    public int getInt(String name) {
        return (int) getNumber(name);
    }

    /**
     * 布尔特征；缺失时为 false
     */
    public boolean getFlag(String name) {
        Object v = values.get(name);
        return v instanceof Boolean && (Boolean) v;
    }

    /**
     * 类别特征；缺失时返回 {@link #UNKNOWN}
     */
    public String getCategory(String name) {
        Object v = values.get(name);
        return v != null ? v.toString() : UNKNOWN;
    }

    public boolean isUnknown(String name) {
        Object v = values.get(name);
        if (v == null) return true;
        if (v instanceof Number) return ((Number) v).doubleValue() == UNKNOWN_NUMBER;
        return UNKNOWN.equals(v);
    }

    public String text() {
        Object v = values.get(TEXT);
        return v != null ? v.toString() : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return values.equals(((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + values;
    }
}
