package com.example.docxschema.util.schema.feature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    private final StyleMeta title = StyleMeta.builder()
            .styleId("Heading1").styleName("heading 1").fontName("Arial").fontSize(20.0).bold(true).build();
    private final StyleMeta body = StyleMeta.builder()
            .styleId("Normal").fontName("Calibri").fontSize(11.0).alignment("BOTH").build();
    private final StyleMeta listItem = StyleMeta.builder().listLevel(0).indentLevel(1).build();

    private List<StructuralUnit> sample() {
        return Arrays.asList(
                StructuralUnit.paragraph(0, "Annual Report", title),
                StructuralUnit.paragraph(1, "This is the body text.  It has two sentences.", body),
                StructuralUnit.paragraph(2, "• first item", listItem));
    }

    @Test
    @DisplayName("位置特征：序号、相对位置、首尾")
    void positionalFeatures() {
        List<FeatureVector> fvs = extractor.extractAll(sample());

        assertThat(fvs).hasSize(3);
        assertThat(fvs.get(0).getInt(FeatureVector.INDEX)).isEqualTo(0);
        assertThat(fvs.get(0).getFlag(FeatureVector.IS_FIRST)).isTrue();
        assertThat(fvs.get(1).getNumber(FeatureVector.REL_POSITION)).isCloseTo(0.5, within(1e-9));
        assertThat(fvs.get(2).getFlag(FeatureVector.IS_LAST)).isTrue();
        assertThat(fvs.get(1).getFlag(FeatureVector.IS_FIRST)).isFalse();
    }

    @Test
    @DisplayName("文本形态特征")
    void lexicalFeatures() {
        FeatureVector fv = extractor.extractAll(sample()).get(1);

        assertThat(fv.text()).isEqualTo("This is the body text. It has two sentences.");
        assertThat(fv.getInt(FeatureVector.TOKEN_COUNT)).isEqualTo(9);
        assertThat(fv.getInt(FeatureVector.SENTENCE_COUNT)).isEqualTo(2);
        assertThat(fv.getFlag(FeatureVector.ENDS_WITH_PERIOD)).isTrue();
        assertThat(fv.getFlag(FeatureVector.TRAILING_COLON)).isFalse();
        assertThat(fv.getNumber(FeatureVector.PUNCT_DENSITY)).isGreaterThan(0.0);
        assertThat(fv.getCategory(FeatureVector.ALIGNMENT)).isEqualTo("both");
    }

    @Test
    @DisplayName("行首空白宽度按原文计算，制表符记 4")
    void leadingSpaces() {
        List<FeatureVector> fvs = extractor.extractAll(Arrays.asList(
                StructuralUnit.paragraph(0, "\t  return x;", body),
                StructuralUnit.paragraph(1, "no indent", body)));

        assertThat(fvs.get(0).getInt(FeatureVector.LEADING_SPACES)).isEqualTo(6);
        assertThat(fvs.get(0).text()).isEqualTo("return x;");
        assertThat(fvs.get(1).getInt(FeatureVector.LEADING_SPACES)).isEqualTo(0);
    }

    @Test
    @DisplayName("相对特征：字号差、大于上下文")
    void relativeFeatures() {
        List<FeatureVector> fvs = extractor.extractAll(sample());

        assertThat(fvs.get(0).getFlag(FeatureVector.LARGER_THAN_CONTEXT)).isTrue();
        assertThat(fvs.get(1).getFlag(FeatureVector.LARGER_THAN_CONTEXT)).isFalse();
        assertThat(fvs.get(1).getNumber(FeatureVector.FONT_SIZE_DELTA_PREV)).isCloseTo(-9.0, within(1e-9));
        // 未知字号不参与差值
        assertThat(fvs.get(2).getNumber(FeatureVector.FONT_SIZE_DELTA_PREV)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("列表项：项目符号、列表层级、缩进")
    void listFeatures() {
        FeatureVector fv = extractor.extractAll(sample()).get(2);

        assertThat(fv.getFlag(FeatureVector.STARTS_WITH_BULLET)).isTrue();
        assertThat(fv.getCategory(FeatureVector.BULLET_GLYPH)).isEqualTo("•");
        assertThat(fv.getFlag(FeatureVector.IN_LIST)).isTrue();
        assertThat(fv.getInt(FeatureVector.LIST_LEVEL)).isEqualTo(0);
        assertThat(fv.getInt(FeatureVector.INDENT_LEVEL)).isEqualTo(1);
    }

    @Test
    @DisplayName("缺失样式映射为 unknown 哨兵值而不是抛异常")
    void missingStyleMapsToSentinels() {
        StructuralUnit unit = new StructuralUnit(0, null, null, null);

        FeatureVector fv = extractor.extract(unit, ContextWindow.<StructuralUnit>empty());

        assertThat(fv.getCategory(FeatureVector.STYLE_ID)).isEqualTo(FeatureVector.UNKNOWN);
        assertThat(fv.getCategory(FeatureVector.FONT_NAME)).isEqualTo(FeatureVector.UNKNOWN);
        assertThat(fv.isUnknown(FeatureVector.FONT_SIZE)).isTrue();
        assertThat(fv.getFlag(FeatureVector.STYLE_KNOWN)).isFalse();
        assertThat(fv.getInt(FeatureVector.TABLE_ROW)).isEqualTo(-1);
        assertThat(fv.getInt(FeatureVector.TOKEN_COUNT)).isEqualTo(0);
    }

    @Test
    @DisplayName("编号前缀、邮箱、电话、目录点线")
    void markerFeatures() {
        List<FeatureVector> fvs = extractor.extractAll(Arrays.asList(
                StructuralUnit.paragraph(0, "1.2 Scope of work", StyleMeta.UNKNOWN),
                StructuralUnit.paragraph(1, "Contact: jane@example.com, +1 555 123 4567", StyleMeta.UNKNOWN),
                StructuralUnit.paragraph(2, "Introduction ........ 3", StyleMeta.UNKNOWN),
                StructuralUnit.paragraph(3, "- 3.5 is a negative number", StyleMeta.UNKNOWN)));

        assertThat(fvs.get(0).getCategory(FeatureVector.NUMBERING_PREFIX)).isEqualTo("1.2");
        assertThat(fvs.get(1).getFlag(FeatureVector.CONTAINS_EMAIL)).isTrue();
        assertThat(fvs.get(1).getFlag(FeatureVector.CONTAINS_PHONE)).isTrue();
        assertThat(fvs.get(1).getCategory(FeatureVector.NUMBERING_PREFIX)).isEqualTo(FeatureVector.NONE);
        assertThat(fvs.get(2).getFlag(FeatureVector.HAS_LEADER_DOTS)).isTrue();
        // 负数前的短横线不是项目符号
        assertThat(fvs.get(3).getFlag(FeatureVector.STARTS_WITH_BULLET)).isFalse();
    }

    @Test
    @DisplayName("表格单元格特征")
    void tableFeatures() {
        StyleMeta cell = StyleMeta.builder().table(new TableRef("t001", 1, 2, 3, 4)).build();
        FeatureVector fv = extractor.extractAll(Collections.singletonList(
                new StructuralUnit(0, StructuralUnit.Kind.TABLE_CELL, "42 | 17", cell))).get(0);

        assertThat(fv.getFlag(FeatureVector.IN_TABLE)).isTrue();
        assertThat(fv.getInt(FeatureVector.TABLE_ROW)).isEqualTo(1);
        assertThat(fv.getInt(FeatureVector.TABLE_COL)).isEqualTo(2);
        assertThat(fv.getFlag(FeatureVector.CONTAINS_DELIMITER)).isTrue();
    }

    @Test
    @DisplayName("确定性：同一输入两次提取结果相等")
    void deterministic() {
        assertThat(extractor.extractAll(sample())).isEqualTo(extractor.extractAll(sample()));
    }

    @Test
    @DisplayName("上下文窗口只包含前后 k 个单元")
    void contextWindowIsBounded() {
        List<Integer> seq = Arrays.asList(0, 1, 2, 3, 4, 5, 6);

        ContextWindow<Integer> window = ContextWindow.around(seq, 3, 2);

        assertThat(window.getBefore()).containsExactly(1, 2);
        assertThat(window.getAfter()).containsExactly(4, 5);
        assertThat(window.previous()).isEqualTo(2);
        assertThat(window.next()).isEqualTo(4);
        assertThat(ContextWindow.around(seq, 0, 2).previous()).isNull();
    }

    @Test
    @DisplayName("归一化：去首尾空白并合并内部空白")
    void normalize() {
        assertThat(FeatureExtractor.normalize("  a \t  b\n c  ")).isEqualTo("a b c");
        assertThat(FeatureExtractor.normalize(null)).isEmpty();
    }
}
