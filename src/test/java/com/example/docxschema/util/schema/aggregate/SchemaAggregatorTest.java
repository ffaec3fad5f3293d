package com.example.docxschema.util.schema.aggregate;

import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.match.SlotMatch;
import com.example.docxschema.util.schema.score.DomainScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.example.docxschema.util.schema.SchemaFixtures.BODY_STYLE;
import static com.example.docxschema.util.schema.SchemaFixtures.HEADING_STYLE;
import static com.example.docxschema.util.schema.SchemaFixtures.fixed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SchemaAggregatorTest {

    private final SchemaAggregator aggregator = new SchemaAggregator();

    private final DomainPack pack = DomainPack.builder("REPORT_LIKE")
            .role("title", DetectorKind.TITLE, Cardinality.EXACTLY_ONE)
            .role("subtitle", DetectorKind.HEADING, Cardinality.OPTIONAL)
            .role("body", DetectorKind.BODY, Cardinality.REPEATABLE)
            .role("closing", DetectorKind.CLOSING, Cardinality.EXACTLY_ONE)
            .build();

    private final List<StructuralUnit> units = Arrays.asList(
            StructuralUnit.paragraph(0, "Annual Report", HEADING_STYLE),
            StructuralUnit.paragraph(1, "First paragraph of body text.", BODY_STYLE),
            StructuralUnit.paragraph(2, "Second paragraph of body text.", BODY_STYLE),
            StructuralUnit.paragraph(3, "Thank you", BODY_STYLE.toBuilder().italic(true).build()));

    private final DomainScore score = new DomainScore("REPORT_LIKE", 1, 0.8, 0,
            Collections.<DomainScore.Anchor>emptyList());

    private List<SlotMatch> matches() {
        return Arrays.asList(
                new SlotMatch(0, "title", 0.9),
                new SlotMatch(1, "body", 0.8),
                new SlotMatch(2, "body", 0.6),
                new SlotMatch(3, "closing", 0.7, Collections.singletonMap("k", "v")));
    }

    @Test
    @DisplayName("连续的可重复角色合并为一个槽位")
    void mergesRepeatableRuns() {
        Schema schema = aggregator.aggregate(matches(), units, pack, score);

        assertThat(schema.getDomain()).isEqualTo("REPORT_LIKE");
        assertThat(schema.getConfidence()).isEqualTo(0.8);
        assertThat(schema.getSlots()).extracting(SchemaSlot::getRole).containsExactly("title", "body", "closing");
        SchemaSlot body = schema.getSlots().get(1);
        assertThat(body.getSlotId()).isEqualTo("slot-002");
        assertThat(body.getOrdinal()).isEqualTo(1);
        assertThat(body.getRealizedCount()).isEqualTo(2);
        assertThat(body.getSourceIndices()).containsExactly(1, 2);
        assertThat(body.getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(body.getPlaceholder()).isEqualTo("{{body}}");
        assertThat(body.getPatternType()).isEqualTo("BODY");
        assertThat(body.isRequired()).isFalse();
        assertThat(schema.getSlots().get(2).getFields()).containsEntry("k", "v");
        assertThat(schema.getDiagnostics()).isEmpty();
    }

    @Test
    @DisplayName("槽位样式取自首个来源单元的样式")
    void slotStyleComesFromFirstSourceUnit() {
        Schema schema = aggregator.aggregate(matches(), units, pack, score);

        assertThat(schema.getSlots().get(0).getStyle()).isEqualTo(HEADING_STYLE);
        assertThat(schema.getSlots().get(1).getStyle()).isEqualTo(BODY_STYLE);
        assertThat(schema.getSlots().get(2).getStyle().getItalic()).isTrue();
    }

    @Test
    @DisplayName("同一输入聚合两次结果相等")
    void idempotent() {
        assertThat(aggregator.aggregate(matches(), units, pack, score))
                .isEqualTo(aggregator.aggregate(matches(), units, pack, score));
    }

    @Test
    @DisplayName("必需角色未实现时给出诊断而不是失败")
    void missingRequiredRoleIsDiagnosed() {
        Schema schema = aggregator.aggregate(Arrays.asList(
                new SlotMatch(0, "title", 0.9),
                new SlotMatch(1, "body", 0.8)), units, pack, score);

        assertThat(schema.getDiagnostics()).hasSize(1);
        BuildDiagnostic diagnostic = schema.getDiagnostics().get(0);
        assertThat(diagnostic.getType()).isEqualTo(BuildDiagnostic.Type.MISSING_REQUIRED_ROLE);
        assertThat(diagnostic.getRole()).isEqualTo("closing");
    }

    @Test
    @DisplayName("直接注入检测器的角色模式类型为 CUSTOM")
    void customPatternType() {
        DomainPack custom = DomainPack.builder("C")
                .role("only", fixed(1.0), Cardinality.EXACTLY_ONE)
                .build();

        Schema schema = aggregator.aggregate(Collections.singletonList(new SlotMatch(0, "only", 1.0)),
                units, custom, null);

        assertThat(schema.getSlots().get(0).getPatternType()).isEqualTo("CUSTOM");
        assertThat(schema.getConfidence()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("单元序号不递增时抛 SchemaIntegrityException")
    void rejectsNonMonotonicIndices() {
        List<SlotMatch> bad = Arrays.asList(new SlotMatch(1, "title", 0.9), new SlotMatch(1, "body", 0.8));

        assertThatThrownBy(() -> aggregator.aggregate(bad, units, pack, score))
                .isInstanceOf(SchemaIntegrityException.class)
                .hasMessageContaining("Non-monotonic");
    }

    @Test
    @DisplayName("引用不存在的单元时抛 SchemaIntegrityException")
    void rejectsUnitOutOfRange() {
        List<SlotMatch> bad = Collections.singletonList(new SlotMatch(9, "title", 0.9));

        assertThatThrownBy(() -> aggregator.aggregate(bad, units, pack, score))
                .isInstanceOf(SchemaIntegrityException.class);
    }

    @Test
    @DisplayName("未知角色抛 SchemaIntegrityException")
    void rejectsUnknownRole() {
        List<SlotMatch> bad = Collections.singletonList(new SlotMatch(0, "ghost", 0.9));

        assertThatThrownBy(() -> aggregator.aggregate(bad, units, pack, score))
                .isInstanceOf(SchemaIntegrityException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("不可重复角色出现两次抛 SchemaIntegrityException")
    void rejectsRepeatedSingleRole() {
        List<SlotMatch> bad = Arrays.asList(
                new SlotMatch(0, "title", 0.9),
                new SlotMatch(1, "subtitle", 0.8),
                new SlotMatch(2, "subtitle", 0.8));

        assertThatThrownBy(() -> aggregator.aggregate(bad, units, pack, score))
                .isInstanceOf(SchemaIntegrityException.class)
                .hasMessageContaining("subtitle");
    }

    @Test
    @DisplayName("必需角色顺序与声明顺序不符时抛 SchemaIntegrityException")
    void rejectsRequiredRolesOutOfOrder() {
        List<SlotMatch> bad = Arrays.asList(new SlotMatch(0, "closing", 0.9), new SlotMatch(1, "title", 0.8));

        assertThatThrownBy(() -> aggregator.aggregate(bad, units, pack, score))
                .isInstanceOf(SchemaIntegrityException.class)
                .hasMessageContaining("order");
    }

    @Test
    @DisplayName("样式未知的单元也能聚合，槽位样式为 UNKNOWN")
    void unknownStyle() {
        List<StructuralUnit> bare = Collections.singletonList(StructuralUnit.paragraph(0, "x", null));

        Schema schema = aggregator.aggregate(Collections.singletonList(new SlotMatch(0, "title", 0.9)),
                bare, pack, score);

        assertThat(schema.getSlots().get(0).getStyle()).isEqualTo(StyleMeta.UNKNOWN);
    }
}
