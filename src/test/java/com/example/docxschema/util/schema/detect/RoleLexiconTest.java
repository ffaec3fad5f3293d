package com.example.docxschema.util.schema.detect;

import com.example.docxschema.util.schema.detect.detectors.LexiconDetector;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

import static com.example.docxschema.util.schema.SchemaFixtures.fv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RoleLexiconTest {

    private final RoleLexicon headings = RoleLexicon.builder()
            .headingsExact(Arrays.asList("Experience", "Work Experience", "Education"))
            .headingsFuzzy(Arrays.asList("Employment History", "Technical Skills"))
            .build();

    @Test
    @DisplayName("标题精确命中忽略大小写与标点，返回词表原文")
    void exactHeading() {
        RoleLexicon.Evidence evidence = headings.evaluate("experience:");

        assertThat(evidence.getScore()).isEqualTo(1.0);
        assertThat(evidence.getMatchedHeading()).isEqualTo("Experience");
        assertThat(headings.evaluate("  WORK   experience ").getMatchedHeading()).isEqualTo("Work Experience");
    }

    @Test
    @DisplayName("拼写相近的标题按相似度加分，相差过大不命中")
    void fuzzyHeading() {
        RoleLexicon.Evidence typo = headings.evaluate("Employment Histroy");
        RoleLexicon.Evidence unrelated = headings.evaluate("Quarterly Revenue");

        assertThat(typo.getScore()).isCloseTo(0.6 * 34 / 36, within(1e-9));
        assertThat(typo.getMatchedHeading()).isEqualTo("Employment History");
        assertThat(unrelated.getScore()).isEqualTo(0.0);
        assertThat(unrelated.getMatchedHeading()).isNull();
    }

    @Test
    @DisplayName("关键词按整词匹配，每个 +0.1，封顶 0.4")
    void keywordsAreCappedWholeWords() {
        RoleLexicon lexicon = RoleLexicon.builder()
                .keywords(Arrays.asList("engineer", "developer", "manager", "intern", "university", "led"))
                .build();

        assertThat(lexicon.evaluate("Engineer, developer and manager; intern at a university")
                .getScore()).isCloseTo(0.4, within(1e-9));
        assertThat(lexicon.evaluate("Led the platform team").getScore()).isCloseTo(0.1, within(1e-9));
        assertThat(lexicon.evaluate("The agenda is attached").getScore()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("停用词扣分一次，可使证据为负")
    void stopwordPenalty() {
        RoleLexicon lexicon = RoleLexicon.builder()
                .keywords(Collections.singletonList("analysis"))
                .stopwords(Arrays.asList("dear", "sincerely"))
                .build();

        assertThat(lexicon.evaluate("Dear team, the analysis is attached. Sincerely").getScore())
                .isCloseTo(-0.2, within(1e-9));
    }

    @Test
    @DisplayName("正则多条命中也只加一次；非法正则在构建时拒绝")
    void regexCountsOnce() {
        RoleLexicon lexicon = RoleLexicon.builder()
                .regexes(Arrays.asList("^whereas\\b", "\\bparties\\b"))
                .build();

        assertThat(lexicon.evaluate("WHEREAS the parties wish to cooperate").getScore())
                .isCloseTo(0.5, within(1e-9));
        assertThatThrownBy(() -> RoleLexicon.builder().regexes(Collections.singletonList("(unclosed")))
                .isInstanceOf(PatternSyntaxException.class);
    }

    @Test
    @DisplayName("相似度为 2·LCS/总长，长度悬殊时直接为 0")
    void ratio() {
        assertThat(RoleLexicon.ratio("ABC", "ABC")).isEqualTo(1.0);
        assertThat(RoleLexicon.ratio("ABCD", "ABXD")).isEqualTo(0.75);
        assertThat(RoleLexicon.ratio("AB", "ABCDEFGH")).isEqualTo(0.0);
        assertThat(RoleLexicon.ratio("", "")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("空词表与空白文本不产生证据")
    void emptyLexicon() {
        RoleLexicon empty = RoleLexicon.builder().keywords(Arrays.asList(" ", null)).build();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(headings.isEmpty()).isFalse();
        assertThat(headings.evaluate("   ").getScore()).isEqualTo(0.0);
        assertThat(headings.evaluate(null).getMatchedHeading()).isNull();
    }

    @Test
    @DisplayName("词表检测器在结构置信度上叠加证据并记录命中的标题，保留原有字段")
    void lexiconDetectorAddsEvidence() {
        Detector base = (features, context) -> {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("level", "1");
            return new DetectionResult("HEADING", 0.35, fields);
        };
        LexiconDetector detector = new LexiconDetector(base, headings);

        DetectionResult hit = detector.detect(fv(FeatureVector.TEXT, "Education"), ContextWindow.empty());
        DetectionResult miss = detector.detect(fv(FeatureVector.TEXT, "Quarterly Revenue"), ContextWindow.empty());

        assertThat(hit.getRole()).isEqualTo("HEADING");
        assertThat(hit.getConfidence()).isEqualTo(1.0);
        assertThat(hit.getFields())
                .containsEntry("level", "1")
                .containsEntry(LexiconDetector.FIELD_HEADING_MATCH, "Education");
        assertThat(miss.getConfidence()).isCloseTo(0.35, within(1e-9));
        assertThat(miss.getFields()).doesNotContainKey(LexiconDetector.FIELD_HEADING_MATCH);
        assertThatThrownBy(() -> new LexiconDetector(null, headings)).isInstanceOf(IllegalArgumentException.class);
    }
}
