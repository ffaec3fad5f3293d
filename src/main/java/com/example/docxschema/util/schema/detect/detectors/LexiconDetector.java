package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.RoleLexicon;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 词表增强检测器：结构检测器的置信度 + 角色词表证据
 *
 * 命中标题词表时在字段中记录 heading_match（词表中的原始写法）。
 */
public class LexiconDetector implements Detector {

    public static final String FIELD_HEADING_MATCH = "heading_match";

    private final Detector base;
    private final RoleLexicon lexicon;

    public LexiconDetector(Detector base, RoleLexicon lexicon) {
        if (base == null || lexicon == null) {
            throw new IllegalArgumentException("Lexicon detector needs a base detector and a lexicon");
        }
        this.base = base;
        this.lexicon = lexicon;
    }

    @Override
    public DetectionResult detect(FeatureVector features, ContextWindow<FeatureVector> context) {
        DetectionResult r = base.detect(features, context);
        RoleLexicon.Evidence evidence = lexicon.evaluate(features.text());
        if (evidence.getScore() == 0.0 && evidence.getMatchedHeading() == null) {
            return r;
        }
        Map<String, String> fields = new LinkedHashMap<>(r.getFields());
        if (evidence.getMatchedHeading() != null) {
            fields.put(FIELD_HEADING_MATCH, evidence.getMatchedHeading());
        }
        return new DetectionResult(r.getRole(), r.getConfidence() + evidence.getScore(), fields);
    }

    public RoleLexicon getLexicon() {
        return lexicon;
    }
}
