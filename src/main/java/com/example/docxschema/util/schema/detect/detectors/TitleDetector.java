package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.Locale;

/**
 * 文档标题检测器
 *
 * 文档标题通常位于开头、字号最大、短小且不以句号结尾；含联系方式的行更像信头而不是标题。
 */
public class TitleDetector implements Detector {

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);
        String style = (fv.getCategory(FeatureVector.STYLE_ID) + " " + fv.getCategory(FeatureVector.STYLE_NAME))
                .toLowerCase(Locale.ROOT);

        if (style.contains("title") || style.contains("标题")) score += 0.30;
        if (fv.getInt(FeatureVector.INDEX) <= 1) score += 0.25;
        if (fv.getFlag(FeatureVector.LARGER_THAN_CONTEXT)) score += 0.20;
        if (fv.getFlag(FeatureVector.BOLD)) score += 0.15;
        if (tokens >= 1 && tokens <= 10) score += 0.10;
        if (tokens > 0 && !fv.getFlag(FeatureVector.ENDS_WITH_PERIOD)) score += 0.10;
        if (fv.getNumber(FeatureVector.UPPERCASE_RATIO) >= 0.8
                || fv.getNumber(FeatureVector.TITLECASE_RATE) >= 0.6) score += 0.05;

        if (fv.getFlag(FeatureVector.CONTAINS_EMAIL) || fv.getFlag(FeatureVector.CONTAINS_PHONE)
                || fv.getFlag(FeatureVector.CONTAINS_URL)) score -= 0.40;
        if (fv.getFlag(FeatureVector.STARTS_WITH_BULLET)) score -= 0.30;
        if (fv.getFlag(FeatureVector.IN_TABLE)) score -= 0.30;
        if (tokens > 15) score -= 0.30;

        return new DetectionResult(DetectorKind.TITLE.name(), score, null);
    }
}
