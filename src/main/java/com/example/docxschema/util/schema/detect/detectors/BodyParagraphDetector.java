package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.Locale;

/**
 * 正文段落检测器
 *
 * 正文 = 较长、有标点、完整句子、普通样式；标题/列表/表格特征都会扣分。
 */
public class BodyParagraphDetector implements Detector {

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);

        if (tokens >= 8) score += 0.35;
        if (fv.getNumber(FeatureVector.PUNCT_DENSITY) > 0.0) score += 0.15;
        if (fv.getFlag(FeatureVector.ENDS_WITH_PERIOD)) score += 0.15;
        if (fv.getInt(FeatureVector.SENTENCE_COUNT) >= 2) score += 0.15;
        if (isPlainStyle(fv.getCategory(FeatureVector.STYLE_NAME), fv.getCategory(FeatureVector.STYLE_ID))) {
            score += 0.10;
        }

        if (tokens < 4) score -= 0.40;
        if (fv.getFlag(FeatureVector.BOLD)) score -= 0.30;
        if (fv.getFlag(FeatureVector.LARGER_THAN_CONTEXT)) score -= 0.20;
        if (fv.getFlag(FeatureVector.STARTS_WITH_BULLET) || fv.getFlag(FeatureVector.IN_LIST)) score -= 0.40;
        if (fv.getFlag(FeatureVector.TRAILING_COLON)) score -= 0.30;
        if (fv.getFlag(FeatureVector.IN_TABLE)) score -= 0.30;
        if (fv.getNumber(FeatureVector.UPPERCASE_RATIO) > 0.7) score -= 0.30;

        return new DetectionResult(DetectorKind.BODY.name(), score, null);
    }

    private static boolean isPlainStyle(String styleName, String styleId) {
        String s = (styleName + " " + styleId).toLowerCase(Locale.ROOT);
        if (FeatureVector.UNKNOWN.equals(styleName) && FeatureVector.UNKNOWN.equals(styleId)) {
            return true;
        }
        return s.contains("normal") || s.contains("body") || s.contains("正文");
    }
}
