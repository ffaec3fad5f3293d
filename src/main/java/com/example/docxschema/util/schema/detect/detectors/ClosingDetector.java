package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.regex.Pattern;

/**
 * 结束语检测器（Sincerely, / Best regards, ...）
 */
public class ClosingDetector implements Detector {

    static final String CLOSING_PHRASE = "(sincerely|yours (?:sincerely|truly|faithfully)|best regards|kind regards"
            + "|warm regards|regards|respectfully|cordially|thank you)";

    /** 整行就是结束语（允许逗号结尾） */
    static final Pattern CLOSING_FULL = Pattern.compile("(?i)^" + CLOSING_PHRASE + "[,.!]?$");

    private static final Pattern CLOSING_PREFIX = Pattern.compile("(?i)^" + CLOSING_PHRASE + "\\b");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();
        double score = 0.0;

        if (CLOSING_FULL.matcher(text).matches()) {
            score += 0.70;
        } else if (CLOSING_PREFIX.matcher(text).find()) {
            score += 0.40;
        }
        if (score > 0 && text.endsWith(",")) score += 0.15;
        if (score > 0 && fv.getNumber(FeatureVector.REL_POSITION) >= 0.6) score += 0.15;

        return new DetectionResult(DetectorKind.CLOSING.name(), score, null);
    }
}
