package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 称呼行检测器（Dear ..., / To whom it may concern:）
 *
 * 抽取字段 addressee：称呼对象。
 */
public class SalutationDetector implements Detector {

    private static final Pattern SALUTATION = Pattern.compile(
            "(?i)^(dear|to whom it may concern|hello|hi|greetings)\\b\\s*(.*?)[,:;!]?$");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();
        Matcher m = SALUTATION.matcher(text);
        boolean matched = m.matches();
        double score = 0.0;

        // 长句以 Hello/Hi 开头多半是正文
        if (matched) score += fv.getInt(FeatureVector.TOKEN_COUNT) <= 12 ? 0.70 : 0.30;
        if (text.endsWith(",") || text.endsWith(":")) score += 0.20;
        if (matched && fv.getInt(FeatureVector.TOKEN_COUNT) <= 8) score += 0.10;

        Map<String, String> fields = new LinkedHashMap<>();
        if (matched && !m.group(2).trim().isEmpty()) {
            fields.put("addressee", m.group(2).trim());
        }
        return new DetectionResult(DetectorKind.SALUTATION.name(), score, fields);
    }
}
