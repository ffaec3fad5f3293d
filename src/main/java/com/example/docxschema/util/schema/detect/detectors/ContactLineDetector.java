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
 * 联系方式行检测器（邮箱 / 电话 / 网址）
 */
public class ContactLineDetector implements Detector {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{7,}\\d");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);

        if (fv.getFlag(FeatureVector.CONTAINS_EMAIL)) score += 0.45;
        if (fv.getFlag(FeatureVector.CONTAINS_PHONE)) score += 0.35;
        if (fv.getFlag(FeatureVector.CONTAINS_URL)) score += 0.25;
        if (score > 0 && (text.contains("|") || text.contains("•"))) score += 0.10;
        if (score > 0 && tokens <= 12) score += 0.10;
        if (fv.getInt(FeatureVector.SENTENCE_COUNT) >= 2) score -= 0.30;

        Map<String, String> fields = new LinkedHashMap<>();
        putFirst(fields, "email", EMAIL.matcher(text));
        putFirst(fields, "phone", PHONE.matcher(text));
        putFirst(fields, "url", URL.matcher(text));
        return new DetectionResult(DetectorKind.CONTACT_LINE.name(), score, fields);
    }

    private static void putFirst(Map<String, String> fields, String name, Matcher m) {
        if (m.find()) {
            fields.put(name, m.group().trim());
        }
    }
}
