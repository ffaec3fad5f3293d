package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 日期行检测器
 *
 * 支持：January 5, 2024 / 5 January 2024 / 2024-01-05 / 01/05/2024 / 2024年1月5日
 * 抽取字段 date：命中的日期原文。
 */
public class DateLineDetector implements Detector {

    private static final String MONTH = "(?:jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|jun(?:e)?|jul(?:y)?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";

    private static final List<Pattern> DATE_PATTERNS = Arrays.asList(
            Pattern.compile("(?i)\\b" + MONTH + "\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4}\\b"),
            Pattern.compile("(?i)\\b\\d{1,2}(?:st|nd|rd|th)?\\s+" + MONTH + ",?\\s+\\d{4}\\b"),
            Pattern.compile("\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b"),
            Pattern.compile("\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"),
            Pattern.compile("\\d{4}年\\d{1,2}月(?:\\d{1,2}日)?")
    );

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String date = findDate(fv.text());
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);

        if (date != null) score += 0.60;
        if (tokens >= 1 && tokens <= 6) score += 0.25;
        if (tokens > 0 && !fv.getFlag(FeatureVector.ENDS_WITH_PERIOD)) score += 0.05;
        if ("right".equals(fv.getCategory(FeatureVector.ALIGNMENT))) score += 0.10;

        // 没有日期的短行不能只靠长度得分
        if (date == null) score = Math.min(score, 0.30);

        Map<String, String> fields = new LinkedHashMap<>();
        if (date != null) {
            fields.put("date", date);
        }
        return new DetectionResult(DetectorKind.DATE_LINE.name(), score, fields);
    }

    static String findDate(String text) {
        for (Pattern p : DATE_PATTERNS) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return m.group();
            }
        }
        return null;
    }
}
