package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 合同条款检测器
 *
 * 编号前缀（1. / 2.1 / Section 3 / Article IV / 第三条）+ 法律措辞关键词。
 * 抽取字段 number：条款编号。
 */
public class ClauseDetector implements Detector {

    private static final Pattern CLAUSE_PREFIX = Pattern.compile(
            "(?i)^(?:section|article|clause)\\s+([\\dIVXLCDM]+(?:\\.\\d+)*)\\b|^(第[一二三四五六七八九十百零〇两\\d]+条)");

    private static final List<Pattern> LEGAL_KEYWORDS = Arrays.asList(
            Pattern.compile("\\bshall\\b"),
            Pattern.compile("\\bhereby\\b"),
            Pattern.compile("\\bagree(?:s|d|ment)?\\b"),
            Pattern.compile("\\bpart(?:y|ies)\\b"),
            Pattern.compile("\\bpursuant\\b"),
            Pattern.compile("\\bherein\\b"),
            Pattern.compile("\\bthereof\\b"),
            Pattern.compile("\\bwhereas\\b"),
            Pattern.compile("\\bobligations?\\b")
    );

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();
        String numbering = fv.getCategory(FeatureVector.NUMBERING_PREFIX);
        String number = FeatureVector.NONE.equals(numbering) || FeatureVector.UNKNOWN.equals(numbering) ? null : numbering;
        Matcher m = CLAUSE_PREFIX.matcher(text);
        if (number == null && m.find()) {
            number = m.group(1) != null ? m.group(1) : m.group(2);
        }

        double score = 0.0;
        if (number != null) score += 0.35;
        score += Math.min(0.45, 0.15 * keywordHits(text));
        if (fv.getInt(FeatureVector.TOKEN_COUNT) >= 6) score += 0.10;
        if (fv.getFlag(FeatureVector.STARTS_WITH_BULLET)) score -= 0.30;

        Map<String, String> fields = new LinkedHashMap<>();
        if (number != null) {
            fields.put("number", number);
        }
        return new DetectionResult(DetectorKind.CLAUSE.name(), score, fields);
    }

    private static int keywordHits(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (Pattern kw : LEGAL_KEYWORDS) {
            if (kw.matcher(lower).find()) {
                hits++;
            }
        }
        return hits;
    }
}
