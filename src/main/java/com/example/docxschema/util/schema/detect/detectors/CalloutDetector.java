package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 提示块检测器：警告框、引文、代码片段
 *
 * 三种形态分别累加，取最高者；同分按 代码 → 警告 → 引文 的顺序。
 * 抽取字段 callout = code / warning / quote。
 *
 * 警告：WARNING / CAUTION / BLACK BOX 等字样 +0.6，位于行首 +0.2，加粗 +0.1
 * 引文：引号或 ">" 开头 +0.6，"- 作者" 署名行 +0.6，斜体 +0.2，有缩进 +0.1
 * 代码：行首空白 ≥ 4 +0.6，等宽字体 +0.4，分号/花括号/反引号 +0.3
 */
public class CalloutDetector implements Detector {

    public static final String CODE = "code";
    public static final String WARNING = "warning";
    public static final String QUOTE = "quote";

    private static final Pattern WARNING_WORD = Pattern.compile(
            "\\b(WARNING|CAUTION|BLACK BOX|DANGER|警告|注意)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WARNING_LEAD = Pattern.compile(
            "^(WARNING|CAUTION|BLACK BOX|DANGER|警告|注意)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTE_LEAD = Pattern.compile("^[\"'>“‘「]");
    private static final Pattern ATTRIBUTION = Pattern.compile("^[-–—]\\s*\\p{Lu}\\p{L}+(?:\\s+\\p{Lu}\\p{L}+){0,3}$");
    private static final Pattern CODE_MARK = Pattern.compile("[;{}]|`[^`]+`");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();

        double warning = 0.0;
        if (WARNING_WORD.matcher(text).find()) {
            warning += 0.6;
            if (WARNING_LEAD.matcher(text).find()) warning += 0.2;
            if (fv.getFlag(FeatureVector.BOLD)) warning += 0.1;
        }

        double quote = 0.0;
        if (QUOTE_LEAD.matcher(text).find()) quote += 0.6;
        if (ATTRIBUTION.matcher(text).matches()) quote += 0.6;
        if (quote > 0) {
            if (fv.getFlag(FeatureVector.ITALIC)) quote += 0.2;
            if (fv.getInt(FeatureVector.INDENT_LEVEL) > 0) quote += 0.1;
        }

        double code = 0.0;
        if (fv.getInt(FeatureVector.LEADING_SPACES) >= 4) code += 0.6;
        if (isMonospace(fv.getCategory(FeatureVector.FONT_NAME))) code += 0.4;
        if (CODE_MARK.matcher(text).find()) code += 0.3;

        String form = null;
        double score = 0.0;
        if (code > score) { score = code; form = CODE; }
        if (warning > score) { score = warning; form = WARNING; }
        if (quote > score) { score = quote; form = QUOTE; }

        Map<String, String> fields = new LinkedHashMap<>();
        if (form != null) {
            fields.put("callout", form);
        }
        return new DetectionResult(DetectorKind.CALLOUT.name(), score, fields);
    }

    private static boolean isMonospace(String font) {
        String f = font.toLowerCase(Locale.ROOT);
        return f.contains("courier") || f.contains("consol") || f.contains("mono") || f.contains("menlo");
    }
}
