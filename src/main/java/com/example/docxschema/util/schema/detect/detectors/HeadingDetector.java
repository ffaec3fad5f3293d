package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 章节标题检测器
 *
 * 打分规则（累加后截断到 [0,1]）：
 * - 样式名/ID 含 heading / title / 标题：+0.35
 * - 加粗：+0.20
 * - 字号大于上下文：+0.20
 * - 短文本（1-8 词）：+0.15
 * - 无句号结尾：+0.10
 * - 全大写：+0.15；标题式大小写：+0.10
 * - 编号前缀且不长：+0.10
 * - 冒号结尾：+0.05
 * - 项目符号 / 目录点线 / 超长 / 表格内：扣分
 *
 * 抽取字段 level：优先取样式名里的数字，其次取编号层级，默认 1。
 */
public class HeadingDetector implements Detector {

    private static final Pattern STYLE_LEVEL = Pattern.compile("(\\d)");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);
        String numbering = fv.getCategory(FeatureVector.NUMBERING_PREFIX);
        boolean numbered = !FeatureVector.NONE.equals(numbering) && !FeatureVector.UNKNOWN.equals(numbering);

        if (isHeadingStyle(fv)) score += 0.35;
        if (fv.getFlag(FeatureVector.BOLD)) score += 0.20;
        if (fv.getFlag(FeatureVector.LARGER_THAN_CONTEXT)) score += 0.20;
        if (tokens >= 1 && tokens <= 8) score += 0.15;
        if (tokens > 0 && !fv.getFlag(FeatureVector.ENDS_WITH_PERIOD)) score += 0.10;
        if (fv.getNumber(FeatureVector.UPPERCASE_RATIO) >= 0.8) score += 0.15;
        if (fv.getNumber(FeatureVector.TITLECASE_RATE) >= 0.6) score += 0.10;
        if (numbered && tokens <= 12) score += 0.10;
        if (fv.getFlag(FeatureVector.TRAILING_COLON)) score += 0.05;

        if (fv.getFlag(FeatureVector.STARTS_WITH_BULLET)) score -= 0.30;
        if (fv.getFlag(FeatureVector.HAS_LEADER_DOTS)) score -= 0.30;
        if (tokens > 20) score -= 0.30;
        if (fv.getFlag(FeatureVector.IN_TABLE)) score -= 0.25;

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("level", String.valueOf(level(fv, numbered ? numbering : null)));
        return new DetectionResult(DetectorKind.HEADING.name(), score, fields);
    }

    static boolean isHeadingStyle(FeatureVector fv) {
        String style = (fv.getCategory(FeatureVector.STYLE_ID) + " " + fv.getCategory(FeatureVector.STYLE_NAME))
                .toLowerCase(Locale.ROOT);
        return style.contains("heading") || style.contains("title") || style.contains("标题");
    }

    private static int level(FeatureVector fv, String numbering) {
        String styleName = fv.getCategory(FeatureVector.STYLE_NAME);
        if (FeatureVector.UNKNOWN.equals(styleName)) {
            styleName = fv.getCategory(FeatureVector.STYLE_ID);
        }
        if (!FeatureVector.UNKNOWN.equals(styleName)) {
            Matcher m = STYLE_LEVEL.matcher(styleName);
            if (m.find()) {
                return Math.max(1, Integer.parseInt(m.group(1)));
            }
        }
        if (numbering != null && numbering.matches("\\d+(\\.\\d+)*\\.?")) {
            String core = numbering.endsWith(".") ? numbering.substring(0, numbering.length() - 1) : numbering;
            return core.split("\\.").length;
        }
        return 1;
    }
}
