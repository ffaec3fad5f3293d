package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 列表项检测器
 *
 * 强信号是 Word 列表编号（numPr），其次是文本里的项目符号或编号前缀。
 * 抽取字段 marker：项目符号或编号前缀。
 */
public class ListItemDetector implements Detector {

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);
        boolean bullet = fv.getFlag(FeatureVector.STARTS_WITH_BULLET);
        String numbering = fv.getCategory(FeatureVector.NUMBERING_PREFIX);
        boolean numbered = !FeatureVector.NONE.equals(numbering) && !FeatureVector.UNKNOWN.equals(numbering);

        if (fv.getFlag(FeatureVector.IN_LIST)) score += 0.55;
        if (bullet) score += 0.35;
        if (numbered) score += 0.30;
        if (fv.getInt(FeatureVector.INDENT_LEVEL) > 0) score += 0.10;
        if (tokens >= 1 && tokens <= 25) score += 0.05;

        if (fv.getFlag(FeatureVector.IN_TABLE)) score -= 0.30;
        if (fv.getFlag(FeatureVector.BOLD) && fv.getFlag(FeatureVector.LARGER_THAN_CONTEXT)) score -= 0.20;

        Map<String, String> fields = new LinkedHashMap<>();
        if (bullet) {
            fields.put("marker", fv.getCategory(FeatureVector.BULLET_GLYPH));
        } else if (numbered) {
            fields.put("marker", numbering);
        }
        return new DetectionResult(DetectorKind.LIST_ITEM.name(), score, fields);
    }
}
