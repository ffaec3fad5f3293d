package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表格单元格检测器
 *
 * 真实表格内的单元格几乎确定；纯文本中的 | 或 Tab 分隔行给少量分。
 */
public class TableCellDetector implements Detector {

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        double score = 0.0;
        boolean inTable = fv.getFlag(FeatureVector.IN_TABLE);
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);

        if (inTable) score += 0.80;
        if (fv.getFlag(FeatureVector.CONTAINS_DELIMITER)) score += 0.30;
        if (tokens >= 1 && tokens <= 6) score += 0.10;

        Map<String, String> fields = new LinkedHashMap<>();
        if (inTable) {
            fields.put("row", String.valueOf(fv.getInt(FeatureVector.TABLE_ROW)));
            fields.put("col", String.valueOf(fv.getInt(FeatureVector.TABLE_COL)));
        }
        return new DetectionResult(DetectorKind.TABLE_CELL.name(), score, fields);
    }
}
