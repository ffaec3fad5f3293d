package com.example.docxschema.util.schema.detect.detectors;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 签名块检测器
 *
 * 签名通常紧跟结束语、位于文档末尾、很短；也可能带 "Signature:" / "By:" / 下划线 / "/s/" 等标记。
 * 抽取字段 signatory：去掉标记后的签名人文本。
 */
public class SignatureBlockDetector implements Detector {

    private static final Pattern SIGNATURE_CUE = Pattern.compile("(?i)(signature|signed|\\bby:|_{3,}|/s/)");
    private static final Pattern CUE_STRIP = Pattern.compile("(?i)^(signature|signed|by)\\s*:?\\s*|_{3,}|/s/");

    @Override
    public DetectionResult detect(FeatureVector fv, ContextWindow<FeatureVector> context) {
        String text = fv.text();
        double score = 0.0;
        int tokens = fv.getInt(FeatureVector.TOKEN_COUNT);
        FeatureVector prev = context.previous();

        if (prev != null && ClosingDetector.CLOSING_FULL.matcher(prev.text()).matches()) score += 0.40;
        if (SIGNATURE_CUE.matcher(text).find()) score += 0.40;
        if (fv.getNumber(FeatureVector.REL_POSITION) >= 0.75) score += 0.20;
        if (tokens >= 1 && tokens <= 5) score += 0.10;
        if (fv.getNumber(FeatureVector.TITLECASE_RATE) >= 0.6) score += 0.10;
        if (fv.getInt(FeatureVector.SENTENCE_COUNT) >= 2) score -= 0.30;

        Map<String, String> fields = new LinkedHashMap<>();
        String signatory = CUE_STRIP.matcher(text).replaceAll("").trim();
        if (!signatory.isEmpty() && score > 0) {
            fields.put("signatory", signatory);
        }
        return new DetectionResult(DetectorKind.SIGNATURE_BLOCK.name(), score, fields);
    }
}
