package com.example.docxschema.util.schema.detect;

import com.example.docxschema.util.schema.detect.detectors.BodyParagraphDetector;
import com.example.docxschema.util.schema.detect.detectors.CalloutDetector;
import com.example.docxschema.util.schema.detect.detectors.ClauseDetector;
import com.example.docxschema.util.schema.detect.detectors.ClosingDetector;
import com.example.docxschema.util.schema.detect.detectors.ContactLineDetector;
import com.example.docxschema.util.schema.detect.detectors.DateLineDetector;
import com.example.docxschema.util.schema.detect.detectors.HeadingDetector;
import com.example.docxschema.util.schema.detect.detectors.ListItemDetector;
import com.example.docxschema.util.schema.detect.detectors.SalutationDetector;
import com.example.docxschema.util.schema.detect.detectors.SignatureBlockDetector;
import com.example.docxschema.util.schema.detect.detectors.TableCellDetector;
import com.example.docxschema.util.schema.detect.detectors.TitleDetector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 检测器注册表：种类 → 检测器
 *
 * 进程启动时一次性构建，之后只读。
 */
public class DetectorRegistry {

    private final Map<DetectorKind, Detector> detectors;

    private DetectorRegistry(Map<DetectorKind, Detector> detectors) {
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(detectors));
    }

    /**
     * 内置检测器全集
     */
    public static DetectorRegistry defaults() {
        Map<DetectorKind, Detector> map = new EnumMap<>(DetectorKind.class);
        map.put(DetectorKind.TITLE, new TitleDetector());
        map.put(DetectorKind.HEADING, new HeadingDetector());
        map.put(DetectorKind.BODY, new BodyParagraphDetector());
        map.put(DetectorKind.LIST_ITEM, new ListItemDetector());
        map.put(DetectorKind.TABLE_CELL, new TableCellDetector());
        map.put(DetectorKind.DATE_LINE, new DateLineDetector());
        map.put(DetectorKind.CONTACT_LINE, new ContactLineDetector());
        map.put(DetectorKind.SALUTATION, new SalutationDetector());
        map.put(DetectorKind.CLOSING, new ClosingDetector());
        map.put(DetectorKind.SIGNATURE_BLOCK, new SignatureBlockDetector());
        map.put(DetectorKind.CLAUSE, new ClauseDetector());
        map.put(DetectorKind.CALLOUT, new CalloutDetector());
        return new DetectorRegistry(map);
    }

    /**
     * 在现有注册表基础上替换/新增一个检测器（返回新实例）
     */
    public DetectorRegistry with(DetectorKind kind, Detector detector) {
        Map<DetectorKind, Detector> map = new EnumMap<>(DetectorKind.class);
        map.putAll(detectors);
        map.put(kind, detector);
        return new DetectorRegistry(map);
    }

    public Detector get(DetectorKind kind) {
        Detector detector = detectors.get(kind);
        if (detector == null) {
            throw new IllegalArgumentException("No detector registered for kind: " + kind);
        }
        return detector;
    }

    public Map<DetectorKind, Detector> asMap() {
        return detectors;
    }
}
