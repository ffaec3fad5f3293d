package com.example.docxschema.util.schema.run;

import com.example.docxschema.util.schema.SchemaConfig;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.aggregate.SchemaSlot;
import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureExtractor;
import com.example.docxschema.util.schema.feature.FeatureVector;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.feature.StyleMeta;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema 运行器：把新内容块按顺序映射到槽位，复用槽位捕获的样式
 *
 * 规则：
 * 1. 按槽位顺序处理；EXACTLY_ONE / OPTIONAL 各取一个块，REPEATABLE 取一串连续块直到边界策略认定的分隔处
 * 2. OPTIONAL / REPEATABLE 不会占用后续必需槽位所需的块
 * 3. 内容耗尽：必需槽位以空文本 + 原样式渲染并报 UNFILLED_REQUIRED_SLOT；可选/可重复槽位跳过
 * 4. 槽位用完仍有剩余块：追加为无样式的 overflow 单元并报 OVERFLOW，任何输入文本都不会丢失
 * 5. 开启兼容性检查时，槽位检测器对块的置信度过低则跳过该 OPTIONAL 槽位（块留给后续槽位）
 */
@Slf4j
public class SchemaRunner {

    private final BoundaryPolicy policy;
    private final boolean compatibilityCheck;
    private final double optionalMinConfidence;
    private final DetectorRegistry detectors;
    private final int window;

    public SchemaRunner(BoundaryPolicy policy) {
        this(policy, false, 0.0, DetectorRegistry.defaults(), FeatureExtractor.DEFAULT_WINDOW);
    }

    public SchemaRunner(SchemaConfig config, DetectorRegistry detectors) {
        this(config.BOUNDARY_POLICY, config.COMPATIBILITY_CHECK, config.OPTIONAL_SLOT_MIN_CONFIDENCE,
                detectors, config.CONTEXT_WINDOW);
    }

    public SchemaRunner(BoundaryPolicy policy, boolean compatibilityCheck, double optionalMinConfidence,
                        DetectorRegistry detectors, int window) {
        this.policy = policy != null ? policy : BoundaryPolicy.BLANK_LINE;
        this.compatibilityCheck = compatibilityCheck;
        this.optionalMinConfidence = optionalMinConfidence;
        this.detectors = detectors;
        this.window = window;
    }

    public RunResult run(Schema schema, List<ContentBlock> blocks) {
        List<SchemaSlot> slots = schema.getSlots();
        int n = blocks.size();
        int[] requiredAfter = new int[slots.size()];
        int required = 0;
        for (int i = slots.size() - 1; i >= 0; i--) {
            requiredAfter[i] = required;
            if (slots.get(i).isRequired()) {
                required++;
            }
        }
        List<FeatureVector> blockFeatures = compatibilityCheck ? blockFeatures(blocks) : null;

        List<RenderedUnit> out = new ArrayList<>();
        List<RunDiagnostic> diagnostics = new ArrayList<>();
        int pos = 0;

        for (int i = 0; i < slots.size(); i++) {
            SchemaSlot slot = slots.get(i);
            Cardinality cardinality = slot.getCardinality();

            if (cardinality == Cardinality.EXACTLY_ONE) {
                if (pos < n) {
                    out.add(render(slot, blocks.get(pos), out.size()));
                    pos++;
                } else {
                    out.add(new RenderedUnit(slot.getSlotId(), slot.getRole(), "", slot.getStyle(),
                            out.size(), null, false, false));
                    diagnostics.add(new RunDiagnostic(RunDiagnostic.Type.UNFILLED_REQUIRED_SLOT,
                            slot.getSlotId(), slot.getRole(), "Content exhausted before required slot was filled"));
                }
                continue;
            }

            // 留足后续必需槽位的块
            int limit = n - requiredAfter[i];
            if (pos >= limit) {
                continue;
            }

            if (cardinality == Cardinality.OPTIONAL) {
                if (blockFeatures != null && !compatible(slot, blockFeatures, pos)) {
                    diagnostics.add(new RunDiagnostic(RunDiagnostic.Type.SKIPPED_OPTIONAL_SLOT,
                            slot.getSlotId(), slot.getRole(), "Block " + blocks.get(pos).getIndex()
                            + " is not compatible with the slot role"));
                    continue;
                }
                out.add(render(slot, blocks.get(pos), out.size()));
                pos++;
            } else {
                out.add(render(slot, blocks.get(pos), out.size()));
                pos++;
                while (pos < limit && !policy.splitsAt(blocks.get(pos).getBoundary())) {
                    out.add(render(slot, blocks.get(pos), out.size()));
                    pos++;
                }
            }
        }

        if (pos < n) {
            int leftover = n - pos;
            for (; pos < n; pos++) {
                ContentBlock b = blocks.get(pos);
                out.add(new RenderedUnit(RenderedUnit.OVERFLOW, RenderedUnit.OVERFLOW, b.getText(),
                        StyleMeta.UNKNOWN, out.size(), b.getIndex(), true, true));
            }
            diagnostics.add(new RunDiagnostic(RunDiagnostic.Type.OVERFLOW, RenderedUnit.OVERFLOW,
                    RenderedUnit.OVERFLOW, leftover + " content block(s) left after all slots were consumed"));
        }

        log.info("Ran schema {} over {} blocks: {} units, {} diagnostics",
                schema.getDomain(), n, out.size(), diagnostics.size());
        return new RunResult(out, diagnostics);
    }

    private static RenderedUnit render(SchemaSlot slot, ContentBlock block, int ordinal) {
        return new RenderedUnit(slot.getSlotId(), slot.getRole(), block.getText(), slot.getStyle(),
                ordinal, block.getIndex(), true, false);
    }

    private List<FeatureVector> blockFeatures(List<ContentBlock> blocks) {
        List<StructuralUnit> units = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            units.add(StructuralUnit.paragraph(i, blocks.get(i).getText(), StyleMeta.UNKNOWN));
        }
        return new FeatureExtractor(window).extractAll(units);
    }

    private boolean compatible(SchemaSlot slot, List<FeatureVector> features, int pos) {
        DetectorKind kind = kindOf(slot.getPatternType());
        if (kind == null || detectors == null) {
            return true;
        }
        DetectionResult r = detectors.get(kind).detect(features.get(pos), ContextWindow.around(features, pos, window));
        return r.getConfidence() >= optionalMinConfidence;
    }

    private static DetectorKind kindOf(String patternType) {
        for (DetectorKind k : DetectorKind.values()) {
            if (k.name().equals(patternType)) {
                return k;
            }
        }
        return null;
    }
}
