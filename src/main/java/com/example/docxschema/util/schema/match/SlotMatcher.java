package com.example.docxschema.util.schema.match;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.domain.RoleSpec;
import com.example.docxschema.util.schema.score.PackEvaluation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 槽位匹配器：把单元分配给选中域的角色（每个单元至多一个角色）
 *
 * 算法（贪心、无回溯）：
 * 1. 必需角色按声明顺序定位：在上一个必需角色之后取置信度最高的单元（同分取靠前者）。
 *    若声明在它之前、尚未分配的 OPTIONAL / REPEATABLE 角色对该单元的置信度严格更高，
 *    单元让给该角色，必需角色在这个单元之后重新找最佳候选；找不到则视为未锚定
 * 2. 相邻两个必需角色之间的空隙，由声明在它们之间的 OPTIONAL / REPEATABLE 角色按声明顺序竞争，游标单调前进：
 *    - 单元只有在后面的竞争角色置信度严格更高时才让给它（同分归前者）
 *    - OPTIONAL 角色输掉最佳候选后，在游标之后、输掉的单元之前重新找次佳候选
 *    - REPEATABLE 角色按文档顺序认领候选，遇到第一个输掉的单元即停止
 * 3. 低于 minConfidence 的候选不认领；认领时检查相邻规则（REPEATABLE 只检查第一次认领）
 *
 * 输出按单元序号严格递增。
 */
@Slf4j
public class SlotMatcher {

    private final double minConfidence;

    public SlotMatcher(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public List<SlotMatch> match(PackEvaluation evaluation) {
        DomainPack pack = evaluation.getPack();
        int n = evaluation.unitCount();

        List<SlotMatch> matches = new ArrayList<>();
        List<RoleSpec> gap = new ArrayList<>();
        int gapStart = 0;
        String previousRole = null;

        for (RoleSpec role : pack.getRoles()) {
            if (!role.isRequired()) {
                gap.add(role);
                continue;
            }
            int unit = placeRequired(evaluation, role, gap, gapStart, n - 1);
            if (unit < 0) {
                // 未锚定的必需角色不切分空隙，前后的可选角色并入同一空隙
                continue;
            }
            previousRole = fillGap(evaluation, gap, gapStart, unit - 1, previousRole, matches);
            gap.clear();

            matches.add(toMatch(evaluation, role, unit));
            previousRole = role.getName();
            gapStart = unit + 1;
        }
        fillGap(evaluation, gap, gapStart, n - 1, previousRole, matches);

        matches.sort(Comparator.comparingInt(SlotMatch::getUnitIndex));
        log.debug("Matched {} units for domain {}: {}", matches.size(), pack.getName(), matches);
        return matches;
    }

    /**
     * 定位必需角色：最佳候选被前面空隙里的角色以更高置信度抢走时，在其后重新搜索
     *
     * @return 单元序号，没有不低于阈值的候选时 -1
     */
    private int placeRequired(PackEvaluation eval, RoleSpec role, List<RoleSpec> competitors, int lo, int hi) {
        int from = lo;
        while (true) {
            int best = bestCandidate(eval, role, from, hi);
            if (best < 0) {
                return -1;
            }
            if (!outscored(eval, competitors, best, eval.confidence(role.getName(), best))) {
                return best;
            }
            log.debug("Unit {} goes to a stronger optional role, re-searching {}", best, role.getName());
            from = best + 1;
        }
    }

    /**
     * 在 [lo, hi] 内为 gap 中的角色分配单元
     *
     * @return 空隙处理完后最后一个被认领的角色
     */
    private String fillGap(PackEvaluation eval, List<RoleSpec> gap, int lo, int hi,
                           String previousRole, List<SlotMatch> out) {
        int cursor = lo;
        String prev = previousRole;
        for (int j = 0; j < gap.size(); j++) {
            RoleSpec role = gap.get(j);
            List<RoleSpec> later = gap.subList(j + 1, gap.size());
            if (role.getCardinality() == Cardinality.REPEATABLE) {
                boolean first = true;
                for (int u = cursor; u <= hi; u++) {
                    double c = eval.confidence(role.getName(), u);
                    if (c < minConfidence) {
                        continue;
                    }
                    if (outscored(eval, later, u, c)) {
                        break;
                    }
                    if (first && !eval.getPack().allowsFollower(prev, role.getName())) {
                        break;
                    }
                    first = false;
                    out.add(toMatch(eval, role, u));
                    prev = role.getName();
                    cursor = u + 1;
                }
            } else {
                int upper = hi;
                while (true) {
                    int best = bestCandidate(eval, role, cursor, upper);
                    if (best < 0) {
                        break;
                    }
                    if (outscored(eval, later, best, eval.confidence(role.getName(), best))) {
                        upper = best - 1;
                        continue;
                    }
                    if (eval.getPack().allowsFollower(prev, role.getName())) {
                        out.add(toMatch(eval, role, best));
                        prev = role.getName();
                        cursor = best + 1;
                    }
                    break;
                }
            }
        }
        return prev;
    }

    /**
     * [from, to] 内置信度最高且不低于阈值的单元（同分取靠前者），没有则 -1
     */
    private int bestCandidate(PackEvaluation eval, RoleSpec role, int from, int to) {
        int best = -1;
        double bestConf = -1.0;
        for (int u = from; u <= to; u++) {
            double c = eval.confidence(role.getName(), u);
            if (c >= minConfidence && c > bestConf) {
                best = u;
                bestConf = c;
            }
        }
        return best;
    }

    private boolean outscored(PackEvaluation eval, List<RoleSpec> others, int unit, double confidence) {
        for (RoleSpec other : others) {
            double c = eval.confidence(other.getName(), unit);
            if (c >= minConfidence && c > confidence) {
                return true;
            }
        }
        return false;
    }

    private static SlotMatch toMatch(PackEvaluation eval, RoleSpec role, int unit) {
        DetectionResult r = eval.result(role.getName(), unit);
        return new SlotMatch(unit, role.getName(), r.getConfidence(), r.getFields());
    }
}
