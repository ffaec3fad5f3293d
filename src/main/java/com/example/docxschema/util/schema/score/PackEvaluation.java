package com.example.docxschema.util.schema.score;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.domain.RoleSpec;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个域模板在一份文档上的检测结果矩阵：[角色][单元] → DetectionResult
 *
 * 只在一个域内部使用，角色名不跨域混用。构建后不可变。
 */
public final class PackEvaluation {

    private final DomainPack pack;
    private final List<FeatureVector> features;
    private final DetectionResult[][] results;

    private PackEvaluation(DomainPack pack, List<FeatureVector> features, DetectionResult[][] results) {
        this.pack = pack;
        this.features = features;
        this.results = results;
    }

    /**
     * 对每个 (角色, 单元) 运行角色检测器
     *
     * @param features 文档特征序列
     * @param pack 域模板
     * @param window 上下文窗口大小
     */
    public static PackEvaluation evaluate(List<FeatureVector> features, DomainPack pack, int window) {
        List<FeatureVector> fs = Collections.unmodifiableList(new ArrayList<>(features));
        List<RoleSpec> roles = pack.getRoles();
        DetectionResult[][] results = new DetectionResult[roles.size()][fs.size()];
        for (int u = 0; u < fs.size(); u++) {
            ContextWindow<FeatureVector> ctx = ContextWindow.around(fs, u, window);
            for (int r = 0; r < roles.size(); r++) {
                results[r][u] = pack.detect(roles.get(r).getName(), fs.get(u), ctx);
            }
        }
        return new PackEvaluation(pack, fs, results);
    }

    public DomainPack getPack() { return pack; }
    public List<FeatureVector> getFeatures() { return features; }

    public int unitCount() {
        return features.size();
    }

    public DetectionResult result(String role, int unit) {
        return results[roleIndex(role)][unit];
    }

    public double confidence(String role, int unit) {
        return results[roleIndex(role)][unit].getConfidence();
    }

    /**
     * 必需角色的顺序锚定（打分与匹配共用）
     *
     * 按声明顺序处理每个 EXACTLY_ONE 角色：在上一个锚点之后取置信度最高的单元（同分取靠前者）。
     * 最佳候选低于 minConfidence 的角色记为扣分角色，不锚定，也不推进位置。
     *
     * @return 每个必需角色一个锚点，顺序同声明顺序
     */
    public List<DomainScore.Anchor> anchorRequiredRoles(double minConfidence) {
        List<DomainScore.Anchor> anchors = new ArrayList<>();
        int position = -1;
        for (RoleSpec role : pack.getRequiredRoles()) {
            int r = roleIndex(role.getName());
            int best = -1;
            double bestConf = -1.0;
            for (int u = position + 1; u < features.size(); u++) {
                double c = results[r][u].getConfidence();
                if (c > bestConf) {
                    best = u;
                    bestConf = c;
                }
            }
            if (best < 0 || bestConf < minConfidence) {
                anchors.add(new DomainScore.Anchor(role.getName(), -1, Math.max(0.0, bestConf), true));
            } else {
                anchors.add(new DomainScore.Anchor(role.getName(), best, bestConf, false));
                position = best;
            }
        }
        return anchors;
    }

    private int roleIndex(String role) {
        int idx = pack.indexOf(role);
        if (idx < 0) {
            throw new IllegalArgumentException("Role " + role + " is not declared in domain " + pack.getName());
        }
        return idx;
    }
}
