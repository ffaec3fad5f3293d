package com.example.docxschema.util.schema.score;

import com.example.docxschema.util.schema.SchemaConfig;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.domain.RoleSpec;
import com.example.docxschema.util.schema.feature.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 域打分器
 *
 * 打分算法：
 * 1. 按声明顺序锚定每个必需角色（见 {@link PackEvaluation#anchorRequiredRoles(double)}）
 * 2. 得分 = Σ(权重 × 锚点置信度) / Σ权重 - 扣分 × 扣分角色数，截断到 [0,1]
 *    扣分角色的置信度按 0 计
 *
 * 选域：得分降序 → 扣分角色少者优先 → 域优先级小者优先；最佳得分低于下限时报告无可信域。
 * 打分器本身无状态，不缓存任何域或文档数据。
 */
@Slf4j
public class DomainScorer {

    /** 排名：得分降序，扣分角色升序，优先级升序 */
    public static final Comparator<DomainScore> RANKING = Comparator
            .comparingDouble(DomainScore::getScore).reversed()
            .thenComparingInt(DomainScore::getPenalizedRoles)
            .thenComparingInt(DomainScore::getPriority);

    private final double minConfidence;
    private final double missingRolePenalty;
    private final double scoreFloor;
    private final int window;

    public DomainScorer(SchemaConfig config) {
        this(config.MIN_CONFIDENCE, config.MISSING_ROLE_PENALTY, config.DOMAIN_SCORE_FLOOR, config.CONTEXT_WINDOW);
    }

    public DomainScorer(double minConfidence, double missingRolePenalty, double scoreFloor, int window) {
        this.minConfidence = minConfidence;
        this.missingRolePenalty = missingRolePenalty;
        this.scoreFloor = scoreFloor;
        this.window = window;
    }

    public double getMinConfidence() { return minConfidence; }
    public double getScoreFloor() { return scoreFloor; }

    public PackEvaluation evaluate(List<FeatureVector> features, DomainPack pack) {
        return PackEvaluation.evaluate(features, pack, window);
    }

    /**
     * 计算单个域的得分
     */
    public DomainScore score(List<FeatureVector> features, DomainPack pack) {
        return score(evaluate(features, pack));
    }

    public DomainScore score(PackEvaluation evaluation) {
        DomainPack pack = evaluation.getPack();
        List<DomainScore.Anchor> anchors = evaluation.anchorRequiredRoles(minConfidence);

        double weighted = 0.0;
        double totalWeight = 0.0;
        int penalized = 0;
        for (DomainScore.Anchor anchor : anchors) {
            RoleSpec role = pack.getRole(anchor.getRole());
            totalWeight += role.getWeight();
            if (anchor.isPenalized()) {
                penalized++;
            } else {
                weighted += role.getWeight() * anchor.getConfidence();
            }
        }
        double mean = totalWeight > 0 ? weighted / totalWeight : 0.0;
        double score = Math.max(0.0, Math.min(1.0, mean - missingRolePenalty * penalized));

        DomainScore result = new DomainScore(pack.getName(), pack.getPriority(), score, penalized, anchors);
        log.debug("Domain {} scored {} with anchors {}", pack.getName(), String.format("%.3f", score), anchors);
        return result;
    }

    /**
     * 串行评估所有域并排名
     */
    public DomainSelection select(List<FeatureVector> features, List<DomainPack> packs) {
        List<DomainScore> scores = new ArrayList<>();
        for (DomainPack pack : packs) {
            scores.add(score(features, pack));
        }
        return rank(scores);
    }

    /**
     * 并行评估所有域（每个域一个任务，只读共享特征序列），结果按同一排名规则合并
     */
    public DomainSelection select(List<FeatureVector> features, List<DomainPack> packs, ExecutorService executor) {
        if (executor == null || packs.size() <= 1) {
            return select(features, packs);
        }
        List<Future<DomainScore>> futures = new ArrayList<>();
        for (DomainPack pack : packs) {
            futures.add(executor.submit(() -> score(features, pack)));
        }
        List<DomainScore> scores = new ArrayList<>();
        try {
            for (Future<DomainScore> f : futures) {
                scores.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Domain scoring interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Domain scoring failed: " + cause, cause);
        }
        return rank(scores);
    }

    private DomainSelection rank(List<DomainScore> scores) {
        List<DomainScore> ranking = new ArrayList<>(scores);
        ranking.sort(RANKING);
        if (ranking.isEmpty() || ranking.get(0).getScore() < scoreFloor) {
            log.warn("No confident domain (floor={}): {}", scoreFloor, ranking);
            return new DomainSelection(DomainSelection.Outcome.NO_CONFIDENT_DOMAIN, scoreFloor, ranking);
        }
        log.info("Selected domain {} from ranking {}", ranking.get(0).getDomain(), ranking);
        return new DomainSelection(DomainSelection.Outcome.SELECTED, scoreFloor, ranking);
    }
}
