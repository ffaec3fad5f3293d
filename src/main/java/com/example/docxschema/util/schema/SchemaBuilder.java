package com.example.docxschema.util.schema;

import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.aggregate.SchemaAggregator;
import com.example.docxschema.util.schema.domain.DomainPack;
import com.example.docxschema.util.schema.domain.DomainPackRegistry;
import com.example.docxschema.util.schema.feature.FeatureExtractor;
import com.example.docxschema.util.schema.feature.FeatureVector;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.match.SlotMatch;
import com.example.docxschema.util.schema.match.SlotMatcher;
import com.example.docxschema.util.schema.score.DomainScore;
import com.example.docxschema.util.schema.score.DomainScorer;
import com.example.docxschema.util.schema.score.DomainSelection;
import com.example.docxschema.util.schema.score.PackEvaluation;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Schema 构建流水线
 *
 * 结构单元 → 特征提取 → 域打分/选择 → 槽位匹配 → 聚合 → Schema
 *
 * 每一步都是无状态的纯计算，多个文档可以并发构建。
 */
@Slf4j
public class SchemaBuilder {

    private final DomainPackRegistry packs;
    private final FeatureExtractor extractor;
    private final DomainScorer scorer;
    private final SlotMatcher matcher;
    private final SchemaAggregator aggregator;
    private final ExecutorService executor;

    public SchemaBuilder(DomainPackRegistry packs, SchemaConfig config) {
        this(packs, config, null);
    }

    public SchemaBuilder(DomainPackRegistry packs, SchemaConfig config, ExecutorService executor) {
        this.packs = packs;
        this.extractor = new FeatureExtractor(config.CONTEXT_WINDOW);
        this.scorer = new DomainScorer(config);
        this.matcher = new SlotMatcher(config.MIN_CONFIDENCE);
        this.aggregator = new SchemaAggregator();
        this.executor = executor;
    }

    /**
     * 自动选择域并构建 Schema
     */
    public BuildOutcome build(List<StructuralUnit> units) {
        log.debug("Building schema from {} structural units", units.size());
        List<FeatureVector> features = extractor.extractAll(units);
        DomainSelection selection = scorer.select(features, packs.all(), executor);
        if (!selection.isConfident()) {
            return BuildOutcome.noConfidentDomain(selection);
        }
        DomainPack pack = packs.require(selection.getSelected().getDomain());
        return BuildOutcome.built(selection, buildFor(features, units, pack));
    }

    /**
     * 指定域构建 Schema（跳过域选择和得分下限）
     */
    public BuildOutcome build(List<StructuralUnit> units, String domain) {
        if (domain == null || domain.trim().isEmpty()) {
            return build(units);
        }
        DomainPack pack = packs.require(domain);
        List<FeatureVector> features = extractor.extractAll(units);
        PackEvaluation evaluation = scorer.evaluate(features, pack);
        DomainScore score = scorer.score(evaluation);
        DomainSelection selection = new DomainSelection(DomainSelection.Outcome.SELECTED, scorer.getScoreFloor(),
                Collections.singletonList(score));
        return BuildOutcome.built(selection, aggregate(evaluation, score, units));
    }

    private Schema buildFor(List<FeatureVector> features, List<StructuralUnit> units, DomainPack pack) {
        PackEvaluation evaluation = scorer.evaluate(features, pack);
        return aggregate(evaluation, scorer.score(evaluation), units);
    }

    private Schema aggregate(PackEvaluation evaluation, DomainScore score, List<StructuralUnit> units) {
        List<SlotMatch> matches = matcher.match(evaluation);
        return aggregator.aggregate(matches, units, evaluation.getPack(), score);
    }
}
