package com.example.docxschema.util.schema.score;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 域选择结果
 *
 * 最佳得分低于下限时结果为 NO_CONFIDENT_DOMAIN（可恢复，调用方据此决定是否提示用户指定域），
 * 不会强行选出一个低可信度的域。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DomainSelection {

    public enum Outcome {
        SELECTED,
        NO_CONFIDENT_DOMAIN
    }

    private final Outcome outcome;
    private final double floor;
    private final List<DomainScore> ranking;

    public DomainSelection(Outcome outcome, double floor, List<DomainScore> ranking) {
        this.outcome = outcome;
        this.floor = floor;
        this.ranking = Collections.unmodifiableList(new ArrayList<>(ranking));
    }

    @JsonProperty("outcome")
    public Outcome getOutcome() { return outcome; }

    @JsonProperty("floor")
    public double getFloor() { return floor; }

    @JsonProperty("ranking")
    public List<DomainScore> getRanking() { return ranking; }

    @JsonIgnore
    public boolean isConfident() {
        return outcome == Outcome.SELECTED;
    }

    /**
     * 选中的域；无可信域时为 null
     */
    @JsonProperty("selected")
    public DomainScore getSelected() {
        return isConfident() ? ranking.get(0) : null;
    }

    /**
     * 前 k 个候选（无论是否可信）
     */
    public List<DomainScore> top(int k) {
        return ranking.subList(0, Math.max(0, Math.min(k, ranking.size())));
    }

    @Override
    public String toString() {
        return "DomainSelection{" + outcome + ", ranking=" + ranking + "}";
    }
}
