package com.example.docxschema.util.schema.score;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单个域的聚合得分
 */
public final class DomainScore {

    private final String domain;
    private final int priority;
    private final double score;
    private final int penalizedRoles;
    private final List<Anchor> anchors;

    @JsonCreator
    public DomainScore(@JsonProperty("domain") String domain,
                       @JsonProperty("priority") int priority,
                       @JsonProperty("score") double score,
                       @JsonProperty("penalized_roles") int penalizedRoles,
                       @JsonProperty("anchors") List<Anchor> anchors) {
        this.domain = domain;
        this.priority = priority;
        this.score = score;
        this.penalizedRoles = penalizedRoles;
        this.anchors = anchors == null ? Collections.<Anchor>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(anchors));
    }

    @JsonProperty("domain")
    public String getDomain() { return domain; }

    @JsonProperty("priority")
    public int getPriority() { return priority; }

    @JsonProperty("score")
    public double getScore() { return score; }

    @JsonProperty("penalized_roles")
    public int getPenalizedRoles() { return penalizedRoles; }

    @JsonProperty("anchors")
    public List<Anchor> getAnchors() { return anchors; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainScore)) return false;
        DomainScore that = (DomainScore) o;
        return priority == that.priority
                && Double.compare(that.score, score) == 0
                && penalizedRoles == that.penalizedRoles
                && Objects.equals(domain, that.domain)
                && anchors.equals(that.anchors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, priority, score, penalizedRoles, anchors);
    }

    @Override
    public String toString() {
        return String.format("%s=%.3f (penalized=%d)", domain, score, penalizedRoles);
    }

    /**
     * 必需角色的锚点；unit = -1 表示未锚定（扣分角色）
     */
    public static final class Anchor {
        private final String role;
        private final int unit;
        private final double confidence;
        private final boolean penalized;

        @JsonCreator
        public Anchor(@JsonProperty("role") String role,
                      @JsonProperty("unit") int unit,
                      @JsonProperty("confidence") double confidence,
                      @JsonProperty("penalized") boolean penalized) {
            this.role = role;
            this.unit = unit;
            this.confidence = confidence;
            this.penalized = penalized;
        }

        @JsonProperty("role")
        public String getRole() { return role; }

        @JsonProperty("unit")
        public int getUnit() { return unit; }

        @JsonProperty("confidence")
        public double getConfidence() { return confidence; }

        @JsonProperty("penalized")
        public boolean isPenalized() { return penalized; }

        @JsonIgnore
        public boolean isAnchored() {
            return unit >= 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Anchor)) return false;
            Anchor that = (Anchor) o;
            return unit == that.unit && penalized == that.penalized
                    && Double.compare(that.confidence, confidence) == 0
                    && Objects.equals(role, that.role);
        }

        @Override
        public int hashCode() {
            return Objects.hash(role, unit, confidence, penalized);
        }

        @Override
        public String toString() {
            return role + "@" + unit + (penalized ? "(penalized)" : "");
        }
    }
}
