package com.example.docxschema.util.schema.domain;

import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.example.docxschema.util.schema.detect.RoleLexicon;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * domain-packs.json 中单个域模板的定义（Jackson 绑定用）
 *
 * <pre>
 * {
 *   "name": "LETTER",
 *   "priority": 1,
 *   "roles": [
 *     {"name": "date", "detector": "DATE_LINE", "cardinality": "EXACTLY_ONE", "weight": 1.0},
 *     {"name": "section_heading", "detector": "HEADING", "cardinality": "EXACTLY_ONE",
 *      "lexicon": {"headings_exact": ["Experience"], "headings_fuzzy": [], "keywords": [],
 *                  "regexes": [], "stopwords": []}}
 *   ],
 *   "adjacency": { "closing": ["signature"] }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomainPackDefinition {

    @JsonProperty("name")
    private String name;

    @JsonProperty("priority")
    private int priority = Integer.MAX_VALUE;

    @JsonProperty("roles")
    private List<RoleDefinition> roles = new ArrayList<>();

    @JsonProperty("adjacency")
    private Map<String, List<String>> adjacency = new LinkedHashMap<>();

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }
    public List<RoleDefinition> getRoles() { return roles; }
    public void setRoles(List<RoleDefinition> roles) { this.roles = roles; }
    public Map<String, List<String>> getAdjacency() { return adjacency; }
    public void setAdjacency(Map<String, List<String>> adjacency) { this.adjacency = adjacency; }

    /**
     * 转换为 DomainPack（未知检测器种类/基数直接抛 IllegalArgumentException）
     */
    public DomainPack toPack(DetectorRegistry registry) {
        DomainPack.Builder builder = DomainPack.builder(name).priority(priority);
        if (roles != null) {
            for (RoleDefinition r : roles) {
                builder.role(r.getName(), parseKind(r), parseCardinality(r), r.getWeight());
                if (r.getLexicon() != null) {
                    builder.lexicon(r.getName(), r.getLexicon().toLexicon());
                }
            }
        }
        if (adjacency != null) {
            for (Map.Entry<String, List<String>> e : adjacency.entrySet()) {
                builder.followers(e.getKey(), e.getValue());
            }
        }
        return builder.build(registry);
    }

    private DetectorKind parseKind(RoleDefinition r) {
        if (r.getDetector() == null) {
            throw new IllegalArgumentException("Role " + r.getName() + " in domain " + name + " has no detector");
        }
        try {
            return DetectorKind.valueOf(r.getDetector().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown detector '" + r.getDetector() + "' for role "
                    + r.getName() + " in domain " + name, e);
        }
    }

    private Cardinality parseCardinality(RoleDefinition r) {
        if (r.getCardinality() == null) {
            throw new IllegalArgumentException("Role " + r.getName() + " in domain " + name + " has no cardinality");
        }
        try {
            return Cardinality.valueOf(r.getCardinality().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cardinality '" + r.getCardinality() + "' for role "
                    + r.getName() + " in domain " + name, e);
        }
    }

    /**
     * 角色定义
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RoleDefinition {

        @JsonProperty("name")
        private String name;

        @JsonProperty("detector")
        private String detector;

        @JsonProperty("cardinality")
        private String cardinality;

        @JsonProperty("weight")
        private double weight = 1.0;

        @JsonProperty("lexicon")
        private LexiconDefinition lexicon;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDetector() { return detector; }
        public void setDetector(String detector) { this.detector = detector; }
        public String getCardinality() { return cardinality; }
        public void setCardinality(String cardinality) { this.cardinality = cardinality; }
        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
        public LexiconDefinition getLexicon() { return lexicon; }
        public void setLexicon(LexiconDefinition lexicon) { this.lexicon = lexicon; }
    }

    /**
     * 角色词表定义，各字段均可省略
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LexiconDefinition {

        @JsonProperty("headings_exact")
        private List<String> headingsExact = new ArrayList<>();

        @JsonProperty("headings_fuzzy")
        private List<String> headingsFuzzy = new ArrayList<>();

        @JsonProperty("keywords")
        private List<String> keywords = new ArrayList<>();

        @JsonProperty("regexes")
        private List<String> regexes = new ArrayList<>();

        @JsonProperty("stopwords")
        private List<String> stopwords = new ArrayList<>();

        public List<String> getHeadingsExact() { return headingsExact; }
        public void setHeadingsExact(List<String> headingsExact) { this.headingsExact = headingsExact; }
        public List<String> getHeadingsFuzzy() { return headingsFuzzy; }
        public void setHeadingsFuzzy(List<String> headingsFuzzy) { this.headingsFuzzy = headingsFuzzy; }
        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }
        public List<String> getRegexes() { return regexes; }
        public void setRegexes(List<String> regexes) { this.regexes = regexes; }
        public List<String> getStopwords() { return stopwords; }
        public void setStopwords(List<String> stopwords) { this.stopwords = stopwords; }

        public RoleLexicon toLexicon() {
            return RoleLexicon.builder()
                    .headingsExact(headingsExact)
                    .headingsFuzzy(headingsFuzzy)
                    .keywords(keywords)
                    .regexes(regexes)
                    .stopwords(stopwords)
                    .build();
        }
    }
}
