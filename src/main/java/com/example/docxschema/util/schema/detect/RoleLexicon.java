package com.example.docxschema.util.schema.detect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 角色词表：按文字内容为某个域内角色提供证据
 *
 * 证据分项（可加，最终由检测结果钳制到 [0,1]）：
 * - 标题精确命中（去标点、大写、合并空白后相等）：+1.0
 * - 标题模糊命中（相似度 ≥ 0.82）：+0.6 × 相似度
 * - 任一正则命中：+0.5
 * - 关键词：每个 +0.1，最多 +0.4
 * - 任一停用词命中：-0.3
 *
 * 不可变，可被多个线程同时读取。
 */
public final class RoleLexicon {

    public static final double EXACT_WEIGHT = 1.0;
    public static final double FUZZY_WEIGHT = 0.6;
    public static final double FUZZY_MIN_RATIO = 0.82;
    public static final double REGEX_WEIGHT = 0.5;
    public static final double KEYWORD_WEIGHT = 0.1;
    public static final double KEYWORD_CAP = 0.4;
    public static final double STOPWORD_PENALTY = 0.3;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final String BOUNDARY = "(?:^|[^\\p{L}\\p{N}_])";

    /** 规范化键 → 原始写法 */
    private final Map<String, String> headingsExact;
    private final Map<String, String> headingsFuzzy;
    private final List<Pattern> keywords;
    private final List<Pattern> regexes;
    private final List<Pattern> stopwords;

    private RoleLexicon(Builder b) {
        this.headingsExact = Collections.unmodifiableMap(new LinkedHashMap<>(b.headingsExact));
        this.headingsFuzzy = Collections.unmodifiableMap(new LinkedHashMap<>(b.headingsFuzzy));
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
        this.regexes = Collections.unmodifiableList(new ArrayList<>(b.regexes));
        this.stopwords = Collections.unmodifiableList(new ArrayList<>(b.stopwords));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return headingsExact.isEmpty() && headingsFuzzy.isEmpty() && keywords.isEmpty()
                && regexes.isEmpty() && stopwords.isEmpty();
    }

    /**
     * 对一行文本计算词表证据
     */
    public Evidence evaluate(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Evidence.NONE;
        }
        double score = 0.0;
        String matched = null;

        String key = headingKey(text);
        String exact = headingsExact.get(key);
        if (exact != null) {
            score += EXACT_WEIGHT;
            matched = exact;
        }

        double bestRatio = 0.0;
        String bestFuzzy = null;
        for (Map.Entry<String, String> e : headingsFuzzy.entrySet()) {
            double r = ratio(key, e.getKey());
            if (r > bestRatio) {
                bestRatio = r;
                bestFuzzy = e.getValue();
            }
        }
        if (bestRatio >= FUZZY_MIN_RATIO) {
            score += FUZZY_WEIGHT * bestRatio;
            if (matched == null) {
                matched = bestFuzzy;
            }
        }

        for (Pattern p : regexes) {
            if (p.matcher(text).find()) {
                score += REGEX_WEIGHT;
                break;
            }
        }

        int hits = 0;
        for (Pattern p : keywords) {
            if (p.matcher(text).find()) {
                hits++;
            }
        }
        score += Math.min(KEYWORD_CAP, hits * KEYWORD_WEIGHT);

        for (Pattern p : stopwords) {
            if (p.matcher(text).find()) {
                score -= STOPWORD_PENALTY;
                break;
            }
        }
        return new Evidence(score, matched);
    }

    /**
     * 标题键：标点换成空格、合并空白、转大写
     */
    static String headingKey(String s) {
        String t = NON_WORD.matcher(s.trim()).replaceAll(" ");
        return SPACES.matcher(t).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    }

    /**
     * 相似度 2·LCS / (|a| + |b|)，范围 [0,1]
     */
    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        // 长度差过大时上界已低于阈值
        if (2.0 * Math.min(a.length(), b.length()) / total < FUZZY_MIN_RATIO) {
            return 0.0;
        }
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                cur[j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? prev[j - 1] + 1
                        : Math.max(prev[j], cur[j - 1]);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return 2.0 * prev[b.length()] / total;
    }

    /**
     * 词表证据：分数（可为负）与命中的标题原文
     */
    public static final class Evidence {

        static final Evidence NONE = new Evidence(0.0, null);

        private final double score;
        private final String matchedHeading;

        Evidence(double score, String matchedHeading) {
            this.score = score;
            this.matchedHeading = matchedHeading;
        }

        public double getScore() { return score; }
        public String getMatchedHeading() { return matchedHeading; }
    }

    public static final class Builder {
        private final Map<String, String> headingsExact = new LinkedHashMap<>();
        private final Map<String, String> headingsFuzzy = new LinkedHashMap<>();
        private final List<Pattern> keywords = new ArrayList<>();
        private final List<Pattern> regexes = new ArrayList<>();
        private final List<Pattern> stopwords = new ArrayList<>();

        private Builder() {
        }

        public Builder headingsExact(Iterable<String> headings) {
            addHeadings(headingsExact, headings);
            return this;
        }

        public Builder headingsFuzzy(Iterable<String> headings) {
            addHeadings(headingsFuzzy, headings);
            return this;
        }

        public Builder keywords(Iterable<String> words) {
            addWords(keywords, words);
            return this;
        }

        /**
         * 正则不合法时抛 PatternSyntaxException（IllegalArgumentException 子类）
         */
        public Builder regexes(Iterable<String> patterns) {
            if (patterns != null) {
                for (String p : patterns) {
                    if (p != null && !p.trim().isEmpty()) {
                        regexes.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
                    }
                }
            }
            return this;
        }

        public Builder stopwords(Iterable<String> words) {
            addWords(stopwords, words);
            return this;
        }

        public RoleLexicon build() {
            return new RoleLexicon(this);
        }

        private static void addHeadings(Map<String, String> target, Iterable<String> headings) {
            if (headings == null) {
                return;
            }
            for (String h : headings) {
                if (h == null) {
                    continue;
                }
                String key = headingKey(h);
                if (!key.isEmpty()) {
                    target.putIfAbsent(key, h.trim());
                }
            }
        }

        private static void addWords(List<Pattern> target, Iterable<String> words) {
            if (words == null) {
                return;
            }
            for (String w : words) {
                if (w == null || w.trim().isEmpty()) {
                    continue;
                }
                target.add(Pattern.compile(BOUNDARY + Pattern.quote(w.trim()) + "(?:$|[^\\p{L}\\p{N}_])",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
        }
    }
}
