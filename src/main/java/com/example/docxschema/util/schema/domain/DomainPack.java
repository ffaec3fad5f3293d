package com.example.docxschema.util.schema.domain;

import com.example.docxschema.util.schema.detect.DetectionResult;
import com.example.docxschema.util.schema.detect.Detector;
import com.example.docxschema.util.schema.detect.DetectorKind;
import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.example.docxschema.util.schema.detect.RoleLexicon;
import com.example.docxschema.util.schema.detect.detectors.LexiconDetector;
import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 域模板（DomainPack）
 *
 * 一个文档体裁的期望结构：
 * - 有序角色列表（每个角色带基数和权重）
 * - 角色 → 检测器映射（不同域可以共用同一个检测器）；带词表的角色在检测器外包一层 {@link LexiconDetector}
 * - 相邻规则：role → 允许紧随其后的角色集合；未声明的角色允许任意后继
 *
 * 构建后不可变，可被多个线程同时读取。
 */
public final class DomainPack {

    private final String name;
    private final int priority;
    private final List<RoleSpec> roles;
    private final Map<String, RoleSpec> rolesByName;
    private final Map<String, Detector> detectors;
    private final Map<String, Set<String>> adjacency;

    private DomainPack(String name, int priority, List<RoleSpec> roles,
                       Map<String, Detector> detectors, Map<String, Set<String>> adjacency) {
        this.name = name;
        this.priority = priority;
        this.roles = Collections.unmodifiableList(new ArrayList<>(roles));
        Map<String, RoleSpec> byName = new LinkedHashMap<>();
        for (RoleSpec r : roles) {
            byName.put(r.getName(), r);
        }
        this.rolesByName = Collections.unmodifiableMap(byName);
        this.detectors = Collections.unmodifiableMap(new LinkedHashMap<>(detectors));
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : adjacency.entrySet()) {
            adj.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() { return name; }
    public int getPriority() { return priority; }
    public List<RoleSpec> getRoles() { return roles; }
    public Map<String, Set<String>> getAdjacency() { return adjacency; }

    public RoleSpec getRole(String roleName) {
        return rolesByName.get(roleName);
    }

    public boolean hasRole(String roleName) {
        return rolesByName.containsKey(roleName);
    }

    /**
     * 必需角色（EXACTLY_ONE），按声明顺序
     */
    public List<RoleSpec> getRequiredRoles() {
        List<RoleSpec> required = new ArrayList<>();
        for (RoleSpec r : roles) {
            if (r.isRequired()) {
                required.add(r);
            }
        }
        return required;
    }

    public int indexOf(String roleName) {
        for (int i = 0; i < roles.size(); i++) {
            if (roles.get(i).getName().equals(roleName)) {
                return i;
            }
        }
        return -1;
    }

    public Detector detectorFor(String roleName) {
        Detector detector = detectors.get(roleName);
        if (detector == null) {
            throw new IllegalArgumentException("Role " + roleName + " is not declared in domain " + name);
        }
        return detector;
    }

    /**
     * 用角色对应的检测器打分，结果换成域内角色名
     */
    public DetectionResult detect(String roleName, FeatureVector features, ContextWindow<FeatureVector> context) {
        DetectionResult r = detectorFor(roleName).detect(features, context);
        return r.withRole(roleName);
    }

    /**
     * 相邻规则：previous 之后能否紧跟 next
     *
     * previous 为 null（文档开头）或未声明规则时一律允许。
     */
    public boolean allowsFollower(String previous, String next) {
        if (previous == null) {
            return true;
        }
        Set<String> allowed = adjacency.get(previous);
        return allowed == null || allowed.contains(next);
    }

    @Override
    public String toString() {
        return "DomainPack{" + name + ", priority=" + priority + ", roles=" + roles + "}";
    }

    /**
     * DomainPack 构建器
     *
     * 角色可按种类声明（build 时从 DetectorRegistry 取检测器），也可直接注入检测器；
     * 两种方式都可以再挂一个角色词表。
     */
    public static final class Builder {
        private final String name;
        private int priority = Integer.MAX_VALUE;
        private final List<RoleSpec> roles = new ArrayList<>();
        private final Map<String, Detector> explicitDetectors = new LinkedHashMap<>();
        private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        private final Map<String, RoleLexicon> lexicons = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder role(String roleName, DetectorKind kind, Cardinality cardinality) {
            return role(roleName, kind, cardinality, 1.0);
        }

        public Builder role(String roleName, DetectorKind kind, Cardinality cardinality, double weight) {
            if (kind == null) {
                throw new IllegalArgumentException("Role " + roleName + " needs a detector kind");
            }
            roles.add(new RoleSpec(roleName, kind, cardinality, weight));
            return this;
        }

        public Builder role(String roleName, Detector detector, Cardinality cardinality) {
            return role(roleName, detector, cardinality, 1.0);
        }

        public Builder role(String roleName, Detector detector, Cardinality cardinality, double weight) {
            if (detector == null) {
                throw new IllegalArgumentException("Role " + roleName + " needs a detector");
            }
            roles.add(new RoleSpec(roleName, null, cardinality, weight));
            explicitDetectors.put(roleName, detector);
            return this;
        }

        /**
         * 为角色挂词表（空词表忽略）
         */
        public Builder lexicon(String roleName, RoleLexicon lexicon) {
            if (lexicon != null && !lexicon.isEmpty()) {
                lexicons.put(roleName, lexicon);
            }
            return this;
        }

        public Builder followers(String roleName, String... allowed) {
            return followers(roleName, Arrays.asList(allowed));
        }

        public Builder followers(String roleName, Iterable<String> allowed) {
            Set<String> set = adjacency.computeIfAbsent(roleName, k -> new LinkedHashSet<>());
            for (String a : allowed) {
                set.add(a);
            }
            return this;
        }

        public DomainPack build() {
            return build(DetectorRegistry.defaults());
        }

        public DomainPack build(DetectorRegistry registry) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Domain pack name must not be blank");
            }
            if (roles.isEmpty()) {
                throw new IllegalArgumentException("Domain pack " + name + " declares no roles");
            }
            Set<String> seen = new LinkedHashSet<>();
            boolean hasRequired = false;
            Map<String, Detector> detectors = new LinkedHashMap<>();
            for (RoleSpec r : roles) {
                if (!seen.add(r.getName())) {
                    throw new IllegalArgumentException("Domain pack " + name + " declares role twice: " + r.getName());
                }
                hasRequired |= r.isRequired();
                Detector d = explicitDetectors.get(r.getName());
                if (d == null) {
                    d = registry.get(r.getKind());
                }
                RoleLexicon lexicon = lexicons.get(r.getName());
                detectors.put(r.getName(), lexicon != null ? new LexiconDetector(d, lexicon) : d);
            }
            if (!seen.containsAll(lexicons.keySet())) {
                throw new IllegalArgumentException("Domain pack " + name + " has a lexicon for unknown roles: "
                        + lexicons.keySet());
            }
            if (!hasRequired) {
                throw new IllegalArgumentException("Domain pack " + name + " must declare at least one EXACTLY_ONE role");
            }
            for (Map.Entry<String, Set<String>> e : adjacency.entrySet()) {
                if (!seen.contains(e.getKey()) || !seen.containsAll(e.getValue())) {
                    throw new IllegalArgumentException("Domain pack " + name + " adjacency refers to unknown roles: "
                            + e.getKey() + " -> " + e.getValue());
                }
            }
            return new DomainPack(name, priority, roles, detectors, adjacency);
        }
    }
}
