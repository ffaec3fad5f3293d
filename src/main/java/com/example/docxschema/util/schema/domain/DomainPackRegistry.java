package com.example.docxschema.util.schema.domain;

import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 域模板注册表：域名 → DomainPack
 *
 * 进程启动时从显式配置（domain-packs.json）一次性构建，之后只读；
 * 不做运行时类发现，也不保存任何"当前选中域"之类的全局状态。
 * 遍历顺序 = 优先级升序（同优先级按声明顺序）。
 */
@Slf4j
public class DomainPackRegistry {

    /** classpath 上的内置域模板 */
    public static final String DEFAULT_RESOURCE = "/domain-packs.json";

    private final Map<String, DomainPack> packs;

    public DomainPackRegistry(List<DomainPack> packs) {
        List<DomainPack> sorted = new ArrayList<>(packs);
        sorted.sort(Comparator.comparingInt(DomainPack::getPriority));
        Map<String, DomainPack> map = new LinkedHashMap<>();
        for (DomainPack p : sorted) {
            if (map.put(p.getName(), p) != null) {
                throw new IllegalStateException("Duplicate domain pack: " + p.getName());
            }
        }
        this.packs = Collections.unmodifiableMap(map);
    }

    /**
     * 加载内置域模板（LETTER / RESUME / CONTRACT / REPORT）
     */
    public static DomainPackRegistry loadDefault(DetectorRegistry detectors) {
        try (InputStream in = DomainPackRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            JsonNode json = new ObjectMapper().readTree(in);
            DomainPackRegistry registry = fromJson(json, detectors);
            log.info("Loaded {} built-in domain packs: {}", registry.size(), registry.names());
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    /**
     * 从 JSON 文件加载域模板
     *
     * 与调参配置不同，域模板缺失或非法时不能静默回退，直接抛异常让启动失败。
     */
    public static DomainPackRegistry loadFromJson(String jsonPath, DetectorRegistry detectors) {
        try {
            JsonNode json = new ObjectMapper().readTree(new File(jsonPath));
            DomainPackRegistry registry = fromJson(json, detectors);
            log.info("Loaded {} domain packs from {}: {}", registry.size(), jsonPath, registry.names());
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read domain packs from " + jsonPath + ": " + e.getMessage(), e);
        }
    }

    static DomainPackRegistry fromJson(JsonNode json, DetectorRegistry detectors) throws IOException {
        JsonNode packsNode = json.has("packs") ? json.get("packs") : json;
        if (!packsNode.isArray()) {
            throw new IllegalArgumentException("Domain pack configuration must be an array or contain \"packs\"");
        }
        ObjectMapper mapper = new ObjectMapper();
        List<DomainPackDefinition> definitions = mapper.readerFor(new TypeReference<List<DomainPackDefinition>>() { })
                .readValue(packsNode);
        List<DomainPack> packs = new ArrayList<>();
        for (DomainPackDefinition def : definitions) {
            packs.add(def.toPack(detectors));
        }
        return new DomainPackRegistry(packs);
    }

    public DomainPack get(String name) {
        return packs.get(name);
    }

    /**
     * 按名取域模板（大小写不敏感），不存在时抛 IllegalArgumentException
     */
    public DomainPack require(String name) {
        DomainPack pack = packs.get(name);
        if (pack == null && name != null) {
            for (DomainPack p : packs.values()) {
                if (p.getName().equalsIgnoreCase(name.trim())) {
                    return p;
                }
            }
        }
        if (pack == null) {
            throw new IllegalArgumentException("Unknown domain: " + name + " (known: " + names() + ")");
        }
        return pack;
    }

    public List<DomainPack> all() {
        return new ArrayList<>(packs.values());
    }

    public List<String> names() {
        return new ArrayList<>(packs.keySet());
    }

    public int size() {
        return packs.size();
    }
}
