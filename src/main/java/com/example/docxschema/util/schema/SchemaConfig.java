package com.example.docxschema.util.schema;

import com.example.docxschema.util.schema.run.BoundaryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.File;

/**
 * Schema 构建/运行全局配置类
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用）
 * 2. 支持从 JSON 文件部分覆盖
 * 3. 容错回退（JSON 解析失败时使用默认值）
 */
@Slf4j
public class SchemaConfig {

    // ========== 打分相关 ==========

    /** 单个角色候选的最低置信度 */
    public double MIN_CONFIDENCE = 0.5;

    /** 每个缺失（低于 MIN_CONFIDENCE）必需角色的扣分 */
    public double MISSING_ROLE_PENALTY = 0.15;

    /** 域得分下限：最佳域低于此值时报告"无可信域" */
    public double DOMAIN_SCORE_FLOOR = 0.35;

    /** 特征上下文窗口大小（前后各 k 个单元） */
    public int CONTEXT_WINDOW = 2;

    /** 并行打分线程数（<=1 时串行） */
    public int SCORING_THREADS = 4;

    // ========== 运行相关 ==========

    /** 可重复槽位的分块策略 */
    public BoundaryPolicy BOUNDARY_POLICY = BoundaryPolicy.BLANK_LINE;

    /** 显式分隔行 */
    public String BOUNDARY_MARKER = "---";

    /** 是否对 OPTIONAL 槽位做角色兼容性检查 */
    public boolean COMPATIBILITY_CHECK = false;

    /** 兼容性检查阈值：槽位检测器对内容块的置信度低于此值则跳过该槽位 */
    public double OPTIONAL_SLOT_MIN_CONFIDENCE = 0.3;

    private SchemaConfig() {
    }

    /**
     * 加载默认配置
     */
    public static SchemaConfig loadDefault() {
        return new SchemaConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static SchemaConfig loadFromJson(String jsonPath) {
        SchemaConfig config = new SchemaConfig();
        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode json = mapper.readTree(new File(jsonPath));

            if (json.has("MIN_CONFIDENCE")) {
                config.MIN_CONFIDENCE = json.get("MIN_CONFIDENCE").asDouble();
            }
            if (json.has("MISSING_ROLE_PENALTY")) {
                config.MISSING_ROLE_PENALTY = json.get("MISSING_ROLE_PENALTY").asDouble();
            }
            if (json.has("DOMAIN_SCORE_FLOOR")) {
                config.DOMAIN_SCORE_FLOOR = json.get("DOMAIN_SCORE_FLOOR").asDouble();
            }
            if (json.has("CONTEXT_WINDOW")) {
                config.CONTEXT_WINDOW = json.get("CONTEXT_WINDOW").asInt();
            }
            if (json.has("SCORING_THREADS")) {
                config.SCORING_THREADS = json.get("SCORING_THREADS").asInt();
            }
            if (json.has("BOUNDARY_POLICY")) {
                config.BOUNDARY_POLICY = BoundaryPolicy.valueOf(json.get("BOUNDARY_POLICY").asText().trim().toUpperCase());
            }
            if (json.has("BOUNDARY_MARKER")) {
                config.BOUNDARY_MARKER = json.get("BOUNDARY_MARKER").asText();
            }
            if (json.has("COMPATIBILITY_CHECK")) {
                config.COMPATIBILITY_CHECK = json.get("COMPATIBILITY_CHECK").asBoolean();
            }
            if (json.has("OPTIONAL_SLOT_MIN_CONFIDENCE")) {
                config.OPTIONAL_SLOT_MIN_CONFIDENCE = json.get("OPTIONAL_SLOT_MIN_CONFIDENCE").asDouble();
            }

            log.info("[SchemaConfig] Loaded config from: {}", jsonPath);
        } catch (Exception e) {
            log.warn("[SchemaConfig] Failed to load JSON, using default config: {}", e.getMessage());
            return new SchemaConfig();
        }
        return config;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SchemaConfig{\n");
        sb.append("  MIN_CONFIDENCE=").append(MIN_CONFIDENCE).append(",\n");
        sb.append("  MISSING_ROLE_PENALTY=").append(MISSING_ROLE_PENALTY).append(",\n");
        sb.append("  DOMAIN_SCORE_FLOOR=").append(DOMAIN_SCORE_FLOOR).append(",\n");
        sb.append("  CONTEXT_WINDOW=").append(CONTEXT_WINDOW).append(",\n");
        sb.append("  SCORING_THREADS=").append(SCORING_THREADS).append(",\n");
        sb.append("  BOUNDARY_POLICY=").append(BOUNDARY_POLICY).append(",\n");
        sb.append("  BOUNDARY_MARKER=").append(BOUNDARY_MARKER).append(",\n");
        sb.append("  COMPATIBILITY_CHECK=").append(COMPATIBILITY_CHECK).append(",\n");
        sb.append("  OPTIONAL_SLOT_MIN_CONFIDENCE=").append(OPTIONAL_SLOT_MIN_CONFIDENCE).append("\n");
        sb.append("}");
        return sb.toString();
    }
}
