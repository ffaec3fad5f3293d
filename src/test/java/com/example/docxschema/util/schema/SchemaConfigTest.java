package com.example.docxschema.util.schema;

import com.example.docxschema.util.schema.run.BoundaryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaConfigTest {

    @Test
    @DisplayName("默认配置")
    void defaults() {
        SchemaConfig config = SchemaConfig.loadDefault();

        assertThat(config.MIN_CONFIDENCE).isEqualTo(0.5);
        assertThat(config.MISSING_ROLE_PENALTY).isEqualTo(0.15);
        assertThat(config.DOMAIN_SCORE_FLOOR).isEqualTo(0.35);
        assertThat(config.CONTEXT_WINDOW).isEqualTo(2);
        assertThat(config.BOUNDARY_POLICY).isEqualTo(BoundaryPolicy.BLANK_LINE);
        assertThat(config.BOUNDARY_MARKER).isEqualTo("---");
        assertThat(config.COMPATIBILITY_CHECK).isFalse();
    }

    @Test
    @DisplayName("JSON 部分覆盖，未出现的字段保持默认")
    void partialOverride(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("schema-config.json");
        Files.write(file, ("{\"MIN_CONFIDENCE\": 0.6, \"BOUNDARY_POLICY\": \"explicit_marker\","
                + " \"COMPATIBILITY_CHECK\": true}").getBytes(StandardCharsets.UTF_8));

        SchemaConfig config = SchemaConfig.loadFromJson(file.toString());

        assertThat(config.MIN_CONFIDENCE).isEqualTo(0.6);
        assertThat(config.BOUNDARY_POLICY).isEqualTo(BoundaryPolicy.EXPLICIT_MARKER);
        assertThat(config.COMPATIBILITY_CHECK).isTrue();
        assertThat(config.DOMAIN_SCORE_FLOOR).isEqualTo(0.35);
        assertThat(config.SCORING_THREADS).isEqualTo(4);
    }

    @Test
    @DisplayName("文件缺失或内容非法时回退到默认配置")
    void fallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path bad = dir.resolve("bad.json");
        Files.write(bad, "{\"MIN_CONFIDENCE\": 0.9, \"BOUNDARY_POLICY\": \"SOMETIMES\"}".getBytes(StandardCharsets.UTF_8));

        SchemaConfig missing = SchemaConfig.loadFromJson(dir.resolve("missing.json").toString());
        SchemaConfig invalid = SchemaConfig.loadFromJson(bad.toString());

        assertThat(missing.MIN_CONFIDENCE).isEqualTo(0.5);
        assertThat(invalid.MIN_CONFIDENCE).isEqualTo(0.5);
        assertThat(invalid.BOUNDARY_POLICY).isEqualTo(BoundaryPolicy.BLANK_LINE);
    }
}
