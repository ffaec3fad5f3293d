package com.example.docxschema.config;

import com.example.docxschema.util.docx.DocxRenderWriter;
import com.example.docxschema.util.docx.DocxUnitReader;
import com.example.docxschema.util.schema.SchemaBuilder;
import com.example.docxschema.util.schema.SchemaConfig;
import com.example.docxschema.util.schema.detect.DetectorRegistry;
import com.example.docxschema.util.schema.domain.DomainPackRegistry;
import com.example.docxschema.util.schema.run.SchemaRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Schema 流水线装配
 *
 * 调参配置和域模板都在启动时加载一次，之后只读。
 */
@Slf4j
@Configuration
public class SchemaPipelineConfig {

    @Value("${docx-schema.config-path:}")
    private String configPath;

    @Value("${docx-schema.packs-path:}")
    private String packsPath;

    @Bean
    public SchemaConfig schemaConfig() {
        SchemaConfig config = configPath == null || configPath.trim().isEmpty()
                ? SchemaConfig.loadDefault()
                : SchemaConfig.loadFromJson(configPath);
        log.info("Schema pipeline config: {}", config);
        return config;
    }

    @Bean
    public DetectorRegistry detectorRegistry() {
        return DetectorRegistry.defaults();
    }

    @Bean
    public DomainPackRegistry domainPackRegistry(DetectorRegistry detectors) {
        if (packsPath == null || packsPath.trim().isEmpty()) {
            return DomainPackRegistry.loadDefault(detectors);
        }
        return DomainPackRegistry.loadFromJson(packsPath, detectors);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService domainScoringExecutor(SchemaConfig config) {
        return Executors.newFixedThreadPool(Math.max(1, config.SCORING_THREADS));
    }

    @Bean
    public SchemaBuilder schemaBuilder(DomainPackRegistry packs, SchemaConfig config, ExecutorService domainScoringExecutor) {
        return new SchemaBuilder(packs, config, config.SCORING_THREADS > 1 ? domainScoringExecutor : null);
    }

    @Bean
    public SchemaRunner schemaRunner(SchemaConfig config, DetectorRegistry detectors) {
        return new SchemaRunner(config, detectors);
    }

    @Bean
    public DocxUnitReader docxUnitReader() {
        return new DocxUnitReader();
    }

    @Bean
    public DocxRenderWriter docxRenderWriter() {
        return new DocxRenderWriter();
    }
}
