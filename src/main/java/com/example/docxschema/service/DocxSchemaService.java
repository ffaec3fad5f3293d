package com.example.docxschema.service;

import com.example.docxschema.util.docx.DocxRenderWriter;
import com.example.docxschema.util.docx.DocxUnitReader;
import com.example.docxschema.util.schema.BuildOutcome;
import com.example.docxschema.util.schema.SchemaBuilder;
import com.example.docxschema.util.schema.SchemaConfig;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.run.ContentBlock;
import com.example.docxschema.util.schema.run.PlaintextBlockReader;
import com.example.docxschema.util.schema.run.RunResult;
import com.example.docxschema.util.schema.run.SchemaRunner;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * DOCX Schema 服务
 * 提供 Schema 构建（DOCX → Schema）和 Schema 运行（Schema + 纯文本 → 新 DOCX）
 */
@Slf4j
@Service
public class DocxSchemaService {

    @Autowired
    private SchemaBuilder schemaBuilder;

    @Autowired
    private SchemaRunner schemaRunner;

    @Autowired
    private DocxUnitReader unitReader;

    @Autowired
    private DocxRenderWriter renderWriter;

    @Autowired
    private SchemaConfig config;

    /**
     * 从 DOCX 构建 Schema
     *
     * @param docx DOCX 输入流
     * @param domain 指定域（为空则自动选择）
     * @return 构建结果（可能是"无可信域"）
     * @throws IOException DOCX 解析失败
     */
    public BuildOutcome buildSchema(InputStream docx, String domain) throws IOException {
        List<StructuralUnit> units = unitReader.read(docx);
        log.info("DOCX 解析完成: {} 个结构单元, domain={}", units.size(), domain);
        BuildOutcome outcome = schemaBuilder.build(units, domain);
        if (outcome.isBuilt()) {
            log.info("Schema 构建完成: domain={}, slots={}, diagnostics={}",
                    outcome.getSchema().getDomain(), outcome.getSchema().getSlots().size(),
                    outcome.getSchema().getDiagnostics().size());
        } else {
            log.warn("未找到可信域: {}", outcome.getSelection().getRanking());
        }
        return outcome;
    }

    /**
     * 运行 Schema（只返回结果，不生成文档）
     */
    public RunResult run(Schema schema, String text) {
        List<ContentBlock> blocks = new PlaintextBlockReader(config.BOUNDARY_MARKER).read(text);
        return schemaRunner.run(schema, blocks);
    }

    /**
     * 运行 Schema 并生成 DOCX
     *
     * @param schema Schema
     * @param text 新内容
     * @param template 样式来源 DOCX（可为 null），用于让样式ID在新文档中生效
     * @return DOCX 字节
     */
    public byte[] render(Schema schema, String text, InputStream template) throws IOException {
        RunResult result = run(schema, text);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (template == null) {
            renderWriter.write(result.getUnits(), null, baos);
        } else {
            try (XWPFDocument source = new XWPFDocument(template)) {
                renderWriter.write(result.getUnits(), source, baos);
            }
        }
        log.info("生成 DOCX: {} 个输出单元, {} 字节", result.getUnits().size(), baos.size());
        return baos.toByteArray();
    }
}
