package com.example.docxschema.controller;

import com.example.docxschema.controller.dto.SchemaRunRequest;
import com.example.docxschema.service.DocxSchemaService;
import com.example.docxschema.util.docx.SchemaJson;
import com.example.docxschema.util.schema.BuildOutcome;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.aggregate.SchemaIntegrityException;
import com.example.docxschema.util.schema.run.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * DOCX Schema 控制器
 *
 * - /build：上传 DOCX，推断 Schema
 * - /run/preview：Schema + 纯文本 → 输出单元（JSON）
 * - /run：Schema + 纯文本 → 新 DOCX 下载
 */
@Slf4j
@RestController
@RequestMapping("/api/schema")
public class DocxSchemaController {

    /** DOCX MIME 类型 */
    private static final String DOCX_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Autowired
    private DocxSchemaService docxSchemaService;

    /**
     * 构建 Schema
     *
     * @param file DOCX文件
     * @param domain 指定域（可选，不指定则自动选择）
     * @param topK 返回的候选域数量
     */
    @PostMapping("/build")
    public ResponseEntity<Map<String, Object>> build(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "domain", required = false) String domain,
            @RequestParam(value = "topK", required = false, defaultValue = "3") int topK) {

        Map<String, Object> result = new HashMap<>();

        // 验证文件
        ResponseEntity<Map<String, Object>> invalid = validateDocx(file, result);
        if (invalid != null) {
            return invalid;
        }

        try (InputStream in = file.getInputStream()) {
            log.info("接收文件: {}, domain={}", file.getOriginalFilename(), domain);
            BuildOutcome outcome = docxSchemaService.buildSchema(in, domain);

            result.put("outcome", outcome.getSelection().getOutcome().name());
            result.put("proposals", outcome.getSelection().top(topK));
            if (!outcome.isBuilt()) {
                result.put("success", false);
                result.put("message", "未找到可信的文档域，请通过 domain 参数指定");
                return ResponseEntity.ok(result);
            }
            result.put("success", true);
            result.put("schema", outcome.getSchema());
            result.put("message", "Schema 构建成功");
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(result);
        } catch (SchemaIntegrityException e) {
            log.error("Schema 完整性错误: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "Schema 完整性错误: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        } catch (Exception e) {
            log.error("Schema 构建失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "DOCX 解析失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 运行预览：返回输出单元和诊断
     */
    @PostMapping("/run/preview")
    public ResponseEntity<Map<String, Object>> runPreview(@RequestBody SchemaRunRequest request) {
        Map<String, Object> result = new HashMap<>();
        if (request == null || request.getSchema() == null) {
            result.put("success", false);
            result.put("message", "schema 不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        RunResult run = docxSchemaService.run(request.getSchema(), request.getText());
        result.put("success", true);
        result.put("units", run.getUnits());
        result.put("diagnostics", run.getDiagnostics());
        result.put("message", run.getDiagnostics().isEmpty() ? "运行成功" : "运行完成（有诊断信息）");
        return ResponseEntity.ok(result);
    }

    /**
     * 运行 Schema 并下载生成的 DOCX
     *
     * @param schemaJson Schema JSON（/build 返回的 schema 字段）
     * @param text 新内容
     * @param template 样式来源 DOCX（可选）
     */
    @PostMapping("/run")
    public ResponseEntity<byte[]> run(
            @RequestParam("schema") String schemaJson,
            @RequestParam(value = "text", required = false, defaultValue = "") String text,
            @RequestParam(value = "template", required = false) MultipartFile template) {

        Schema schema;
        try {
            schema = SchemaJson.fromJson(schemaJson);
        } catch (IOException e) {
            log.warn("Schema JSON 解析失败: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        try {
            byte[] docx;
            if (template == null || template.isEmpty()) {
                docx = docxSchemaService.render(schema, text, null);
            } else {
                try (InputStream in = template.getInputStream()) {
                    docx = docxSchemaService.render(schema, text, in);
                }
            }

            // 构建响应头
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(DOCX_CONTENT_TYPE));
            String fileName = (schema.getDomain() != null ? schema.getDomain().toLowerCase() : "document") + ".docx";
            headers.setContentDispositionFormData("attachment", fileName);

            log.info("下载生成文档: domain={}, size={}", schema.getDomain(), docx.length);
            return new ResponseEntity<>(docx, headers, HttpStatus.OK);

        } catch (Exception e) {
            log.error("生成 DOCX 失败: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    private ResponseEntity<Map<String, Object>> validateDocx(MultipartFile file, Map<String, Object> result) {
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".docx")) {
            result.put("success", false);
            result.put("message", "只支持.docx文件");
            return ResponseEntity.badRequest().body(result);
        }
        return null;
    }
}
