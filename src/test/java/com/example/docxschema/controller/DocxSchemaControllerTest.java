package com.example.docxschema.controller;

import com.example.docxschema.service.DocxSchemaService;
import com.example.docxschema.util.docx.SchemaJson;
import com.example.docxschema.util.schema.BuildOutcome;
import com.example.docxschema.util.schema.aggregate.BuildDiagnostic;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.aggregate.SchemaSlot;
import com.example.docxschema.util.schema.domain.Cardinality;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.run.RenderedUnit;
import com.example.docxschema.util.schema.run.RunDiagnostic;
import com.example.docxschema.util.schema.run.RunResult;
import com.example.docxschema.util.schema.score.DomainScore;
import com.example.docxschema.util.schema.score.DomainSelection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DocxSchemaControllerTest {

    private static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Mock
    private DocxSchemaService docxSchemaService;

    @InjectMocks
    private DocxSchemaController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static Schema letterSchema() {
        SchemaSlot salutation = new SchemaSlot("slot-001", "salutation", "SALUTATION", Cardinality.EXACTLY_ONE, 1,
                StyleMeta.builder().styleId("Normal").build(), 0, Collections.singletonList(2),
                "{{salutation}}", 0.95, Collections.singletonMap("addressee", "Mr. Smith"));
        return new Schema("LETTER", 0.97, Collections.singletonList(salutation),
                Collections.<BuildDiagnostic>emptyList());
    }

    private static DomainSelection selection(DomainSelection.Outcome outcome) {
        return new DomainSelection(outcome, 0.35, Arrays.asList(
                new DomainScore("LETTER", 1, 0.97, 0, null),
                new DomainScore("CONTRACT", 3, 0.28, 2, null)));
    }

    private static MockMultipartFile docx(String name) {
        return new MockMultipartFile("file", name, DOCX, new byte[]{1, 2, 3});
    }

    @Test
    @DisplayName("/build 返回 Schema 和候选域")
    void buildReturnsSchema() throws Exception {
        when(docxSchemaService.buildSchema(any(InputStream.class), isNull()))
                .thenReturn(BuildOutcome.built(selection(DomainSelection.Outcome.SELECTED), letterSchema()));

        mockMvc.perform(multipart("/api/schema/build").file(docx("letter.docx")).param("topK", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.outcome").value("SELECTED"))
                .andExpect(jsonPath("$.proposals.length()").value(1))
                .andExpect(jsonPath("$.schema.domain").value("LETTER"))
                .andExpect(jsonPath("$.schema.slots[0].slot_id").value("slot-001"))
                .andExpect(jsonPath("$.schema.slots[0].fields.addressee").value("Mr. Smith"));
    }

    @Test
    @DisplayName("/build 无可信域时返回 success=false 和候选排名")
    void buildWithoutConfidentDomain() throws Exception {
        when(docxSchemaService.buildSchema(any(InputStream.class), isNull()))
                .thenReturn(BuildOutcome.noConfidentDomain(selection(DomainSelection.Outcome.NO_CONFIDENT_DOMAIN)));

        mockMvc.perform(multipart("/api/schema/build").file(docx("notes.docx")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.outcome").value("NO_CONFIDENT_DOMAIN"))
                .andExpect(jsonPath("$.proposals.length()").value(2))
                .andExpect(jsonPath("$.schema").doesNotExist());
    }

    @Test
    @DisplayName("/build 拒绝非 docx 文件")
    void buildRejectsOtherFiles() throws Exception {
        mockMvc.perform(multipart("/api/schema/build").file(docx("report.pdf")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(docxSchemaService);
    }

    @Test
    @DisplayName("/build 未知域名返回 400")
    void buildRejectsUnknownDomain() throws Exception {
        when(docxSchemaService.buildSchema(any(InputStream.class), eq("INVOICE")))
                .thenThrow(new IllegalArgumentException("Unknown domain: INVOICE"));

        mockMvc.perform(multipart("/api/schema/build").file(docx("letter.docx")).param("domain", "INVOICE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown domain: INVOICE"));
    }

    @Test
    @DisplayName("/run/preview 返回输出单元和诊断")
    void runPreview() throws Exception {
        RenderedUnit unit = new RenderedUnit("slot-001", "salutation", "Dear Ms. Lee,",
                StyleMeta.builder().styleId("Normal").build(), 0, 0, true, false);
        RunDiagnostic overflow = new RunDiagnostic(RunDiagnostic.Type.OVERFLOW, RenderedUnit.OVERFLOW,
                RenderedUnit.OVERFLOW, "1 content block(s) left after all slots were consumed");
        when(docxSchemaService.run(any(Schema.class), eq("Dear Ms. Lee,\nP.S.")))
                .thenReturn(new RunResult(Collections.singletonList(unit), Collections.singletonList(overflow)));

        String body = "{\"schema\":" + SchemaJson.toJson(letterSchema()) + ",\"text\":\"Dear Ms. Lee,\\nP.S.\"}";

        mockMvc.perform(post("/api/schema/run/preview").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.units[0].text").value("Dear Ms. Lee,"))
                .andExpect(jsonPath("$.diagnostics[0].type").value("OVERFLOW"));
    }

    @Test
    @DisplayName("/run/preview 缺少 schema 返回 400")
    void runPreviewRequiresSchema() throws Exception {
        mockMvc.perform(post("/api/schema/run/preview").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(docxSchemaService);
    }

    @Test
    @DisplayName("/run 返回 DOCX 附件")
    void runDownloadsDocx() throws Exception {
        byte[] bytes = new byte[]{80, 75, 3, 4};
        when(docxSchemaService.render(any(Schema.class), eq("Dear Ms. Lee,"), isNull())).thenReturn(bytes);

        mockMvc.perform(multipart("/api/schema/run")
                        .param("schema", SchemaJson.toJson(letterSchema()))
                        .param("text", "Dear Ms. Lee,"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", DOCX))
                .andExpect(header().string("Content-Disposition",
                        containsString("letter.docx")))
                .andExpect(content().bytes(bytes));
    }

    @Test
    @DisplayName("/run 非法 Schema JSON 返回 400")
    void runRejectsBadSchema() throws Exception {
        mockMvc.perform(multipart("/api/schema/run").param("schema", "{not json").param("text", "x"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(docxSchemaService);
    }

    @Test
    @DisplayName("/run 生成失败返回 500")
    void runFailure() throws Exception {
        when(docxSchemaService.render(any(Schema.class), anyString(), isNull()))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(multipart("/api/schema/run").param("schema", SchemaJson.toJson(letterSchema())))
                .andExpect(status().isInternalServerError());
    }
}
