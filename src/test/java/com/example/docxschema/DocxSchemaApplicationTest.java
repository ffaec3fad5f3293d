package com.example.docxschema;

import com.example.docxschema.service.DocxSchemaService;
import com.example.docxschema.util.docx.DocxUnitReader;
import com.example.docxschema.util.docx.SchemaJson;
import com.example.docxschema.util.schema.BuildOutcome;
import com.example.docxschema.util.schema.aggregate.Schema;
import com.example.docxschema.util.schema.feature.StructuralUnit;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 端到端：DOCX → Schema → 新内容 → DOCX
 */
@SpringBootTest
@AutoConfigureMockMvc
class DocxSchemaApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DocxSchemaService docxSchemaService;

    private static byte[] letterDocx() throws IOException {
        String[] lines = {
                "Jane Doe | jane.doe@example.com | +1 555 123 4567",
                "March 3, 2024",
                "Dear Mr. Smith,",
                "I am writing to confirm the arrangements for our meeting next week. "
                        + "The agenda is attached for your review.",
                "Please let me know if the proposed time does not suit you. "
                        + "I look forward to speaking with you soon.",
                "Sincerely,",
                "Jane Doe"
        };
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (XWPFDocument doc = new XWPFDocument()) {
            for (String line : lines) {
                XWPFRun run = doc.createParagraph().createRun();
                run.setText(line);
                run.setFontFamily("Calibri");
                run.setFontSize(11.0);
            }
            doc.write(out);
        }
        return out.toByteArray();
    }

    @Test
    @DisplayName("上传书信 DOCX 推断出 LETTER Schema")
    void buildEndpoint() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "letter.docx",
                "application/vnd.openxmlformats-officedocument.wordprocessingml.document", letterDocx());

        mockMvc.perform(multipart("/api/schema/build").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.schema.domain").value("LETTER"))
                .andExpect(jsonPath("$.schema.slots[1].role").value("date"));
    }

    @Test
    @DisplayName("用推断出的 Schema 套用新内容生成 DOCX，样式沿用原文档")
    void renderRoundTrip() throws Exception {
        BuildOutcome outcome = docxSchemaService.buildSchema(new ByteArrayInputStream(letterDocx()), null);
        Schema reloaded = SchemaJson.fromJson(SchemaJson.toJson(outcome.getSchema()));

        String text = "Ann Lee | ann@example.org\nJune 1, 2025\nDear Dr. Brown,\n"
                + "Thank you for the invitation to speak at the conference.\n"
                + "\nBest regards,\nAnn Lee";
        byte[] docx = docxSchemaService.render(reloaded, text, new ByteArrayInputStream(letterDocx()));

        List<StructuralUnit> units = new DocxUnitReader().read(new ByteArrayInputStream(docx));
        assertThat(units).extracting(StructuralUnit::getText).containsExactly(
                "Ann Lee | ann@example.org", "June 1, 2025", "Dear Dr. Brown,",
                "Thank you for the invitation to speak at the conference.", "Best regards,", "Ann Lee");
        assertThat(units.get(1).getStyle().getFontName()).isEqualTo("Calibri");
        assertThat(units.get(1).getStyle().getFontSize()).isEqualTo(11.0);
    }
}
