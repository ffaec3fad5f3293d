package com.example.docxschema.util.docx;

import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.feature.TableRef;
import com.example.docxschema.util.schema.run.RenderedUnit;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocxRenderWriterTest {

    private final DocxRenderWriter writer = new DocxRenderWriter();
    private final DocxUnitReader reader = new DocxUnitReader();

    private static final StyleMeta HEADING = StyleMeta.builder().styleId("Heading1").fontName("Arial")
            .fontSize(16.0).bold(true).alignment("center").build();
    private static final StyleMeta BODY = StyleMeta.builder().fontName("Calibri").fontSize(11.0)
            .italic(true).underline(true).indentLevel(1).build();

    private static RenderedUnit unit(int ordinal, String text, StyleMeta style) {
        return new RenderedUnit("slot-00" + (ordinal + 1), "r" + ordinal, text, style, ordinal, ordinal, true, false);
    }

    private static List<RenderedUnit> units() {
        StyleMeta cell = StyleMeta.builder().fontName("Calibri").table(new TableRef("t001", 0, 0, 2, 2)).build();
        return Arrays.asList(
                unit(0, "New Title", HEADING),
                unit(1, "New body text.", BODY),
                unit(2, "A", cell),
                unit(3, "B", cell),
                unit(4, "C", cell),
                new RenderedUnit(RenderedUnit.OVERFLOW, RenderedUnit.OVERFLOW, "extra", StyleMeta.UNKNOWN, 5, 5,
                        true, true));
    }

    @Test
    @DisplayName("段落套用槽位样式，重新读取后样式一致")
    void appliesSlotStyles() {
        List<StructuralUnit> back = reader.read(writer.write(units()));

        StyleMeta heading = back.get(0).getStyle();
        assertThat(back.get(0).getText()).isEqualTo("New Title");
        assertThat(heading.getStyleId()).isEqualTo("Heading1");
        assertThat(heading.getFontName()).isEqualTo("Arial");
        assertThat(heading.getFontSize()).isEqualTo(16.0);
        assertThat(heading.getBold()).isTrue();
        assertThat(heading.getAlignment()).isEqualTo("center");

        StyleMeta body = back.get(1).getStyle();
        assertThat(body.getItalic()).isTrue();
        assertThat(body.getUnderline()).isTrue();
        assertThat(body.getIndentLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("同一表格的连续单元按列数逐行写入新表格，溢出单元写成普通段落")
    void groupsTableCells() {
        XWPFDocument doc = writer.write(units());

        assertThat(doc.getTables()).hasSize(1);
        XWPFTable table = doc.getTables().get(0);
        assertThat(table.getRows()).hasSize(2);
        assertThat(table.getRow(0).getCell(0).getText()).isEqualTo("A");
        assertThat(table.getRow(0).getCell(1).getText()).isEqualTo("B");
        assertThat(table.getRow(1).getCell(0).getText()).isEqualTo("C");
        assertThat(doc.getParagraphs().get(doc.getParagraphs().size() - 1).getText()).isEqualTo("extra");
    }

    @Test
    @DisplayName("从样式来源文档拷贝样式表")
    void copiesStylesFromSource() throws Exception {
        ByteArrayOutputStream template = new ByteArrayOutputStream();
        try (XWPFDocument draft = new XWPFDocument()) {
            DocxUnitReaderTest.addParagraphStyle(draft, "Heading1", "heading 1");
            draft.write(template);
        }

        try (XWPFDocument source = new XWPFDocument(new ByteArrayInputStream(template.toByteArray()))) {
            XWPFDocument out = writer.write(units(), source);

            assertThat(out.getStyles().getStyle("Heading1")).isNotNull();
            assertThat(reader.read(out).get(0).getStyle().getStyleName()).isEqualTo("heading 1");
        }
    }

    @Test
    @DisplayName("写出字节流后可以重新打开")
    void writesToStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        writer.write(units(), null, out);

        List<StructuralUnit> back = reader.read(new ByteArrayInputStream(out.toByteArray()));
        assertThat(back).extracting(StructuralUnit::getText)
                .containsExactly("New Title", "New body text.", "A", "B", "C", "extra");
    }
}
