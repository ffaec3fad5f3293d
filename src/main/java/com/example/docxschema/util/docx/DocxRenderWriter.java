package com.example.docxschema.util.docx;

import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.feature.TableRef;
import com.example.docxschema.util.schema.run.RenderedUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.xmlbeans.XmlException;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 输出单元 → 新 DOCX
 *
 * - 段落：套用样式ID、字体、字号、加粗/斜体/下划线、对齐、缩进
 * - 同一源表格的连续单元：按捕获的列数逐行填入一张新表格
 * - 可选样式来源文档：把其样式表整体拷贝过来，让样式ID在新文档里仍然有效
 */
@Slf4j
public class DocxRenderWriter {

    private static final int TWIPS_PER_INDENT_LEVEL = 720;

    public XWPFDocument write(List<RenderedUnit> units) {
        return write(units, null);
    }

    /**
     * @param units 运行结果
     * @param styleSource 样式来源文档（可为 null）
     */
    public XWPFDocument write(List<RenderedUnit> units, XWPFDocument styleSource) {
        XWPFDocument doc = new XWPFDocument();
        if (styleSource != null) {
            copyStyles(styleSource, doc);
        }

        int i = 0;
        while (i < units.size()) {
            RenderedUnit unit = units.get(i);
            TableRef table = unit.getStyle().getTable();
            if (table == null) {
                writeParagraph(doc.createParagraph(), unit.getText(), unit.getStyle());
                i++;
                continue;
            }
            List<RenderedUnit> group = new ArrayList<>();
            while (i < units.size() && units.get(i).getStyle().getTable() != null
                    && table.getTableId().equals(units.get(i).getStyle().getTable().getTableId())) {
                group.add(units.get(i));
                i++;
            }
            writeTable(doc, group, Math.max(1, table.getColCount()));
        }

        log.debug("Wrote {} rendered units into a new document", units.size());
        return doc;
    }

    public void write(List<RenderedUnit> units, XWPFDocument styleSource, OutputStream out) throws IOException {
        try (XWPFDocument doc = write(units, styleSource)) {
            doc.write(out);
        }
    }

    private void writeTable(XWPFDocument doc, List<RenderedUnit> cells, int cols) {
        int rows = (cells.size() + cols - 1) / cols;
        XWPFTable table = doc.createTable(rows, cols);
        for (int k = 0; k < cells.size(); k++) {
            XWPFTableCell cell = table.getRow(k / cols).getCell(k % cols);
            XWPFParagraph para = cell.getParagraphs().isEmpty() ? cell.addParagraph() : cell.getParagraphs().get(0);
            writeParagraph(para, cells.get(k).getText(), cells.get(k).getStyle());
        }
    }

    static void writeParagraph(XWPFParagraph para, String text, StyleMeta style) {
        if (style.getStyleId() != null) {
            para.setStyle(style.getStyleId());
        }
        ParagraphAlignment alignment = alignmentOf(style.getAlignment());
        if (alignment != null) {
            para.setAlignment(alignment);
        }
        if (style.getIndentLevel() > 0) {
            para.setIndentationLeft(style.getIndentLevel() * TWIPS_PER_INDENT_LEVEL);
        }

        XWPFRun run = para.createRun();
        run.setText(text);
        if (style.getFontName() != null) {
            run.setFontFamily(style.getFontName());
        }
        if (style.getFontSize() != null) {
            run.setFontSize(style.getFontSize());
        }
        if (style.getBold() != null) {
            run.setBold(style.getBold());
        }
        if (style.getItalic() != null) {
            run.setItalic(style.getItalic());
        }
        if (Boolean.TRUE.equals(style.getUnderline())) {
            run.setUnderline(UnderlinePatterns.SINGLE);
        }
    }

    private static ParagraphAlignment alignmentOf(String name) {
        if (name == null) {
            return null;
        }
        for (ParagraphAlignment a : ParagraphAlignment.values()) {
            if (a.name().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                return a;
            }
        }
        return null;
    }

    private static void copyStyles(XWPFDocument source, XWPFDocument target) {
        // 来源文档没有样式部件时 getStyle() 会抛 IllegalStateException
        if (source.getStyles() == null) {
            log.debug("Style source has no styles part, nothing to copy");
            return;
        }
        try {
            XWPFStyles styles = target.createStyles();
            styles.setStyles(source.getStyle());
        } catch (IOException | XmlException e) {
            log.warn("Failed to copy styles from source document, style ids may not resolve: {}", e.getMessage());
        }
    }
}
