package com.example.docxschema.util.docx;

import com.example.docxschema.util.schema.feature.StructuralUnit;
import com.example.docxschema.util.schema.feature.StyleMeta;
import com.example.docxschema.util.schema.feature.TableRef;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * DOCX → 结构单元序列
 *
 * 按文档顺序平铺所有段落和表格：
 * - 段落：跳过空段落，样式取段落样式 + 第一个有文本的 run
 * - 表格：单元格按行优先展开，附带 TableRef（表格ID形如 t001）
 *
 * 样式缺失时保留 null，由特征提取器映射为 unknown 哨兵值。
 */
@Slf4j
public class DocxUnitReader {

    /** 1 级缩进 = 0.5 英寸 = 720 twips */
    private static final int TWIPS_PER_INDENT_LEVEL = 720;

    public List<StructuralUnit> read(InputStream in) throws IOException {
        try (XWPFDocument doc = new XWPFDocument(in)) {
            return read(doc);
        }
    }

    public List<StructuralUnit> read(XWPFDocument doc) {
        List<StructuralUnit> units = new ArrayList<>();
        int tableCounter = 0;

        for (IBodyElement element : doc.getBodyElements()) {
            if (element instanceof XWPFParagraph) {
                XWPFParagraph para = (XWPFParagraph) element;
                String text = para.getText();

                // 跳过空段落
                if (text == null || text.trim().isEmpty()) {
                    continue;
                }
                StyleMeta style = extractStyle(para, doc).build();
                units.add(StructuralUnit.paragraph(units.size(), text, style));

            } else if (element instanceof XWPFTable) {
                tableCounter++;
                String tableId = String.format("t%03d", tableCounter);
                readTable((XWPFTable) element, tableId, doc, units);
            }
        }

        log.debug("Read {} structural units ({} tables)", units.size(), tableCounter);
        return units;
    }

    private void readTable(XWPFTable table, String tableId, XWPFDocument doc, List<StructuralUnit> units) {
        List<XWPFTableRow> rows = table.getRows();
        int colCount = 0;
        for (XWPFTableRow row : rows) {
            colCount = Math.max(colCount, row.getTableCells().size());
        }

        for (int r = 0; r < rows.size(); r++) {
            List<XWPFTableCell> cells = rows.get(r).getTableCells();
            for (int c = 0; c < cells.size(); c++) {
                XWPFTableCell cell = cells.get(c);
                String text = cell.getText();
                if (text == null || text.trim().isEmpty()) {
                    continue;
                }
                StyleMeta.Builder style = cell.getParagraphs().isEmpty()
                        ? StyleMeta.builder()
                        : extractStyle(cell.getParagraphs().get(0), doc);
                style.table(new TableRef(tableId, r, c, rows.size(), colCount));
                units.add(new StructuralUnit(units.size(), StructuralUnit.Kind.TABLE_CELL, text, style.build()));
            }
        }
    }

    /**
     * 提取段落样式：样式ID/样式名、首个文本 run 的字体格式、对齐、缩进、列表层级
     */
    static StyleMeta.Builder extractStyle(XWPFParagraph para, XWPFDocument doc) {
        StyleMeta.Builder b = StyleMeta.builder();

        String styleId = para.getStyle();
        b.styleId(styleId);
        b.styleName(resolveStyleName(styleId, doc));

        XWPFRun run = firstTextRun(para);
        if (run != null) {
            b.fontName(run.getFontFamily());
            Double size = run.getFontSizeAsDouble();
            b.fontSize(size != null && size > 0 ? size : null);
            b.bold(run.isBold());
            b.italic(run.isItalic());
            UnderlinePatterns underline = run.getUnderline();
            b.underline(underline != null && underline != UnderlinePatterns.NONE);
        }

        CTPPr pPr = para.getCTP().getPPr();
        if (pPr != null && pPr.isSetJc() && para.getAlignment() != null) {
            b.alignment(para.getAlignment().name().toLowerCase(Locale.ROOT));
        }

        int left = para.getIndentationLeft();
        if (left > 0) {
            b.indentLevel(left / TWIPS_PER_INDENT_LEVEL);
        }

        BigInteger ilvl = para.getNumIlvl();
        if (ilvl != null) {
            b.listLevel(ilvl.intValue());
        } else if (para.getNumID() != null) {
            b.listLevel(0);
        }
        return b;
    }

    private static String resolveStyleName(String styleId, XWPFDocument doc) {
        if (styleId == null || doc == null) {
            return null;
        }
        XWPFStyles styles = doc.getStyles();
        if (styles == null) {
            return null;
        }
        XWPFStyle style = styles.getStyle(styleId);
        return style != null ? style.getName() : null;
    }

    private static XWPFRun firstTextRun(XWPFParagraph para) {
        for (XWPFRun run : para.getRuns()) {
            String t = run.text();
            if (t != null && !t.trim().isEmpty()) {
                return run;
            }
        }
        return para.getRuns().isEmpty() ? null : para.getRuns().get(0);
    }
}
