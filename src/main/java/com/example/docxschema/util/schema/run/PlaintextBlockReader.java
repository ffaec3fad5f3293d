package com.example.docxschema.util.schema.run;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * 纯文本 → 内容块
 *
 * - 每个非空行一个块
 * - 空行在下一个块前记 BLANK_LINE 边界
 * - 分隔行（默认 "---"）在下一个块前记 EXPLICIT 边界，优先于空行
 * - 统一 CRLF/CR 换行，去掉 BOM 和零宽字符，Unicode 规范化为 NFC
 */
public class PlaintextBlockReader {

    public static final String DEFAULT_MARKER = "---";

    private final String marker;

    public PlaintextBlockReader() {
        this(DEFAULT_MARKER);
    }

    public PlaintextBlockReader(String marker) {
        this.marker = marker == null || marker.trim().isEmpty() ? DEFAULT_MARKER : marker.trim();
    }

    public List<ContentBlock> read(String text) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (text == null) {
            return blocks;
        }
        String normalized = clean(text).replace("\r\n", "\n").replace('\r', '\n');

        ContentBlock.Boundary pending = ContentBlock.Boundary.NONE;
        for (String line : normalized.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.equals(marker)) {
                pending = ContentBlock.Boundary.EXPLICIT;
            } else if (trimmed.isEmpty()) {
                if (pending == ContentBlock.Boundary.NONE) {
                    pending = ContentBlock.Boundary.BLANK_LINE;
                }
            } else {
                // 第一块之前的空行没有意义
                ContentBlock.Boundary boundary = blocks.isEmpty() ? ContentBlock.Boundary.NONE : pending;
                blocks.add(new ContentBlock(blocks.size(), trimmed, boundary));
                pending = ContentBlock.Boundary.NONE;
            }
        }
        return blocks;
    }

    private static String clean(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060') {
                continue;
            }
            sb.append(c);
        }
        // 组合字符与预组字符统一为同一形式
        return Normalizer.normalize(sb, Normalizer.Form.NFC);
    }
}
