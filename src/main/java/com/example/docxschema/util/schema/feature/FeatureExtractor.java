package com.example.docxschema.util.schema.feature;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 特征提取器
 *
 * 将每个结构单元转换为扁平的特征向量：
 * 1. 位置特征（序号、相对位置、首尾）
 * 2. 文本形态特征（长度、词数、句数、大小写比例、数字/标点/空白密度）
 * 3. 前缀/标记特征（项目符号、编号前缀、目录点线、邮箱/电话/URL）
 * 4. 样式特征（样式ID、字体、字号、加粗/斜体/下划线、缩进、列表、表格）
 * 5. 相对特征（与前一单元的字号差、是否大于上下文字号、是否与前一单元同样式）
 *
 * 确定性、无副作用；样式缺失时输出 "unknown" 哨兵值而不是抛异常。
 */
public class FeatureExtractor {

    /** 默认上下文窗口大小（前后各 k 个单元） */
    public static final int DEFAULT_WINDOW = 2;

    /** 项目符号：符号后必须跟空白，避免句中破折号误判 */
    private static final Pattern BULLET = Pattern.compile("^\\s*([•·∙●◦○▪▸▶\\-–—*])\\s+");

    /** 编号前缀：1. / 1.1 / 1) / a) / iv. / [1] / (2) */
    private static final List<Pattern> NUMBERING = Arrays.asList(
            Pattern.compile("^\\s*((?:\\d+\\.)+\\d+\\.?|\\d+[.)])\\s+"),
            Pattern.compile("^\\s*\\[(\\d+|[A-Za-z])]\\s+"),
            Pattern.compile("^\\s*(\\(?[ivxlcdmIVXLCDM]+[.)])\\s+"),
            Pattern.compile("^\\s*(\\(?[A-Za-z][.)])\\s+"),
            Pattern.compile("^\\s*(\\(\\d+\\))\\s+")
    );

    private static final Pattern LEADER_DOTS = Pattern.compile("(\\.{3,}|…{2,})\\s*\\d+\\s*$");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?。](?=\\s|$)");
    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{7,}\\d");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern WS = Pattern.compile("\\s+");

    private static final String EXTRA_PUNCT = "—–…“”‘’·•∙◦▪";

    private final int window;

    public FeatureExtractor() {
        this(DEFAULT_WINDOW);
    }

    public FeatureExtractor(int window) {
        this.window = Math.max(0, window);
    }

    public int getWindow() {
        return window;
    }

    /**
     * 对整个单元序列提取特征（输出与输入一一对应、顺序一致）
     *
     * @param units 按文档顺序排列的结构单元
     * @return 特征向量列表
     */
    public List<FeatureVector> extractAll(List<StructuralUnit> units) {
        List<FeatureVector> out = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            out.add(extract(units.get(i), ContextWindow.around(units, i, window), units.size()));
        }
        return out;
    }

    /**
     * 提取单个单元的特征
     *
     * @param unit 结构单元
     * @param context 前后 k 个单元
     * @return 特征向量
     */
    public FeatureVector extract(StructuralUnit unit, ContextWindow<StructuralUnit> context) {
        // 文档长度未知时，用窗口推断一个下界
        int total = unit.getIndex() + context.getAfter().size() + 1;
        return extract(unit, context, total);
    }

    private FeatureVector extract(StructuralUnit unit, ContextWindow<StructuralUnit> context, int total) {
        Map<String, Object> f = new LinkedHashMap<>();
        String raw = unit.getText();
        String norm = normalize(raw);
        StyleMeta style = unit.getStyle();

        // 1. 位置
        f.put(FeatureVector.INDEX, unit.getIndex());
        f.put(FeatureVector.REL_POSITION, total <= 1 ? 0.0 : Math.min(1.0, unit.getIndex() / (double) (total - 1)));
        f.put(FeatureVector.IS_FIRST, context.getBefore().isEmpty());
        f.put(FeatureVector.IS_LAST, context.getAfter().isEmpty());

        // 2. 文本形态
        String[] tokens = norm.isEmpty() ? new String[0] : norm.split(" ");
        f.put(FeatureVector.TEXT, norm);
        f.put(FeatureVector.CHAR_LEN, norm.length());
        f.put(FeatureVector.TOKEN_COUNT, tokens.length);
        f.put(FeatureVector.SENTENCE_COUNT, count(SENTENCE_END.matcher(norm)));
        f.put(FeatureVector.UPPERCASE_RATIO, uppercaseRatio(norm));
        f.put(FeatureVector.TITLECASE_RATE, titlecaseRate(tokens));
        f.put(FeatureVector.DIGIT_RATIO, ratio(norm, Character::isDigit));
        f.put(FeatureVector.PUNCT_DENSITY, ratio(norm, FeatureExtractor::isPunct));
        f.put(FeatureVector.WHITESPACE_DENSITY, ratio(raw, Character::isWhitespace));
        f.put(FeatureVector.LEADING_SPACES, leadingSpaces(raw));

        // 3. 前缀/标记
        f.put(FeatureVector.ENDS_WITH_PERIOD, norm.endsWith(".") || norm.endsWith("。"));
        f.put(FeatureVector.TRAILING_COLON, norm.endsWith(":") || norm.endsWith("："));
        String bullet = detectBullet(norm);
        f.put(FeatureVector.STARTS_WITH_BULLET, bullet != null);
        f.put(FeatureVector.BULLET_GLYPH, bullet != null ? bullet : FeatureVector.NONE);
        String numbering = detectNumbering(norm);
        f.put(FeatureVector.NUMBERING_PREFIX, numbering != null ? numbering : FeatureVector.NONE);
        f.put(FeatureVector.HAS_LEADER_DOTS, LEADER_DOTS.matcher(norm).find());
        f.put(FeatureVector.CONTAINS_EMAIL, EMAIL.matcher(norm).find());
        f.put(FeatureVector.CONTAINS_PHONE, PHONE.matcher(norm).find());
        f.put(FeatureVector.CONTAINS_URL, URL.matcher(norm).find());
        f.put(FeatureVector.CONTAINS_DELIMITER, raw.indexOf('|') >= 0 || raw.indexOf('\t') >= 0);

        // 4. 样式（缺失 → 哨兵值）
        f.put(FeatureVector.STYLE_ID, orUnknown(style.getStyleId()));
        f.put(FeatureVector.STYLE_NAME, orUnknown(style.getStyleName()));
        f.put(FeatureVector.STYLE_KNOWN, style.isResolved());
        f.put(FeatureVector.FONT_NAME, orUnknown(style.getFontName()));
        f.put(FeatureVector.FONT_SIZE, sizeOf(style));
        f.put(FeatureVector.BOLD, Boolean.TRUE.equals(style.getBold()));
        f.put(FeatureVector.ITALIC, Boolean.TRUE.equals(style.getItalic()));
        f.put(FeatureVector.UNDERLINE, Boolean.TRUE.equals(style.getUnderline()));
        f.put(FeatureVector.ALIGNMENT, orUnknown(style.getAlignment() != null
                ? style.getAlignment().toLowerCase(Locale.ROOT) : null));
        f.put(FeatureVector.INDENT_LEVEL, style.getIndentLevel());
        f.put(FeatureVector.LIST_LEVEL, style.getListLevel() != null ? style.getListLevel() : (int) FeatureVector.UNKNOWN_NUMBER);
        f.put(FeatureVector.IN_LIST, style.getListLevel() != null);
        TableRef table = unit.getTableRef();
        boolean inTable = table != null || unit.getKind() == StructuralUnit.Kind.TABLE_CELL;
        f.put(FeatureVector.IN_TABLE, inTable);
        f.put(FeatureVector.TABLE_ROW, table != null ? table.getRow() : (int) FeatureVector.UNKNOWN_NUMBER);
        f.put(FeatureVector.TABLE_COL, table != null ? table.getCol() : (int) FeatureVector.UNKNOWN_NUMBER);

        // 5. 相对特征
        double size = sizeOf(style);
        StructuralUnit prev = context.previous();
        double prevSize = prev != null ? sizeOf(prev.getStyle()) : FeatureVector.UNKNOWN_NUMBER;
        f.put(FeatureVector.FONT_SIZE_DELTA_PREV,
                size != FeatureVector.UNKNOWN_NUMBER && prevSize != FeatureVector.UNKNOWN_NUMBER ? size - prevSize : 0.0);
        f.put(FeatureVector.LARGER_THAN_CONTEXT, largerThanContext(size, context));
        f.put(FeatureVector.SAME_STYLE_AS_PREV, prev != null && style.getStyleId() != null
                && Objects.equals(style.getStyleId(), prev.getStyle().getStyleId()));

        return new FeatureVector(f);
    }

    // ==================== 私有辅助 ====================

    /**
     * 轻量归一化：去首尾空白、合并内部空白（不改大小写，标题启发式需要保留）
     */
    static String normalize(String s) {
        if (s == null) return "";
        String t = s.trim();
        return t.isEmpty() ? t : WS.matcher(t).replaceAll(" ");
    }

    private static String orUnknown(String s) {
        return s == null || s.trim().isEmpty() ? FeatureVector.UNKNOWN : s;
    }

    private static double sizeOf(StyleMeta style) {
        Double size = style.getFontSize();
        return size != null && size > 0 ? size : FeatureVector.UNKNOWN_NUMBER;
    }

    private static boolean largerThanContext(double size, ContextWindow<StructuralUnit> context) {
        if (size == FeatureVector.UNKNOWN_NUMBER) {
            return false;
        }
        double max = FeatureVector.UNKNOWN_NUMBER;
        for (StructuralUnit u : context.all()) {
            max = Math.max(max, sizeOf(u.getStyle()));
        }
        return max != FeatureVector.UNKNOWN_NUMBER && size >= max + 1.0;
    }

    private static String detectBullet(String s) {
        Matcher m = BULLET.matcher(s);
        if (!m.find()) {
            return null;
        }
        String glyph = m.group(1);
        // "-3.5" 这类负数不算项目符号
        String tail = s.substring(m.end());
        if ("-–—*".contains(glyph) && !tail.isEmpty() && Character.isDigit(tail.charAt(0))) {
            return null;
        }
        return glyph;
    }

    private static String detectNumbering(String s) {
        for (Pattern p : NUMBERING) {
            Matcher m = p.matcher(s);
            if (m.find()) {
                return m.group(1).trim();
            }
        }
        return null;
    }

    private static int count(Matcher m) {
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static double uppercaseRatio(String s) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) upper++;
            }
        }
        return letters == 0 ? 0.0 : upper / (double) letters;
    }

    private static double titlecaseRate(String[] tokens) {
        int alpha = 0;
        int title = 0;
        for (String t : tokens) {
            String core = t.replaceAll("^\\p{Punct}+|\\p{Punct}+$", "");
            if (core.chars().noneMatch(Character::isLetter)) continue;
            alpha++;
            if (core.length() >= 2 && Character.isUpperCase(core.charAt(0))
                    && core.substring(1).equals(core.substring(1).toLowerCase(Locale.ROOT))) {
                title++;
            }
        }
        return alpha == 0 ? 0.0 : title / (double) alpha;
    }

    private interface CharTest {
        boolean test(char c);
    }

    private static double ratio(String s, CharTest test) {
        if (s == null || s.isEmpty()) return 0.0;
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (test.test(s.charAt(i))) n++;
        }
        return n / (double) s.length();
    }

    private static boolean isPunct(char c) {
        return (c < 128 && !Character.isLetterOrDigit(c) && !Character.isWhitespace(c) && !Character.isISOControl(c))
                || EXTRA_PUNCT.indexOf(c) >= 0;
    }

    private static int leadingSpaces(String raw) {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ' || c == '\u00A0') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }
}
