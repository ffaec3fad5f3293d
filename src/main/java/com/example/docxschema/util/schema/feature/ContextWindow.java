package com.example.docxschema.util.schema.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 上下文窗口：当前元素前后各 k 个邻居
 *
 * before 按文档顺序排列（最后一个元素紧邻当前元素），after 同样按文档顺序排列（第一个元素紧邻当前元素）。
 *
 * @param <T> 元素类型（StructuralUnit 或 FeatureVector）
 */
public final class ContextWindow<T> {

    private final List<T> before;
    private final List<T> after;

    public ContextWindow(List<T> before, List<T> after) {
        this.before = Collections.unmodifiableList(new ArrayList<>(before));
        this.after = Collections.unmodifiableList(new ArrayList<>(after));
    }

    public static <T> ContextWindow<T> empty() {
        return new ContextWindow<>(Collections.<T>emptyList(), Collections.<T>emptyList());
    }

    /**
     * 从序列中截取第 i 个元素的窗口
     */
    public static <T> ContextWindow<T> around(List<T> sequence, int i, int k) {
        int from = Math.max(0, i - k);
        int to = Math.min(sequence.size(), i + k + 1);
        return new ContextWindow<>(sequence.subList(from, i), sequence.subList(Math.min(i + 1, to), to));
    }

    public List<T> getBefore() { return before; }
    public List<T> getAfter() { return after; }

    /**
     * 紧邻的前一个元素，不存在时返回 null
     */
    public T previous() {
        return before.isEmpty() ? null : before.get(before.size() - 1);
    }

    /**
     * 紧邻的后一个元素，不存在时返回 null
     */
    public T next() {
        return after.isEmpty() ? null : after.get(0);
    }

    public List<T> all() {
        List<T> all = new ArrayList<>(before);
        all.addAll(after);
        return all;
    }
}
