package com.example.docxschema.util.schema.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 新内容的一个文本块
 *
 * boundary 表示该块之前是否有分隔（空行或显式分隔行）。
 */
public final class ContentBlock {

    public enum Boundary {
        NONE,
        BLANK_LINE,
        EXPLICIT
    }

    private final int index;
    private final String text;
    private final Boundary boundary;

    @JsonCreator
    public ContentBlock(@JsonProperty("index") int index,
                        @JsonProperty("text") String text,
                        @JsonProperty("boundary") Boundary boundary) {
        this.index = index;
        this.text = text != null ? text : "";
        this.boundary = boundary != null ? boundary : Boundary.NONE;
    }

    public static ContentBlock of(int index, String text) {
        return new ContentBlock(index, text, Boundary.NONE);
    }

    @JsonProperty("index")
    public int getIndex() { return index; }

    @JsonProperty("text")
    public String getText() { return text; }

    @JsonProperty("boundary")
    public Boundary getBoundary() { return boundary; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentBlock)) return false;
        ContentBlock that = (ContentBlock) o;
        return index == that.index && text.equals(that.text) && boundary == that.boundary;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, text, boundary);
    }

    @Override
    public String toString() {
        return index + (boundary == Boundary.NONE ? "" : "|" + boundary) + ":" + text;
    }
}
