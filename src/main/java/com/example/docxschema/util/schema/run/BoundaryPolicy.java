package com.example.docxschema.util.schema.run;

/**
 * 可重复槽位吃块时的边界策略
 */
public enum BoundaryPolicy {
    /** 空行与显式分隔行都视为边界 */
    BLANK_LINE,
    /** 只有显式分隔行（默认 "---"）才是边界，空行不拆分 */
    EXPLICIT_MARKER;

    public boolean splitsAt(ContentBlock.Boundary boundary) {
        if (boundary == null || boundary == ContentBlock.Boundary.NONE) {
            return false;
        }
        if (this == EXPLICIT_MARKER) {
            return boundary == ContentBlock.Boundary.EXPLICIT;
        }
        return true;
    }
}
