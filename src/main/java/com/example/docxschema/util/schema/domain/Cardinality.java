package com.example.docxschema.util.schema.domain;

/**
 * 角色基数
 */
public enum Cardinality {
    /** 必须且只能出现一次（唯一的"必需"基数） */
    EXACTLY_ONE,
    /** 可缺省，至多一次 */
    OPTIONAL,
    /** 可缺省，可多次 */
    REPEATABLE;

    public boolean isRequired() {
        return this == EXACTLY_ONE;
    }
}
