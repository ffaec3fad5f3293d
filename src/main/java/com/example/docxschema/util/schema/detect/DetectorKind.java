package com.example.docxschema.util.schema.detect;

/**
 * 检测器种类（固定的角色标签集合）
 *
 * 新增角色 = 新增一个枚举值 + 在 DetectorRegistry 中登记一个检测器，不需要继承。
 */
public enum DetectorKind {
    TITLE,
    HEADING,
    BODY,
    LIST_ITEM,
    TABLE_CELL,
    DATE_LINE,
    CONTACT_LINE,
    SALUTATION,
    CLOSING,
    SIGNATURE_BLOCK,
    CLAUSE,
    CALLOUT
}
