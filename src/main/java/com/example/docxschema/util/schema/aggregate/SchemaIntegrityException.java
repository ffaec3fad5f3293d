package com.example.docxschema.util.schema.aggregate;

/**
 * Schema 完整性错误：顺序/基数不变量被流水线自身破坏
 *
 * 表示内部逻辑缺陷而不是输入问题，不做静默修正，直接中止构建。
 */
public class SchemaIntegrityException extends RuntimeException {

    public SchemaIntegrityException(String message) {
        super(message);
    }
}
