package com.minisql.error;

/**
 * ErrorSeverity - 错误严重程度
 */
public enum ErrorSeverity {
    /** 提示(如空查询) */
    INFO,
    /** 警告(如不支持的特性) */
    WARNING,
    /** 错误 */
    ERROR;

    public String label() {
        return name().toLowerCase();
    }
}
