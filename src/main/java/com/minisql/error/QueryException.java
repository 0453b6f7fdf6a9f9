package com.minisql.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * QueryException - 查询异常基类
 *
 * 所有引擎错误都是QueryException,携带结构化信息返回给调用方:
 * - message: 错误描述
 * - suggestion: "Did you mean ..." 形式的修复建议(可能为null)
 * - severity: 严重程度(info/warning/error)
 * - context: 结构化上下文(表名、列名、可用候选等)
 *
 * 设计原则:
 * - "Good taste": 所有错误同一种形状,调用方不需要instanceof判断就能展示
 * - 错误处理直接暴露,而不是被掩盖
 */
public class QueryException extends RuntimeException {

    /** 修复建议 */
    private final String suggestion;

    /** 严重程度 */
    private final ErrorSeverity severity;

    /** 结构化上下文 */
    private final Map<String, Object> context;

    public QueryException(String message, String suggestion, ErrorSeverity severity,
                          Map<String, Object> context) {
        super(message);
        this.suggestion = suggestion;
        this.severity = severity != null ? severity : ErrorSeverity.ERROR;
        this.context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
        this.suggestion = null;
        this.severity = ErrorSeverity.ERROR;
        this.context = Map.of();
    }

    public String getSuggestion() {
        return suggestion;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", suggestion='" + suggestion + '\'' +
                ", severity=" + severity.label() +
                '}';
    }
}
