package com.minisql.parser;

/**
 * ParseIssue - 解析时遇到的无法理解的结构
 *
 * 解析器只记录,不抛异常。
 */
public class ParseIssue {

    private final String message;

    /** 出错位置附近的单词(可能为null) */
    private final String near;

    public ParseIssue(String message, String near) {
        this.message = message;
        this.near = near;
    }

    public String getMessage() {
        return message;
    }

    public String getNear() {
        return near;
    }

    @Override
    public String toString() {
        return near == null ? message : message + " near '" + near + "'";
    }
}
