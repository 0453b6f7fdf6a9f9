package com.minisql.parser;

import com.minisql.parser.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * SqlTokenizer - 手写词法分析器
 *
 * 把SQL文本切成Token序列,同时记录括号深度。
 *
 * 设计原则:
 * - 永不抛异常: 未闭合的字符串吞掉剩余输入并标记为未闭合,未知字符作为单字符运算符
 * - 注释(-- 行注释, /* 块注释 *&#47;)被跳过
 * - 反引号标识符作为普通WORD
 * - 序列以EOF结尾
 */
public final class SqlTokenizer {

    private SqlTokenizer() {
    }

    /**
     * 词法分析
     *
     * @param sql SQL文本
     * @return Token列表(以EOF结尾)
     */
    public static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        if (sql == null) {
            tokens.add(new Token(TokenType.EOF, "", 0, 0, 0));
            return tokens;
        }

        int depth = 0;
        int i = 0;
        int length = sql.length();

        while (i < length) {
            char c = sql.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // 行注释
            if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                while (i < length && sql.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            // 块注释
            if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
                continue;
            }

            int start = i;

            if (c == '\'' || c == '"') {
                StringBuilder content = new StringBuilder();
                boolean closed = false;
                i++;
                while (i < length) {
                    char ch = sql.charAt(i);
                    if (ch == c) {
                        if (i + 1 < length && sql.charAt(i + 1) == c) {
                            content.append(c);
                            i += 2;
                            continue;
                        }
                        i++;
                        closed = true;
                        break;
                    }
                    if (ch == '\\' && i + 1 < length) {
                        content.append(sql.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    content.append(ch);
                    i++;
                }
                tokens.add(new Token(TokenType.STRING, content.toString(), start, i, depth, closed));
                continue;
            }

            if (c == '`') {
                int close = sql.indexOf('`', i + 1);
                int end = close < 0 ? length : close;
                tokens.add(new Token(TokenType.WORD, sql.substring(i + 1, end), start,
                        close < 0 ? length : close + 1, depth, close >= 0));
                i = close < 0 ? length : close + 1;
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && i + 1 < length && Character.isDigit(sql.charAt(i + 1))
                    && !previousIsWord(tokens))) {
                i++;
                boolean seenDot = c == '.';
                while (i < length) {
                    char ch = sql.charAt(i);
                    if (Character.isDigit(ch)) {
                        i++;
                    } else if (ch == '.' && !seenDot && i + 1 < length && Character.isDigit(sql.charAt(i + 1))) {
                        seenDot = true;
                        i++;
                    } else {
                        break;
                    }
                }
                tokens.add(new Token(TokenType.NUMBER, sql.substring(start, i), start, i, depth));
                continue;
            }

            if (Character.isLetter(c) || c == '_' || c == '$') {
                i++;
                while (i < length) {
                    char ch = sql.charAt(i);
                    if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '$') {
                        i++;
                    } else {
                        break;
                    }
                }
                tokens.add(new Token(TokenType.WORD, sql.substring(start, i), start, i, depth));
                continue;
            }

            switch (c) {
                case '(':
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", start, i + 1, depth));
                    depth++;
                    i++;
                    continue;
                case ')':
                    depth = Math.max(0, depth - 1);
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", start, i + 1, depth));
                    i++;
                    continue;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ",", start, i + 1, depth));
                    i++;
                    continue;
                case '.':
                    tokens.add(new Token(TokenType.DOT, ".", start, i + 1, depth));
                    i++;
                    continue;
                case '*':
                    tokens.add(new Token(TokenType.STAR, "*", start, i + 1, depth));
                    i++;
                    continue;
                case ';':
                    tokens.add(new Token(TokenType.SEMICOLON, ";", start, i + 1, depth));
                    i++;
                    continue;
                default:
                    break;
            }

            String twoChars = i + 1 < length ? sql.substring(i, i + 2) : "";
            if (twoChars.equals("<=") || twoChars.equals(">=") || twoChars.equals("<>")
                    || twoChars.equals("!=") || twoChars.equals("||")) {
                tokens.add(new Token(TokenType.OPERATOR, twoChars, start, i + 2, depth));
                i += 2;
                continue;
            }

            tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), start, i + 1, depth));
            i++;
        }

        tokens.add(new Token(TokenType.EOF, "", length, length, depth));
        return tokens;
    }

    /**
     * 前一个Token是否为标识符(e.name 中的 .name 不是小数)
     */
    private static boolean previousIsWord(List<Token> tokens) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.WORD);
    }
}
