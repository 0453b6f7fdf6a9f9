package com.minisql.parser;

import com.minisql.parser.Token.TokenType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ClauseScanner - 顶层子句切分
 *
 * 在括号深度为baseDepth的Token上寻找子句关键字,把SELECT语句切成
 * SELECT / FROM / WHERE / GROUP BY / HAVING / ORDER BY / LIMIT / UNION 各段。
 *
 * 同时提供按顶层逗号、顶层AND切分的工具方法。
 */
final class ClauseScanner {

    /**
     * 子句类型(声明顺序即SQL要求的书写顺序)
     */
    enum Clause {
        SELECT,
        FROM,
        WHERE,
        GROUP_BY,
        HAVING,
        ORDER_BY,
        LIMIT,
        UNION
    }

    private final Map<Clause, List<Token>> bodies = new EnumMap<>(Clause.class);

    private final Map<Clause, Token> keywords = new EnumMap<>(Clause.class);

    private final List<ParseIssue> issues = new ArrayList<>();

    private ClauseScanner() {
    }

    /**
     * 切分SELECT语句
     *
     * @param tokens 语句Token(不含EOF和末尾分号,第一个Token为SELECT)
     */
    static ClauseScanner scan(List<Token> tokens) {
        ClauseScanner scanner = new ClauseScanner();
        int baseDepth = tokens.isEmpty() ? 0 : tokens.get(0).getDepth();

        Clause current = Clause.SELECT;
        scanner.keywords.put(Clause.SELECT, tokens.get(0));
        List<Token> body = new ArrayList<>();

        for (int i = 1; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Clause next = null;
            int width = 1;

            if (token.getDepth() == baseDepth && token.is(TokenType.WORD) && current != Clause.UNION) {
                switch (token.upper()) {
                    case "FROM":
                        next = Clause.FROM;
                        break;
                    case "WHERE":
                        next = Clause.WHERE;
                        break;
                    case "GROUP":
                        if (isBy(tokens, i + 1)) {
                            next = Clause.GROUP_BY;
                            width = 2;
                        }
                        break;
                    case "HAVING":
                        next = Clause.HAVING;
                        break;
                    case "ORDER":
                        if (isBy(tokens, i + 1)) {
                            next = Clause.ORDER_BY;
                            width = 2;
                        }
                        break;
                    case "LIMIT":
                        next = Clause.LIMIT;
                        break;
                    case "UNION":
                        next = Clause.UNION;
                        break;
                    default:
                        break;
                }
            }

            if (next == null) {
                body.add(token);
                continue;
            }

            scanner.bodies.put(current, body);
            if (scanner.keywords.containsKey(next)) {
                scanner.issues.add(new ParseIssue("Duplicate " + label(next) + " clause", token.getText()));
            } else if (next.ordinal() < current.ordinal()) {
                scanner.issues.add(new ParseIssue(label(next) + " clause must come before "
                        + label(current), token.getText()));
            }
            scanner.keywords.put(next, token);
            current = next;
            body = new ArrayList<>();
            i += width - 1;
        }
        scanner.bodies.put(current, body);
        return scanner;
    }

    private static boolean isBy(List<Token> tokens, int index) {
        return index < tokens.size() && tokens.get(index).isKeyword("BY");
    }

    static String label(Clause clause) {
        return clause.name().replace('_', ' ');
    }

    boolean has(Clause clause) {
        return bodies.containsKey(clause);
    }

    List<Token> body(Clause clause) {
        return bodies.getOrDefault(clause, List.of());
    }

    Token keyword(Clause clause) {
        return keywords.get(clause);
    }

    List<ParseIssue> getIssues() {
        return issues;
    }

    // ==================== 切分工具 ====================

    /**
     * 按顶层逗号切分
     */
    static List<List<Token>> splitOnCommas(List<Token> tokens) {
        List<List<Token>> parts = new ArrayList<>();
        if (tokens.isEmpty()) {
            return parts;
        }
        int baseDepth = minDepth(tokens);
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            if (token.is(TokenType.COMMA) && token.getDepth() == baseDepth) {
                parts.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        parts.add(current);
        return parts;
    }

    /**
     * 按顶层AND切分谓词列表,BETWEEN ... AND ... 中的AND不切分
     *
     * @return 切分结果;出现顶层OR时返回null
     */
    static List<List<Token>> splitOnAnd(List<Token> tokens) {
        List<List<Token>> parts = new ArrayList<>();
        if (tokens.isEmpty()) {
            return parts;
        }
        int baseDepth = minDepth(tokens);
        List<Token> current = new ArrayList<>();
        boolean pendingBetween = false;
        for (Token token : tokens) {
            if (token.getDepth() == baseDepth && token.is(TokenType.WORD)) {
                if (token.isKeyword("OR")) {
                    return null;
                }
                if (token.isKeyword("BETWEEN")) {
                    pendingBetween = true;
                } else if (token.isKeyword("AND")) {
                    if (pendingBetween) {
                        pendingBetween = false;
                    } else {
                        parts.add(current);
                        current = new ArrayList<>();
                        continue;
                    }
                }
            }
            current.add(token);
        }
        parts.add(current);
        return parts;
    }

    /**
     * 如果整个片段被一对括号包裹,返回括号内的Token;否则返回null
     */
    static List<Token> unwrapParentheses(List<Token> tokens) {
        if (tokens.size() < 2) {
            return null;
        }
        Token first = tokens.get(0);
        Token last = tokens.get(tokens.size() - 1);
        if (!first.is(TokenType.LEFT_PAREN) || !last.is(TokenType.RIGHT_PAREN)) {
            return null;
        }
        for (int i = 1; i < tokens.size() - 1; i++) {
            if (tokens.get(i).is(TokenType.RIGHT_PAREN) && tokens.get(i).getDepth() == first.getDepth()) {
                return null;
            }
        }
        return tokens.subList(1, tokens.size() - 1);
    }

    private static int minDepth(List<Token> tokens) {
        int min = Integer.MAX_VALUE;
        for (Token token : tokens) {
            min = Math.min(min, token.getDepth());
        }
        return min;
    }
}
