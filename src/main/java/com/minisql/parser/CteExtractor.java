package com.minisql.parser;

import com.minisql.parser.Token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CteExtractor - WITH前缀提取器
 *
 * 把 WITH [RECURSIVE] name [(cols)] AS (...), name2 AS (...) main_query
 * 切分成CTE定义列表和主查询文本。
 *
 * 每个CTE的查询体由与AS后左括号深度相同的右括号结束,
 * 嵌套的子查询、函数调用和IN列表因此不会提前截断查询体。
 *
 * 一个CTE被认为引用自身,当且仅当使用了RECURSIVE关键字,
 * 并且它的名字作为标识符出现在自己的查询体里。
 *
 * 不检查CTE之间的引用顺序,前向引用由执行器报告。
 */
public final class CteExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CteExtractor.class);

    private CteExtractor() {
    }

    /**
     * 提取CTE
     *
     * @param sql 以WITH开头的SQL
     * @return 提取结果(从不抛异常)
     */
    public static Extraction extract(String sql) {
        List<Token> tokens = SqlTokenizer.tokenize(sql);
        List<CteDefinition> ctes = new ArrayList<>();
        List<ParseIssue> issues = new ArrayList<>();

        int i = 0;
        if (tokens.get(i).isKeyword("WITH")) {
            i++;
        }
        boolean recursive = tokens.get(i).isKeyword("RECURSIVE");
        if (recursive) {
            i++;
        }

        while (true) {
            Token name = tokens.get(i);
            if (!name.is(TokenType.WORD) || ExpressionParser.isReserved(name.getText())) {
                issues.add(new ParseIssue("Expected a CTE name", textOf(name)));
                break;
            }
            i++;

            // 可选的显式列名
            List<String> columns = new ArrayList<>();
            if (tokens.get(i).is(TokenType.LEFT_PAREN)) {
                int depth = tokens.get(i).getDepth();
                i++;
                while (!tokens.get(i).is(TokenType.EOF)
                        && !(tokens.get(i).is(TokenType.RIGHT_PAREN) && tokens.get(i).getDepth() == depth)) {
                    if (tokens.get(i).is(TokenType.WORD)) {
                        columns.add(tokens.get(i).getText().toLowerCase(Locale.ROOT));
                    }
                    i++;
                }
                if (!tokens.get(i).is(TokenType.EOF)) {
                    i++;
                }
            }

            if (!tokens.get(i).isKeyword("AS")) {
                issues.add(new ParseIssue("Expected AS after CTE name '" + name.getText() + "'",
                        textOf(tokens.get(i))));
                break;
            }
            i++;

            Token open = tokens.get(i);
            if (!open.is(TokenType.LEFT_PAREN)) {
                issues.add(new ParseIssue("Expected '(' after AS in CTE '" + name.getText() + "'",
                        textOf(open)));
                break;
            }
            int bodyStart = i + 1;
            int close = bodyStart;
            while (!tokens.get(close).is(TokenType.EOF)
                    && !(tokens.get(close).is(TokenType.RIGHT_PAREN) && tokens.get(close).getDepth() == open.getDepth())) {
                close++;
            }

            String cteName = name.getText().toLowerCase(Locale.ROOT);
            int bodyEnd = tokens.get(close).getStart();
            String body = sql.substring(open.getEnd(), bodyEnd).trim();
            boolean selfReferencing = false;
            if (recursive) {
                for (int k = bodyStart; k < close; k++) {
                    if (tokens.get(k).is(TokenType.WORD) && tokens.get(k).getText().equalsIgnoreCase(cteName)) {
                        selfReferencing = true;
                        break;
                    }
                }
            }
            ctes.add(new CteDefinition(cteName, body, columns, selfReferencing));
            logger.debug("Extracted CTE '{}' (self-referencing: {})", cteName, selfReferencing);

            if (tokens.get(close).is(TokenType.EOF)) {
                issues.add(new ParseIssue("Missing ')' to close CTE '" + name.getText() + "'", null));
                i = close;
                break;
            }
            i = close + 1;

            if (tokens.get(i).is(TokenType.COMMA)) {
                i++;
                continue;
            }
            break;
        }

        Token mainStart = tokens.get(i);
        String mainQuery = mainStart.is(TokenType.EOF) ? "" : sql.substring(mainStart.getStart()).trim();
        if (mainQuery.isEmpty() && issues.isEmpty()) {
            issues.add(new ParseIssue("Expected a SELECT after the WITH clause", null));
        }
        return new Extraction(ctes, mainQuery, recursive, issues);
    }

    private static String textOf(Token token) {
        return token.is(TokenType.EOF) ? null : token.getText();
    }

    /**
     * 提取结果
     */
    public static final class Extraction {

        private final List<CteDefinition> ctes;

        private final String mainQuery;

        private final boolean recursive;

        private final List<ParseIssue> issues;

        Extraction(List<CteDefinition> ctes, String mainQuery, boolean recursive, List<ParseIssue> issues) {
            this.ctes = List.copyOf(ctes);
            this.mainQuery = mainQuery;
            this.recursive = recursive;
            this.issues = List.copyOf(issues);
        }

        public List<CteDefinition> getCtes() {
            return ctes;
        }

        public String getMainQuery() {
            return mainQuery;
        }

        public boolean isRecursive() {
            return recursive;
        }

        public List<ParseIssue> getIssues() {
            return issues;
        }
    }
}
