package com.minisql.parser;

import com.minisql.parser.ClauseScanner.Clause;
import com.minisql.parser.ExpressionParser.ParseFailure;
import com.minisql.parser.Token.TokenType;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.FunctionExpression;
import com.minisql.parser.expressions.Operator;
import com.minisql.parser.expressions.UnparsedExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * SQLParser - SQL解析器对外接口
 *
 * 把SQL字符串解析成ParsedQuery。
 *
 * 处理流程:
 * 1. 剥离WITH [RECURSIVE]前缀(CteExtractor)
 * 2. 按首个关键字分类语句类型
 * 3. 按顶层关键字切分子句(ClauseScanner)
 * 4. 逐个子句解析: 表和JOIN、SELECT列表、WHERE、GROUP BY、HAVING、ORDER BY、LIMIT
 *
 * 设计原则:
 * - 简单的接口: 一个方法 parse(String sql)
 * - 纯函数,没有副作用
 * - 永不抛异常: 看不懂的结构记录为ParseIssue,超出可执行子集的结构记录为
 *   UnsupportedFeature,由执行器统一转换成错误
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * ParsedQuery query = parser.parse("SELECT name FROM employees WHERE salary > 50000");
 * query.getTables();          // [employees]
 * query.getWhereConditions(); // [salary &gt; 50000]
 * </pre>
 */
public class SQLParser {

    private static final Logger logger = LoggerFactory.getLogger(SQLParser.class);

    /** 结束FROM表引用的关键字 */
    private static final Set<String> JOIN_KEYWORDS = Set.of(
            "JOIN", "INNER", "LEFT", "RIGHT", "CROSS", "FULL", "NATURAL", "OUTER", "ON", "USING");

    private static final String SUBQUERY_ALTERNATIVE =
            "Rewrite the subquery as a JOIN, or move it into a CTE: WITH t AS (...) SELECT ... FROM t";

    /**
     * 解析SQL字符串
     *
     * @param sql SQL语句
     * @return 解析结果(空输入返回UNKNOWN类型的空查询)
     */
    public ParsedQuery parse(String sql) {
        ParsedQuery.Builder builder = ParsedQuery.builder().rawQuery(sql == null ? "" : sql);
        if (sql == null || sql.trim().isEmpty()) {
            return builder.build();
        }

        String text = sql.trim();
        String mainQuery = text;

        List<Token> tokens = SqlTokenizer.tokenize(text);
        for (Token token : tokens) {
            if (!token.isClosed()) {
                String near = text.substring(token.getStart(), Math.min(token.getEnd(), token.getStart() + 20));
                builder.issue(token.is(TokenType.STRING)
                        ? "Unterminated string literal" : "Missing closing backtick", near);
            }
        }

        if (tokens.get(0).isKeyword("WITH")) {
            CteExtractor.Extraction extraction = CteExtractor.extract(text);
            builder.ctes(extraction.getCtes()).recursive(extraction.isRecursive());
            for (ParseIssue issue : extraction.getIssues()) {
                builder.issue(issue.getMessage(), issue.getNear());
            }
            mainQuery = extraction.getMainQuery();
        }
        builder.mainQuery(mainQuery);

        parseStatement(mainQuery, builder);
        ParsedQuery parsed = builder.build();
        logger.debug("Parsed query: {}", parsed);
        return parsed;
    }

    private void parseStatement(String sql, ParsedQuery.Builder builder) {
        List<Token> tokens = statementTokens(sql, builder);
        if (tokens.isEmpty()) {
            return;
        }

        Token first = tokens.get(0);
        QueryType type = first.is(TokenType.WORD) ? QueryType.fromKeyword(first.getText()) : QueryType.UNKNOWN;
        builder.queryType(type);
        if (type == QueryType.UNKNOWN) {
            builder.issue("Unrecognized statement", first.getText());
            return;
        }
        if (type != QueryType.SELECT) {
            return;
        }

        detectUnsupportedTokens(tokens, builder);

        ClauseScanner scanner = ClauseScanner.scan(tokens);
        for (ParseIssue issue : scanner.getIssues()) {
            builder.issue(issue.getMessage(), issue.getNear());
        }
        if (scanner.has(Clause.UNION)) {
            builder.unsupported("UNION in the main query",
                    "Run the SELECT statements separately, or combine them inside a CTE");
        }

        parseFrom(sql, scanner.body(Clause.FROM), scanner.has(Clause.FROM), builder);
        parseSelectList(sql, scanner.body(Clause.SELECT), builder);
        if (scanner.has(Clause.WHERE)) {
            parseConditions(sql, scanner.body(Clause.WHERE), "WHERE", builder, false);
        }
        if (scanner.has(Clause.GROUP_BY)) {
            parseGroupBy(sql, scanner.body(Clause.GROUP_BY), builder);
        }
        if (scanner.has(Clause.HAVING)) {
            parseConditions(sql, scanner.body(Clause.HAVING), "HAVING", builder, true);
        }
        if (scanner.has(Clause.ORDER_BY)) {
            parseOrderBy(sql, scanner.body(Clause.ORDER_BY), builder);
        }
        if (scanner.has(Clause.LIMIT)) {
            parseLimit(scanner.body(Clause.LIMIT), scanner.keyword(Clause.LIMIT), builder);
        }
    }

    /**
     * 语句Token: 去掉EOF和末尾分号;分号之后还有内容时记为多语句
     */
    private List<Token> statementTokens(String sql, ParsedQuery.Builder builder) {
        List<Token> all = SqlTokenizer.tokenize(sql);
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            Token token = all.get(i);
            if (token.is(TokenType.EOF)) {
                break;
            }
            if (token.is(TokenType.SEMICOLON)) {
                boolean trailing = true;
                for (int k = i + 1; k < all.size(); k++) {
                    if (!all.get(k).is(TokenType.SEMICOLON) && !all.get(k).is(TokenType.EOF)) {
                        trailing = false;
                        break;
                    }
                }
                if (!trailing) {
                    builder.unsupported("Multiple statements", "Run one statement at a time");
                }
                break;
            }
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * 扫描整条语句中不能执行的结构: 子查询、CASE、窗口函数
     */
    private void detectUnsupportedTokens(List<Token> tokens, ParsedQuery.Builder builder) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.LEFT_PAREN) && i + 1 < tokens.size() && tokens.get(i + 1).isKeyword("SELECT")) {
                builder.unsupported("Subqueries", SUBQUERY_ALTERNATIVE);
            } else if (token.isKeyword("EXISTS")) {
                builder.unsupported("Subqueries", SUBQUERY_ALTERNATIVE);
            } else if (token.isKeyword("CASE")) {
                builder.unsupported("CASE expressions",
                        "Filter the rows with WHERE and run one query per case");
            } else if (token.isKeyword("OVER")) {
                builder.unsupported("Window functions",
                        "Use GROUP BY with aggregate functions instead");
            }
        }
    }

    // ==================== FROM / JOIN ====================

    private void parseFrom(String sql, List<Token> tokens, boolean present, ParsedQuery.Builder builder) {
        if (!present) {
            return;
        }
        if (tokens.isEmpty()) {
            builder.issue("Missing table name after FROM", null);
            return;
        }
        if (tokens.get(0).is(TokenType.LEFT_PAREN)) {
            builder.unsupported("Subqueries", SUBQUERY_ALTERNATIVE);
            return;
        }

        int[] cursor = {0};
        String[] reference = readTableReference(tokens, cursor, builder);
        if (reference == null) {
            return;
        }
        builder.table(reference[0]);
        if (reference[1] != null) {
            builder.fromAlias(reference[1].toLowerCase());
            builder.alias(reference[1], reference[0]);
        }

        while (cursor[0] < tokens.size()) {
            Token token = tokens.get(cursor[0]);
            JoinClause.JoinType joinType;

            if (token.is(TokenType.COMMA)) {
                cursor[0]++;
                joinType = JoinClause.JoinType.CROSS;
            } else {
                joinType = readJoinType(tokens, cursor, builder);
                if (joinType == null) {
                    return;
                }
            }

            String[] target = readTableReference(tokens, cursor, builder);
            if (target == null) {
                return;
            }

            // ON条件: 直到下一个JOIN关键字或逗号
            ColumnExpression left = null;
            ColumnExpression right = null;
            String onText = null;
            if (cursor[0] < tokens.size() && tokens.get(cursor[0]).isKeyword("USING")) {
                builder.unsupported("JOIN ... USING", "Use ON a.column = b.column");
                return;
            }
            if (cursor[0] < tokens.size() && tokens.get(cursor[0]).isKeyword("ON")) {
                cursor[0]++;
                int start = cursor[0];
                while (cursor[0] < tokens.size() && !startsJoin(tokens.get(cursor[0]))) {
                    cursor[0]++;
                }
                List<Token> onTokens = tokens.subList(start, cursor[0]);
                if (onTokens.isEmpty()) {
                    builder.issue("Missing JOIN condition after ON", target[0]);
                    return;
                }
                onText = text(sql, onTokens);
                ColumnExpression[] columns = parseJoinCondition(sql, onTokens, builder);
                if (columns != null) {
                    left = columns[0];
                    right = columns[1];
                }
            }

            builder.table(target[0]);
            if (target[1] != null) {
                builder.alias(target[1], target[0]);
            }
            JoinClause.JoinType effective = left == null && onText == null ? JoinClause.JoinType.CROSS : joinType;
            builder.join(new JoinClause(effective, target[0].toLowerCase(),
                    target[1] != null ? target[1].toLowerCase() : null, left, right, onText));
        }
    }

    private boolean startsJoin(Token token) {
        if (token.is(TokenType.COMMA) && token.getDepth() == 0) {
            return true;
        }
        return token.getDepth() == 0 && token.is(TokenType.WORD)
                && JOIN_KEYWORDS.contains(token.upper()) && !token.isKeyword("ON");
    }

    /**
     * 读取 [INNER|LEFT [OUTER]|RIGHT [OUTER]|CROSS] JOIN
     */
    private JoinClause.JoinType readJoinType(List<Token> tokens, int[] cursor, ParsedQuery.Builder builder) {
        Token token = tokens.get(cursor[0]);
        JoinClause.JoinType type;
        switch (token.upper()) {
            case "JOIN":
                cursor[0]++;
                return JoinClause.JoinType.INNER;
            case "INNER":
                type = JoinClause.JoinType.INNER;
                break;
            case "LEFT":
                type = JoinClause.JoinType.LEFT;
                break;
            case "RIGHT":
                type = JoinClause.JoinType.RIGHT;
                break;
            case "CROSS":
                type = JoinClause.JoinType.CROSS;
                break;
            case "FULL":
                builder.unsupported("FULL OUTER JOIN", "Combine the results of a LEFT JOIN and a RIGHT JOIN");
                return null;
            case "NATURAL":
                builder.unsupported("NATURAL JOIN", "Use an explicit JOIN ... ON a.column = b.column");
                return null;
            default:
                builder.issue("Unexpected token in FROM clause", token.getText());
                return null;
        }
        cursor[0]++;
        if (cursor[0] < tokens.size() && tokens.get(cursor[0]).isKeyword("OUTER")) {
            cursor[0]++;
        }
        if (cursor[0] >= tokens.size() || !tokens.get(cursor[0]).isKeyword("JOIN")) {
            builder.issue("Expected JOIN", cursor[0] < tokens.size() ? tokens.get(cursor[0]).getText() : token.getText());
            return null;
        }
        cursor[0]++;
        return type;
    }

    /**
     * 读取 table [[AS] alias]
     *
     * @return [表名, 别名(可能为null)],失败返回null
     */
    private String[] readTableReference(List<Token> tokens, int[] cursor, ParsedQuery.Builder builder) {
        if (cursor[0] >= tokens.size()) {
            builder.issue("Missing table name", null);
            return null;
        }
        Token table = tokens.get(cursor[0]);
        if (table.is(TokenType.LEFT_PAREN)) {
            builder.unsupported("Subqueries", SUBQUERY_ALTERNATIVE);
            return null;
        }
        if (!table.is(TokenType.WORD) || ExpressionParser.isReserved(table.getText())) {
            builder.issue("Expected a table name", table.getText());
            return null;
        }
        cursor[0]++;

        String tableName = table.getText();
        // schema.table: 只保留表名
        while (cursor[0] + 1 < tokens.size() && tokens.get(cursor[0]).is(TokenType.DOT)
                && tokens.get(cursor[0] + 1).is(TokenType.WORD)) {
            tableName = tokens.get(cursor[0] + 1).getText();
            cursor[0] += 2;
        }

        String alias = null;
        if (cursor[0] < tokens.size() && tokens.get(cursor[0]).isKeyword("AS")) {
            cursor[0]++;
            if (cursor[0] >= tokens.size() || !tokens.get(cursor[0]).is(TokenType.WORD)) {
                builder.issue("Expected an alias after AS", tableName);
                return null;
            }
            alias = tokens.get(cursor[0]++).getText();
        } else if (cursor[0] < tokens.size() && tokens.get(cursor[0]).is(TokenType.WORD)
                && !JOIN_KEYWORDS.contains(tokens.get(cursor[0]).upper())
                && !ExpressionParser.isReserved(tokens.get(cursor[0]).getText())) {
            alias = tokens.get(cursor[0]++).getText();
        }
        return new String[]{tableName.toLowerCase(), alias};
    }

    /**
     * ON a.x = b.y
     *
     * @return [左列, 右列],不是单个等值条件时返回null
     */
    private ColumnExpression[] parseJoinCondition(String sql, List<Token> tokens, ParsedQuery.Builder builder) {
        List<Token> inner = ClauseScanner.unwrapParentheses(tokens);
        List<Token> conditionTokens = inner != null ? inner : tokens;
        List<List<Token>> parts = ClauseScanner.splitOnAnd(conditionTokens);
        if (parts == null || parts.size() != 1) {
            builder.unsupported("Compound JOIN conditions",
                    "Join on a single column pair and move the other conditions to WHERE");
            return null;
        }
        try {
            Condition condition = new ExpressionParser(sql, conditionTokens).parseCondition();
            if (condition.getOperator() == Operator.EQUAL
                    && condition.getLeft() instanceof ColumnExpression
                    && condition.getRightOperand() instanceof ColumnExpression) {
                return new ColumnExpression[]{
                        (ColumnExpression) condition.getLeft(),
                        (ColumnExpression) condition.getRightOperand()};
            }
            builder.unsupported("Non-equality JOIN conditions", "Join with ON a.column = b.column");
        } catch (ParseFailure e) {
            builder.issue("Could not parse JOIN condition: " + e.getMessage(), e.getNear());
        }
        return null;
    }

    // ==================== SELECT ====================

    private void parseSelectList(String sql, List<Token> tokens, ParsedQuery.Builder builder) {
        List<Token> items = tokens;
        if (!items.isEmpty() && items.get(0).isKeyword("DISTINCT")) {
            builder.distinct(true);
            items = items.subList(1, items.size());
        } else if (!items.isEmpty() && items.get(0).isKeyword("ALL")) {
            items = items.subList(1, items.size());
        }
        if (items.isEmpty()) {
            builder.issue("Missing column list after SELECT", null);
            return;
        }

        for (List<Token> itemTokens : ClauseScanner.splitOnCommas(items)) {
            if (itemTokens.isEmpty()) {
                builder.issue("Empty item in SELECT list", ",");
                continue;
            }
            SelectItem item = parseSelectItem(sql, itemTokens, builder);
            builder.selectItem(item);
            reportFunctions(item.getExpression(), builder);
        }
    }

    private SelectItem parseSelectItem(String sql, List<Token> tokens, ParsedQuery.Builder builder) {
        ExpressionParser parser = new ExpressionParser(sql, tokens);
        try {
            Expression expression = parser.parseAdditive();
            int expressionEnd = parser.getPosition();
            String alias = null;

            Token next = parser.peek();
            if (next != null) {
                int remaining = tokens.size() - expressionEnd;
                if (next.isKeyword("AS") && remaining == 2 && isAliasToken(tokens.get(expressionEnd + 1))) {
                    alias = tokens.get(expressionEnd + 1).getText();
                } else if (remaining == 1 && isAliasToken(next) && !ExpressionParser.isReserved(next.getText())) {
                    alias = next.getText();
                } else {
                    throw new ParseFailure("Unexpected token in SELECT list", next);
                }
            }
            return new SelectItem(expression, alias, parser.text(0, expressionEnd));
        } catch (ParseFailure e) {
            builder.issue("Could not parse SELECT item '" + text(sql, tokens) + "'", e.getNear());
            return new SelectItem(new UnparsedExpression(text(sql, tokens)), null, text(sql, tokens));
        }
    }

    private static boolean isAliasToken(Token token) {
        return token.is(TokenType.WORD) || token.is(TokenType.STRING);
    }

    // ==================== WHERE / HAVING ====================

    private void parseConditions(String sql, List<Token> tokens, String clause,
                                 ParsedQuery.Builder builder, boolean having) {
        if (tokens.isEmpty()) {
            builder.issue("Missing condition after " + clause, null);
            return;
        }
        List<Token> body = tokens;
        List<Token> unwrapped = ClauseScanner.unwrapParentheses(body);
        while (unwrapped != null) {
            body = unwrapped;
            unwrapped = ClauseScanner.unwrapParentheses(body);
        }

        List<List<Token>> parts = ClauseScanner.splitOnAnd(body);
        if (parts == null) {
            builder.unsupported("OR conditions in " + clause,
                    "Use IN (...) for alternatives on one column, or run one query per alternative");
            return;
        }

        for (List<Token> part : parts) {
            List<Token> inner = ClauseScanner.unwrapParentheses(part);
            if (inner != null) {
                // (a AND b) 展开成同级谓词
                parseConditions(sql, inner, clause, builder, having);
                continue;
            }
            if (part.isEmpty()) {
                builder.issue("Empty condition in " + clause, "AND");
                continue;
            }
            if (part.get(0).isKeyword("NOT")) {
                builder.unsupported("NOT conditions in " + clause,
                        "Use the opposite operator instead (<> for =, NOT IN for IN, NOT LIKE for LIKE)");
                continue;
            }
            Condition condition = parseCondition(sql, part, clause, builder);
            if (having) {
                builder.having(condition);
            } else {
                if (condition.isParsed() && (ExpressionUtils.containsAggregate(condition.getLeft())
                        || condition.getRight().stream().anyMatch(ExpressionUtils::containsAggregate))) {
                    builder.unsupported("Aggregate functions in WHERE",
                            "Move conditions on aggregates to HAVING");
                }
                builder.where(condition);
            }
            reportFunctions(condition.getLeft(), builder);
            condition.getRight().forEach(e -> reportFunctions(e, builder));
        }
    }

    private Condition parseCondition(String sql, List<Token> tokens, String clause, ParsedQuery.Builder builder) {
        try {
            return new ExpressionParser(sql, tokens).parseCondition();
        } catch (ParseFailure e) {
            builder.issue("Could not parse " + clause + " condition '" + text(sql, tokens) + "'", e.getNear());
            return Condition.unparsed(text(sql, tokens));
        }
    }

    // ==================== GROUP BY / ORDER BY / LIMIT ====================

    private void parseGroupBy(String sql, List<Token> tokens, ParsedQuery.Builder builder) {
        if (tokens.isEmpty()) {
            builder.issue("Missing column list after GROUP BY", null);
            return;
        }
        List<Token> body = tokens;
        if (body.size() >= 2 && body.get(body.size() - 2).isKeyword("WITH")
                && body.get(body.size() - 1).isKeyword("ROLLUP")) {
            builder.unsupported("WITH ROLLUP", "Compute the subtotals with a separate aggregate query");
            body = body.subList(0, body.size() - 2);
        }
        for (List<Token> part : ClauseScanner.splitOnCommas(body)) {
            builder.groupBy(parseExpression(sql, part, "GROUP BY", builder));
        }
    }

    private void parseOrderBy(String sql, List<Token> tokens, ParsedQuery.Builder builder) {
        if (tokens.isEmpty()) {
            builder.issue("Missing column list after ORDER BY", null);
            return;
        }
        for (List<Token> part : ClauseScanner.splitOnCommas(tokens)) {
            OrderByItem.Direction direction = OrderByItem.Direction.ASC;
            List<Token> keyTokens = part;
            if (!part.isEmpty()) {
                Token last = part.get(part.size() - 1);
                if (last.isKeyword("DESC") || last.isKeyword("ASC")) {
                    direction = last.isKeyword("DESC") ? OrderByItem.Direction.DESC : OrderByItem.Direction.ASC;
                    keyTokens = part.subList(0, part.size() - 1);
                }
            }
            Expression expression = parseExpression(sql, keyTokens, "ORDER BY", builder);
            builder.orderBy(new OrderByItem(expression, text(sql, keyTokens), direction));
        }
    }

    private Expression parseExpression(String sql, List<Token> tokens, String clause, ParsedQuery.Builder builder) {
        if (tokens.isEmpty()) {
            builder.issue("Missing expression in " + clause, null);
            return new UnparsedExpression("");
        }
        try {
            Expression expression = new ExpressionParser(sql, tokens).parseFull();
            reportFunctions(expression, builder);
            return expression;
        } catch (ParseFailure e) {
            builder.issue("Could not parse " + clause + " item '" + text(sql, tokens) + "'", e.getNear());
            return new UnparsedExpression(text(sql, tokens));
        }
    }

    /**
     * LIMIT n | LIMIT n OFFSET m | LIMIT m, n
     */
    private void parseLimit(List<Token> tokens, Token keyword, ParsedQuery.Builder builder) {
        if (tokens.size() == 1 && isCount(tokens.get(0))) {
            builder.limit(Integer.parseInt(tokens.get(0).getText()));
        } else if (tokens.size() == 3 && isCount(tokens.get(0)) && tokens.get(1).is(TokenType.COMMA)
                && isCount(tokens.get(2))) {
            builder.offset(Integer.parseInt(tokens.get(0).getText()));
            builder.limit(Integer.parseInt(tokens.get(2).getText()));
        } else if (tokens.size() == 3 && isCount(tokens.get(0)) && tokens.get(1).isKeyword("OFFSET")
                && isCount(tokens.get(2))) {
            builder.limit(Integer.parseInt(tokens.get(0).getText()));
            builder.offset(Integer.parseInt(tokens.get(2).getText()));
        } else {
            builder.issue("LIMIT expects a non-negative integer",
                    tokens.isEmpty() ? keyword.getText() : tokens.get(0).getText());
        }
    }

    private static boolean isCount(Token token) {
        if (!token.is(TokenType.NUMBER) || token.getText().contains(".")) {
            return false;
        }
        return token.getText().length() <= 9;
    }

    // ==================== 辅助方法 ====================

    /**
     * 非聚合函数记为不支持的特性
     */
    private void reportFunctions(Expression expression, ParsedQuery.Builder builder) {
        FunctionExpression function = ExpressionUtils.firstFunction(expression);
        if (function != null) {
            builder.unsupported("Function " + function.getName().toUpperCase() + "()",
                    "Only the aggregate functions COUNT, SUM, AVG, MIN and MAX are available");
        }
    }

    private static String text(String sql, List<Token> tokens) {
        if (tokens.isEmpty()) {
            return "";
        }
        return sql.substring(tokens.get(0).getStart(), tokens.get(tokens.size() - 1).getEnd());
    }
}
