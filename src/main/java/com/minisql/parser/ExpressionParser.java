package com.minisql.parser;

import com.minisql.parser.Token.TokenType;
import com.minisql.parser.expressions.AggregateExpression;
import com.minisql.parser.expressions.BinaryExpression;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.FunctionExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.Operator;
import com.minisql.parser.expressions.StarExpression;
import com.minisql.table.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ExpressionParser - 递归下降表达式解析器
 *
 * 在一段Token上工作(一个SELECT项、一个谓词、一个ORDER BY项)。
 *
 * 文法:
 * <pre>
 * condition      := additive ( compOp additive
 *                            | IS [NOT] NULL
 *                            | [NOT] LIKE additive
 *                            | [NOT] IN '(' additive {',' additive} ')'
 *                            | [NOT] BETWEEN additive AND additive )
 * additive       := multiplicative { ('+' | '-') multiplicative }
 * multiplicative := unary { ('*' | '/' | '%') unary }
 * unary          := '-' unary | primary
 * primary        := NUMBER | STRING | NULL | TRUE | FALSE
 *                 | name '(' args ')' | name {'.' name} ['.' '*'] | '*' | '(' additive ')'
 * </pre>
 *
 * 失败时抛出{@link ParseFailure},携带出错位置的Token。
 * 调用方(SQLParser)负责把失败记录为ParseIssue,解析器对外从不抛异常。
 */
final class ExpressionParser {

    /** 不能作为列名出现的关键字 */
    private static final Set<String> RESERVED = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "BY", "LIMIT", "OFFSET",
            "AND", "OR", "NOT", "IN", "LIKE", "IS", "BETWEEN", "AS", "ON", "JOIN", "UNION",
            "INNER", "LEFT", "RIGHT", "CROSS", "OUTER", "DISTINCT", "CASE", "WHEN", "THEN",
            "ELSE", "END", "EXISTS", "ASC", "DESC");

    private static final Set<String> COMPARISON_SYMBOLS = Set.of("=", "<>", "!=", "<", ">", "<=", ">=");

    private final String source;

    private final List<Token> tokens;

    private int position;

    /**
     * @param source 源文本(用于截取原文)
     * @param tokens 要解析的Token片段(不含EOF)
     */
    ExpressionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.position = 0;
    }

    static boolean isReserved(String word) {
        return RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    // ==================== 入口 ====================

    /**
     * 解析整个片段为一个表达式
     *
     * @throws ParseFailure 片段不是一个完整的表达式
     */
    Expression parseFull() {
        Expression expression = parseAdditive();
        expectEnd();
        return expression;
    }

    /**
     * 解析整个片段为一个谓词
     *
     * @throws ParseFailure 片段不是一个完整的谓词
     */
    Condition parseCondition() {
        int start = position;
        Expression left = parseAdditive();
        Token token = peek();
        if (token == null) {
            throw new ParseFailure("Expected a comparison operator", lastToken());
        }

        Operator operator;
        List<Expression> right = new ArrayList<>();

        if (token.is(TokenType.OPERATOR) && COMPARISON_SYMBOLS.contains(token.getText())) {
            next();
            operator = Operator.fromSymbol(token.getText());
            right.add(parseAdditive());
        } else if (token.isKeyword("IS")) {
            next();
            boolean negated = acceptKeyword("NOT");
            expectKeyword("NULL");
            operator = negated ? Operator.IS_NOT_NULL : Operator.IS_NULL;
        } else {
            boolean negated = acceptKeyword("NOT");
            Token keyword = next();
            if (keyword == null) {
                throw new ParseFailure("Expected LIKE, IN or BETWEEN", token);
            }
            switch (keyword.upper()) {
                case "LIKE":
                    operator = negated ? Operator.NOT_LIKE : Operator.LIKE;
                    right.add(parseAdditive());
                    break;
                case "IN":
                    operator = negated ? Operator.NOT_IN : Operator.IN;
                    right.addAll(parseInList());
                    break;
                case "BETWEEN":
                    operator = negated ? Operator.NOT_BETWEEN : Operator.BETWEEN;
                    right.add(parseAdditive());
                    expectKeyword("AND");
                    right.add(parseAdditive());
                    break;
                default:
                    throw new ParseFailure("Unexpected token in condition", keyword);
            }
        }

        expectEnd();
        // 字面量在左、列在右的比较统一改写为列在左
        if (operator.getCategory() == Operator.Category.COMPARISON
                && left.getType() == Expression.ExpressionType.LITERAL
                && right.get(0).getType() == Expression.ExpressionType.COLUMN) {
            return new Condition(right.get(0), operator.mirrored(), List.of(left), text(start, position));
        }
        return new Condition(left, operator, right, text(start, position));
    }

    private List<Expression> parseInList() {
        Token open = next();
        if (open == null || !open.is(TokenType.LEFT_PAREN)) {
            throw new ParseFailure("Expected '(' after IN", open != null ? open : lastToken());
        }
        List<Expression> values = new ArrayList<>();
        if (peek() != null && peek().isKeyword("SELECT")) {
            throw new ParseFailure("Subquery in IN list", peek());
        }
        values.add(parseAdditive());
        while (peek() != null && peek().is(TokenType.COMMA)) {
            next();
            values.add(parseAdditive());
        }
        Token close = next();
        if (close == null || !close.is(TokenType.RIGHT_PAREN)) {
            throw new ParseFailure("Expected ')' to close IN list", close != null ? close : lastToken());
        }
        return values;
    }

    // ==================== 表达式 ====================

    Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (true) {
            Token token = peek();
            if (token != null && (token.isOperator("+") || token.isOperator("-"))) {
                next();
                Expression right = parseMultiplicative();
                left = new BinaryExpression(left, token.isOperator("+") ? Operator.ADD : Operator.SUBTRACT, right);
            } else {
                return left;
            }
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (true) {
            Token token = peek();
            Operator operator = null;
            if (token != null && token.is(TokenType.STAR)) {
                operator = Operator.MULTIPLY;
            } else if (token != null && token.isOperator("/")) {
                operator = Operator.DIVIDE;
            } else if (token != null && token.isOperator("%")) {
                operator = Operator.MODULO;
            }
            if (operator == null) {
                return left;
            }
            next();
            left = new BinaryExpression(left, operator, parseUnary());
        }
    }

    private Expression parseUnary() {
        Token token = peek();
        if (token != null && token.isOperator("-")) {
            next();
            Expression operand = parseUnary();
            if (operand instanceof LiteralExpression && ((LiteralExpression) operand).getValue().isNumeric()) {
                return new LiteralExpression(((LiteralExpression) operand).getValue().negate());
            }
            return new BinaryExpression(new LiteralExpression(Value.ofInt(0)), Operator.SUBTRACT, operand);
        }
        if (token != null && token.isOperator("+")) {
            next();
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token token = next();
        if (token == null) {
            throw new ParseFailure("Unexpected end of expression", lastToken());
        }

        switch (token.getType()) {
            case NUMBER:
                return new LiteralExpression(parseNumber(token.getText()));
            case STRING:
                return new LiteralExpression(Value.ofText(token.getText()));
            case STAR:
                return new StarExpression();
            case LEFT_PAREN: {
                if (peek() != null && peek().isKeyword("SELECT")) {
                    throw new ParseFailure("Subquery", peek());
                }
                Expression inner = parseAdditive();
                Token close = next();
                if (close == null || !close.is(TokenType.RIGHT_PAREN)) {
                    throw new ParseFailure("Expected ')'", close != null ? close : lastToken());
                }
                return inner;
            }
            case WORD:
                return parseWord(token);
            default:
                throw new ParseFailure("Unexpected token", token);
        }
    }

    private Expression parseWord(Token token) {
        String upper = token.upper();
        switch (upper) {
            case "NULL":
                return new LiteralExpression(Value.NULL);
            case "TRUE":
                return new LiteralExpression(Value.TRUE);
            case "FALSE":
                return new LiteralExpression(Value.FALSE);
            default:
                break;
        }

        if (peek() != null && peek().is(TokenType.LEFT_PAREN)) {
            return parseFunction(token);
        }

        if (isReserved(upper)) {
            throw new ParseFailure("Unexpected keyword " + upper, token);
        }

        List<String> parts = new ArrayList<>();
        parts.add(token.getText());
        while (peek() != null && peek().is(TokenType.DOT)) {
            next();
            Token part = next();
            if (part != null && part.is(TokenType.STAR)) {
                return new StarExpression(String.join(".", parts));
            }
            if (part == null || !part.is(TokenType.WORD)) {
                throw new ParseFailure("Expected a column name after '.'", part != null ? part : lastToken());
            }
            parts.add(part.getText());
        }
        return new ColumnExpression(parts);
    }

    private Expression parseFunction(Token name) {
        Token open = next();
        AggregateExpression.Function aggregate = AggregateExpression.Function.fromName(name.getText());

        Expression result;
        if (aggregate != null) {
            result = parseAggregate(aggregate, open);
        } else {
            result = parseGenericFunction(name, open);
        }

        // 窗口函数: f(...) OVER (...)
        if (peek() != null && peek().isKeyword("OVER")) {
            next();
            Token windowOpen = peek();
            if (windowOpen != null && windowOpen.is(TokenType.LEFT_PAREN)) {
                next();
                skipToClose(windowOpen);
            }
            return new FunctionExpression(name.getText() + " OVER", List.of());
        }
        return result;
    }

    private Expression parseAggregate(AggregateExpression.Function function, Token open) {
        boolean distinct = acceptKeyword("DISTINCT");
        Token token = peek();
        if (token != null && token.is(TokenType.STAR) && !distinct) {
            next();
            if (function != AggregateExpression.Function.COUNT) {
                throw new ParseFailure(function + "(*) is not valid", token);
            }
            expectClose(open);
            return AggregateExpression.countStar();
        }
        Expression argument = parseAdditive();
        expectClose(open);
        return new AggregateExpression(function, argument, distinct);
    }

    /**
     * 非聚合函数: 尽量解析参数,参数语法特殊(如CAST(x AS INT))时跳过参数
     */
    private Expression parseGenericFunction(Token name, Token open) {
        List<Expression> arguments = new ArrayList<>();
        int mark = position;
        try {
            if (peek() != null && !peek().is(TokenType.RIGHT_PAREN)) {
                arguments.add(parseAdditive());
                while (peek() != null && peek().is(TokenType.COMMA)) {
                    next();
                    arguments.add(parseAdditive());
                }
            }
            expectClose(open);
        } catch (ParseFailure e) {
            position = mark;
            arguments.clear();
            skipToClose(open);
        }
        return new FunctionExpression(name.getText(), arguments);
    }

    // ==================== 辅助方法 ====================

    private static Value parseNumber(String text) {
        if (text.contains(".")) {
            return Value.ofFloat(Double.parseDouble(text));
        }
        try {
            return Value.ofInt(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return Value.ofFloat(Double.parseDouble(text));
        }
    }

    private void expectClose(Token open) {
        Token close = next();
        if (close == null || !close.is(TokenType.RIGHT_PAREN) || close.getDepth() != open.getDepth()) {
            throw new ParseFailure("Expected ')'", close != null ? close : lastToken());
        }
    }

    /**
     * 跳到与open匹配的右括号之后
     */
    private void skipToClose(Token open) {
        while (position < tokens.size()) {
            Token token = tokens.get(position++);
            if (token.is(TokenType.RIGHT_PAREN) && token.getDepth() == open.getDepth()) {
                return;
            }
        }
        throw new ParseFailure("Unbalanced parentheses", open);
    }

    private void expectKeyword(String keyword) {
        Token token = next();
        if (token == null || !token.isKeyword(keyword)) {
            throw new ParseFailure("Expected " + keyword, token != null ? token : lastToken());
        }
    }

    private boolean acceptKeyword(String keyword) {
        Token token = peek();
        if (token != null && token.isKeyword(keyword)) {
            position++;
            return true;
        }
        return false;
    }

    void expectEnd() {
        if (position < tokens.size()) {
            throw new ParseFailure("Unexpected token", tokens.get(position));
        }
    }

    boolean atEnd() {
        return position >= tokens.size();
    }

    int getPosition() {
        return position;
    }

    Token peek() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private Token next() {
        return position < tokens.size() ? tokens.get(position++) : null;
    }

    private Token lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    /**
     * Token区间[from, to)对应的原文
     */
    String text(int from, int to) {
        if (from >= to || from >= tokens.size()) {
            return "";
        }
        return source.substring(tokens.get(from).getStart(), tokens.get(Math.min(to, tokens.size()) - 1).getEnd());
    }

    /**
     * 解析失败(内部控制流,不会离开SQLParser)
     */
    static final class ParseFailure extends RuntimeException {

        private final transient Token token;

        ParseFailure(String message, Token token) {
            super(message);
            this.token = token;
        }

        Token getToken() {
            return token;
        }

        /**
         * 出错位置的单词
         */
        String getNear() {
            return token != null ? token.getText() : null;
        }
    }
}
