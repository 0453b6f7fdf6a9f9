package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * FunctionExpression - 非聚合函数调用
 *
 * UPPER(name), YEAR(hire_date) 等。解析器能识别,执行器不支持,
 * 出现时作为不支持的特性报告。
 */
public class FunctionExpression implements Expression {

    private final String name;

    private final List<Expression> arguments;

    public FunctionExpression(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.FUNCTION;
    }

    @Override
    public String toString() {
        return name.toUpperCase() + "(" + arguments.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ")) + ")";
    }
}
