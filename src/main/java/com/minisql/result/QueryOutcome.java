package com.minisql.result;

import com.minisql.error.QueryException;

import java.util.Optional;

/**
 * QueryOutcome - 查询结果或结构化错误,二者必居其一
 *
 * 调用方不需要try/catch就能拿到一个可以展示的值。
 */
public final class QueryOutcome {

    private final QueryResult result;

    private final QueryException error;

    private QueryOutcome(QueryResult result, QueryException error) {
        this.result = result;
        this.error = error;
    }

    public static QueryOutcome success(QueryResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
        return new QueryOutcome(result, null);
    }

    public static QueryOutcome failure(QueryException error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        return new QueryOutcome(null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<QueryResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<QueryException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? result.toString() : error.toString();
    }
}
