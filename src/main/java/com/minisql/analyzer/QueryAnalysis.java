package com.minisql.analyzer;

import com.minisql.explain.AccessType;
import com.minisql.explain.ExplainReport;
import com.minisql.explain.IndexRecommendation;
import com.minisql.parser.ParsedQuery;
import com.minisql.result.QueryOutcome;

import java.util.List;
import java.util.Optional;

/**
 * QueryAnalysis - 一条查询的完整分析
 *
 * 执行结果(或错误)、反模式、EXPLAIN、索引建议和优化提示放在一起。
 * 执行失败时分析仍然继续,错误放在outcome里。
 */
public final class QueryAnalysis {

    private final ParsedQuery parsed;

    private final QueryOutcome outcome;

    private final List<QueryIssue> issues;

    private final OverallSeverity overallSeverity;

    /** EXPLAIN结果,查询没有表或EXPLAIN失败时为null */
    private final ExplainReport explain;

    private final AccessType.Rating accessRating;

    private final List<IndexRecommendation> recommendations;

    private final List<String> tips;

    QueryAnalysis(ParsedQuery parsed, QueryOutcome outcome, List<QueryIssue> issues, ExplainReport explain,
                  List<IndexRecommendation> recommendations, List<String> tips) {
        this.parsed = parsed;
        this.outcome = outcome;
        this.issues = List.copyOf(issues);
        this.overallSeverity = OverallSeverity.of(issues);
        this.explain = explain;
        this.accessRating = explain != null ? explain.getWorstRating() : AccessType.Rating.GOOD;
        this.recommendations = List.copyOf(recommendations);
        this.tips = List.copyOf(tips);
    }

    public ParsedQuery getParsed() {
        return parsed;
    }

    public QueryOutcome getOutcome() {
        return outcome;
    }

    public List<QueryIssue> getIssues() {
        return issues;
    }

    public boolean hasIssue(String title) {
        return issues.stream().anyMatch(i -> i.getTitle().startsWith(title));
    }

    public OverallSeverity getOverallSeverity() {
        return overallSeverity;
    }

    public Optional<ExplainReport> getExplain() {
        return Optional.ofNullable(explain);
    }

    public AccessType.Rating getAccessRating() {
        return accessRating;
    }

    public List<IndexRecommendation> getRecommendations() {
        return recommendations;
    }

    public List<String> getTips() {
        return tips;
    }

    @Override
    public String toString() {
        return "QueryAnalysis{" +
                "success=" + outcome.isSuccess() +
                ", issues=" + issues +
                ", overallSeverity=" + overallSeverity +
                ", accessRating=" + accessRating +
                ", recommendations=" + recommendations +
                '}';
    }
}
