package com.minisql.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * ParsedQuery - 一条SQL的结构化表示
 *
 * 每次parse调用创建一个新实例,不可变。
 *
 * 包含:
 * - 语句类型(只有SELECT可执行)
 * - 表名列表(FROM在前,然后按JOIN顺序,小写)
 * - SELECT列表、WHERE谓词、GROUP BY、HAVING谓词、ORDER BY、LIMIT/OFFSET
 * - JOIN列表、表别名映射(别名 → 表名)
 * - CTE定义和主查询文本
 * - 解析时发现的不支持特性和无法理解的结构
 *
 * tables为空表示字面量查询(SELECT 1),跳过表解析。
 */
public class ParsedQuery {

    private final QueryType queryType;

    private final List<String> tables;

    private final String fromAlias;

    private final List<SelectItem> selectItems;

    private final boolean distinct;

    private final List<Condition> whereConditions;

    private final List<Expression> groupBy;

    private final List<Condition> havingConditions;

    private final List<OrderByItem> orderBy;

    private final Integer limit;

    private final Integer offset;

    private final List<JoinClause> joins;

    private final List<CteDefinition> ctes;

    private final boolean recursive;

    private final Map<String, String> tableAliases;

    private final String rawQuery;

    private final String mainQuery;

    private final List<UnsupportedFeature> unsupportedFeatures;

    private final List<ParseIssue> parseIssues;

    private ParsedQuery(Builder builder) {
        this.queryType = builder.queryType;
        this.tables = List.copyOf(builder.tables);
        this.fromAlias = builder.fromAlias;
        this.selectItems = List.copyOf(builder.selectItems);
        this.distinct = builder.distinct;
        this.whereConditions = List.copyOf(builder.whereConditions);
        this.groupBy = List.copyOf(builder.groupBy);
        this.havingConditions = List.copyOf(builder.havingConditions);
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.joins = List.copyOf(builder.joins);
        this.ctes = List.copyOf(builder.ctes);
        this.recursive = builder.recursive;
        this.tableAliases = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tableAliases));
        this.rawQuery = builder.rawQuery;
        this.mainQuery = builder.mainQuery;
        this.unsupportedFeatures = List.copyOf(builder.unsupportedFeatures);
        this.parseIssues = List.copyOf(builder.parseIssues);
    }

    public static Builder builder() {
        return new Builder();
    }

    public QueryType getQueryType() {
        return queryType;
    }

    public List<String> getTables() {
        return tables;
    }

    /**
     * FROM中的第一个表
     */
    public Optional<String> getPrimaryTable() {
        return tables.isEmpty() ? Optional.empty() : Optional.of(tables.get(0));
    }

    public Optional<String> getFromAlias() {
        return Optional.ofNullable(fromAlias);
    }

    /**
     * FROM表在查询中的引用名: 别名优先
     */
    public String getFromReference() {
        return fromAlias != null ? fromAlias : getPrimaryTable().orElse(null);
    }

    public List<SelectItem> getSelectItems() {
        return selectItems;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<Condition> getWhereConditions() {
        return whereConditions;
    }

    public List<Expression> getGroupBy() {
        return groupBy;
    }

    public List<Condition> getHavingConditions() {
        return havingConditions;
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    public Optional<Integer> getOffset() {
        return Optional.ofNullable(offset);
    }

    public List<JoinClause> getJoins() {
        return joins;
    }

    public List<CteDefinition> getCtes() {
        return ctes;
    }

    public boolean isRecursive() {
        return recursive;
    }

    /**
     * 别名 → 表名
     */
    public Map<String, String> getTableAliases() {
        return tableAliases;
    }

    /**
     * 把别名或表名解析为表名
     *
     * @param reference 别名或表名
     * @return 表名(小写),无法解析时返回reference本身的小写形式
     */
    public String resolveTable(String reference) {
        if (reference == null) {
            return null;
        }
        String lowered = reference.toLowerCase(Locale.ROOT);
        return tableAliases.getOrDefault(lowered, lowered);
    }

    public String getRawQuery() {
        return rawQuery;
    }

    public String getMainQuery() {
        return mainQuery;
    }

    public List<UnsupportedFeature> getUnsupportedFeatures() {
        return unsupportedFeatures;
    }

    public List<ParseIssue> getParseIssues() {
        return parseIssues;
    }

    /**
     * 字面量查询(没有FROM)
     */
    public boolean isLiteralSelect() {
        return tables.isEmpty();
    }

    /**
     * SELECT * (不带前缀)
     */
    public boolean isSelectStar() {
        return selectItems.size() == 1 && selectItems.get(0).isStar()
                && selectItems.get(0).getExpression().toString().equals("*");
    }

    /**
     * SELECT列表是否包含聚合函数
     */
    public boolean hasAggregates() {
        for (SelectItem item : selectItems) {
            if (ExpressionUtils.containsAggregate(item.getExpression())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 查询是否需要分组(有GROUP BY或SELECT列表含聚合)
     */
    public boolean isAggregation() {
        return !groupBy.isEmpty() || hasAggregates();
    }

    @Override
    public String toString() {
        return "ParsedQuery{" +
                "queryType=" + queryType +
                ", tables=" + tables +
                ", selectItems=" + selectItems +
                ", where=" + whereConditions +
                ", groupBy=" + groupBy +
                ", having=" + havingConditions +
                ", orderBy=" + orderBy +
                ", limit=" + limit +
                ", joins=" + joins +
                ", ctes=" + ctes +
                '}';
    }

    /**
     * ParsedQuery构建器
     */
    public static final class Builder {

        private QueryType queryType = QueryType.UNKNOWN;

        private final List<String> tables = new ArrayList<>();

        private String fromAlias;

        private final List<SelectItem> selectItems = new ArrayList<>();

        private boolean distinct;

        private final List<Condition> whereConditions = new ArrayList<>();

        private final List<Expression> groupBy = new ArrayList<>();

        private final List<Condition> havingConditions = new ArrayList<>();

        private final List<OrderByItem> orderBy = new ArrayList<>();

        private Integer limit;

        private Integer offset;

        private final List<JoinClause> joins = new ArrayList<>();

        private final List<CteDefinition> ctes = new ArrayList<>();

        private boolean recursive;

        private final Map<String, String> tableAliases = new LinkedHashMap<>();

        private String rawQuery = "";

        private String mainQuery = "";

        private final List<UnsupportedFeature> unsupportedFeatures = new ArrayList<>();

        private final List<ParseIssue> parseIssues = new ArrayList<>();

        private Builder() {
        }

        public Builder queryType(QueryType queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder table(String table) {
            this.tables.add(table.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder fromAlias(String fromAlias) {
            this.fromAlias = fromAlias;
            return this;
        }

        public Builder selectItem(SelectItem item) {
            this.selectItems.add(item);
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder where(Condition condition) {
            this.whereConditions.add(condition);
            return this;
        }

        public Builder groupBy(Expression expression) {
            this.groupBy.add(expression);
            return this;
        }

        public Builder having(Condition condition) {
            this.havingConditions.add(condition);
            return this;
        }

        public Builder orderBy(OrderByItem item) {
            this.orderBy.add(item);
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder join(JoinClause join) {
            this.joins.add(join);
            return this;
        }

        public Builder ctes(List<CteDefinition> ctes) {
            this.ctes.addAll(ctes);
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder alias(String alias, String table) {
            this.tableAliases.put(alias.toLowerCase(Locale.ROOT), table.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder rawQuery(String rawQuery) {
            this.rawQuery = rawQuery;
            return this;
        }

        public Builder mainQuery(String mainQuery) {
            this.mainQuery = mainQuery;
            return this;
        }

        public Builder unsupported(String feature, String alternative) {
            for (UnsupportedFeature existing : unsupportedFeatures) {
                if (existing.getFeature().equals(feature)) {
                    return this;
                }
            }
            this.unsupportedFeatures.add(new UnsupportedFeature(feature, alternative));
            return this;
        }

        public Builder issue(String message, String near) {
            this.parseIssues.add(new ParseIssue(message, near));
            return this;
        }

        public ParsedQuery build() {
            return new ParsedQuery(this);
        }
    }
}
