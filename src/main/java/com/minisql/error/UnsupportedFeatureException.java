package com.minisql.error;

import java.util.Map;

/**
 * UnsupportedFeatureException - 语法合法但超出可执行子集
 *
 * 例如INSERT/UPDATE语句、WHERE中的OR、子查询。
 * 严重程度固定为WARNING,并且总是给出替代方案。
 */
public class UnsupportedFeatureException extends QueryException {

    private static final String DEFAULT_ALTERNATIVE = "This feature is not available in the engine";

    private final String feature;

    public UnsupportedFeatureException(String feature) {
        this(feature, null);
    }

    public UnsupportedFeatureException(String feature, String alternative) {
        super("Unsupported feature: " + feature,
                alternative != null ? alternative : DEFAULT_ALTERNATIVE,
                ErrorSeverity.WARNING,
                Map.of("feature", feature));
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }
}
