package com.minisql.parser;

/**
 * UnsupportedFeature - 解析时发现的超出可执行子集的结构
 */
public class UnsupportedFeature {

    private final String feature;

    private final String alternative;

    public UnsupportedFeature(String feature, String alternative) {
        this.feature = feature;
        this.alternative = alternative;
    }

    public String getFeature() {
        return feature;
    }

    public String getAlternative() {
        return alternative;
    }

    @Override
    public String toString() {
        return feature;
    }
}
