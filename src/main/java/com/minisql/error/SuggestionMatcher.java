package com.minisql.error;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SuggestionMatcher - "Did you mean" 模糊匹配
 *
 * 使用Ratcliff/Obershelp相似度:
 * ratio = 2 * M / (len(a) + len(b)),M为递归找到的公共子串总长度。
 *
 * 设计原则:
 * - 比较前统一转小写
 * - 只返回相似度不低于阈值的最佳候选
 * - 找不到候选时列出全部可用名称
 */
public final class SuggestionMatcher {

    /** 相似度阈值 */
    public static final double DEFAULT_CUTOFF = 0.6;

    private SuggestionMatcher() {
    }

    /**
     * 生成建议文本
     *
     * @param name 用户输入的名称
     * @param candidates 可用名称
     * @param availableLabel 没有相近候选时的前缀,如"Available tables"
     * @return "Did you mean: x?" 或 "Available tables: a, b"
     */
    public static String suggest(String name, List<String> candidates, String availableLabel) {
        Optional<String> match = closestMatch(name, candidates, DEFAULT_CUTOFF);
        if (match.isPresent()) {
            return "Did you mean: " + match.get() + "?";
        }
        return availableLabel + ": " + String.join(", ", candidates);
    }

    /**
     * 找出最相近的候选(小写形式)
     */
    public static Optional<String> closestMatch(String name, List<String> candidates, double cutoff) {
        if (name == null || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String target = name.toLowerCase(Locale.ROOT);
        String best = null;
        double bestScore = -1;
        for (String candidate : candidates) {
            String lowered = candidate.toLowerCase(Locale.ROOT);
            double score = similarity(target, lowered);
            if (score >= cutoff && score > bestScore) {
                best = lowered;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Ratcliff/Obershelp相似度,范围[0, 1]
     */
    public static double similarity(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        // 最长公共子串: 取a中最靠前的,再取b中最靠前的
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        int[] lengths = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            int[] next = new int[bHigh - bLow + 1];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = lengths[j - bLow] + 1;
                    next[j - bLow + 1] = size;
                    if (size > bestSize) {
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                        bestSize = size;
                    }
                }
            }
            lengths = next;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}
