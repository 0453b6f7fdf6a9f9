package com.minisql.parser;

import com.minisql.parser.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * CompoundQuery - 按顶层UNION [ALL]切分的查询
 *
 * 用于CTE查询体: 递归CTE的锚点成员和递归成员由UNION ALL(或UNION)连接。
 * 只看括号深度为0的UNION。
 */
public final class CompoundQuery {

    /** 各个成员查询 */
    private final List<String> members;

    /** 成员之间的连接符是否为UNION ALL(大小为members.size() - 1) */
    private final List<Boolean> unionAll;

    private CompoundQuery(List<String> members, List<Boolean> unionAll) {
        this.members = List.copyOf(members);
        this.unionAll = List.copyOf(unionAll);
    }

    /**
     * 切分查询
     */
    public static CompoundQuery split(String query) {
        List<Token> tokens = SqlTokenizer.tokenize(query);
        List<String> members = new ArrayList<>();
        List<Boolean> unionAll = new ArrayList<>();

        int memberStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isKeyword("UNION") && token.getDepth() == 0) {
                members.add(query.substring(memberStart, token.getStart()).trim());
                boolean all = tokens.get(i + 1).isKeyword("ALL");
                if (all) {
                    i++;
                }
                unionAll.add(all);
                memberStart = tokens.get(i).getEnd();
            }
        }
        members.add(query.substring(Math.min(memberStart, query.length())).trim());
        return new CompoundQuery(members, unionAll);
    }

    public List<String> getMembers() {
        return members;
    }

    public boolean isCompound() {
        return members.size() > 1;
    }

    /**
     * 是否有任何UNION(不带ALL)需要去重
     */
    public boolean isDistinct() {
        return unionAll.contains(Boolean.FALSE);
    }

    /**
     * 成员查询是否以标识符形式引用了指定的名字
     */
    public static boolean references(String query, String name) {
        for (Token token : SqlTokenizer.tokenize(query)) {
            if (token.is(TokenType.WORD) && token.getText().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
