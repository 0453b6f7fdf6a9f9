package com.minisql.index;

import com.minisql.table.Value;

import java.util.List;

/**
 * TreeView - 递归的树结构视图(用于按层绘制)
 *
 * level从0(根)开始,position是节点在父节点children中的下标。
 */
public class TreeView {

    private final long id;

    private final List<Value> keys;

    private final boolean leaf;

    private final int level;

    private final int position;

    private final List<TreeView> children;

    public TreeView(long id, List<Value> keys, boolean leaf, int level, int position, List<TreeView> children) {
        this.id = id;
        this.keys = List.copyOf(keys);
        this.leaf = leaf;
        this.level = level;
        this.position = position;
        this.children = List.copyOf(children);
    }

    public long getId() {
        return id;
    }

    public List<Value> getKeys() {
        return keys;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public int getLevel() {
        return level;
    }

    public int getPosition() {
        return position;
    }

    public List<TreeView> getChildren() {
        return children;
    }

    /**
     * 以缩进文本形式输出整棵树
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        sb.append("  ".repeat(level)).append(leaf ? "leaf " : "node ").append(id).append(' ').append(keys).append('\n');
        for (TreeView child : children) {
            child.render(sb);
        }
    }

    @Override
    public String toString() {
        return "TreeView{id=" + id + ", keys=" + keys + ", level=" + level + ", children=" + children.size() + '}';
    }
}
