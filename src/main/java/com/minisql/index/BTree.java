package com.minisql.index;

import com.minisql.config.CommonConstant;
import com.minisql.table.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * BTree - 带遍历轨迹的B+树模拟器
 *
 * 用于可视化一列上的索引结构,以及演示索引查找比全表扫描少多少次比较。
 * 不参与执行器的真实行查找。
 *
 * 核心特性(MySQL兼容):
 * - 所有数据在叶子节点,内部节点只存分隔键
 * - 叶子节点形成有序链表(支持跨叶子的范围查询)
 * - 查询路径长度稳定(总是从根到叶)
 *
 * 不变式:
 * - 每个节点的键个数不超过 order - 1
 * - 内部节点的子节点个数 == 键个数 + 1
 * - 叶子节点每个键对应一个值
 *
 * 插入算法(自顶向下,无回溯):
 * - 根节点满时先分裂根,树高加一
 * - 下降途中遇到满的子节点先分裂再进入(预分裂)
 * - 叶子分裂时把右半部分的第一个键复制到父节点;内部节点分裂时中间键上移
 *
 * 存储结构:
 * - 节点存放在arena(ArrayList)中,通过下标引用子节点和下一个叶子
 * - 节点ID由BTreeNode全局分配,进程内唯一
 *
 * 设计原则:
 * - "Good taste": 分裂只有一个入口splitChild,根分裂也走同一路径
 * - 每棵树独占自己的节点,用完即丢弃
 *
 * 使用示例:
 * <pre>
 * BTree tree = new BTree(4);
 * for (int i = 1; i &lt;= 20; i++) {
 *     tree.insert(Value.ofInt(i * 10), Value.ofInt(i));
 * }
 * SearchResult hit = tree.search(Value.ofInt(70));      // found, trace.size() == height
 * RangeResult range = tree.rangeSearch(Value.ofInt(30), Value.ofInt(90));
 * </pre>
 */
public class BTree {

    private static final Logger logger = LoggerFactory.getLogger(BTree.class);

    /** 阶数: 每个节点最多 order - 1 个键 */
    private final int order;

    /** 节点arena */
    private final List<BTreeNode> nodes = new ArrayList<>();

    /** 根节点在arena中的下标 */
    private int root;

    private int height = 1;

    private int size;

    /**
     * 创建B+树
     *
     * @param order 阶数(至少为3)
     */
    public BTree(int order) {
        if (order < CommonConstant.MIN_BTREE_ORDER) {
            throw new IllegalArgumentException("B-tree order must be at least "
                    + CommonConstant.MIN_BTREE_ORDER + ", got: " + order);
        }
        this.order = order;
        this.root = allocate(true);
    }

    private int allocate(boolean leaf) {
        nodes.add(new BTreeNode(leaf));
        return nodes.size() - 1;
    }

    private BTreeNode node(int index) {
        return nodes.get(index);
    }

    private boolean isFull(BTreeNode node) {
        return node.getKeyCount() >= order - 1;
    }

    // ==================== 插入 ====================

    /**
     * 插入键值对(允许重复键)
     *
     * @param key 键(不能为NULL)
     * @param value 值
     */
    public void insert(Value key, Value value) {
        if (key == null || key.isNull()) {
            throw new IllegalArgumentException("B-tree key cannot be NULL");
        }

        if (isFull(node(root))) {
            int newRoot = allocate(false);
            node(newRoot).getChildren().add(root);
            splitChild(newRoot, 0);
            root = newRoot;
            height++;
            logger.trace("Root split, height is now {}", height);
        }

        insertNonFull(root, key, value != null ? value : Value.NULL);
        size++;
    }

    private void insertNonFull(int index, Value key, Value value) {
        BTreeNode current = node(index);
        while (!current.isLeaf()) {
            int pos = current.upperBound(key);
            int child = current.getChildren().get(pos);
            if (isFull(node(child))) {
                splitChild(index, pos);
                if (key.compareTo(current.getKeys().get(pos)) >= 0) {
                    pos++;
                }
                child = current.getChildren().get(pos);
            }
            index = child;
            current = node(index);
        }

        int pos = current.upperBound(key);
        current.getKeys().add(pos, key);
        current.getValues().add(pos, value);
    }

    /**
     * 分裂父节点的第childPos个子节点(子节点必须是满的,父节点必须不满)
     */
    private void splitChild(int parentIndex, int childPos) {
        BTreeNode parent = node(parentIndex);
        int fullIndex = parent.getChildren().get(childPos);
        BTreeNode full = node(fullIndex);
        int siblingIndex = allocate(full.isLeaf());
        BTreeNode sibling = node(siblingIndex);

        List<Value> keys = full.getKeys();
        int mid = keys.size() / 2;
        Value separator;

        if (full.isLeaf()) {
            // 复制上移: 分隔键同时留在右叶子中
            sibling.getKeys().addAll(keys.subList(mid, keys.size()));
            sibling.getValues().addAll(full.getValues().subList(mid, keys.size()));
            separator = sibling.getKeys().get(0);
            keys.subList(mid, keys.size()).clear();
            full.getValues().subList(mid, full.getValues().size()).clear();

            sibling.setNextLeaf(full.getNextLeaf());
            full.setNextLeaf(siblingIndex);
        } else {
            // 中间键上移: 不保留在子节点中
            separator = keys.get(mid);
            sibling.getKeys().addAll(keys.subList(mid + 1, keys.size()));
            sibling.getChildren().addAll(full.getChildren().subList(mid + 1, full.getChildren().size()));
            keys.subList(mid, keys.size()).clear();
            full.getChildren().subList(mid + 1, full.getChildren().size()).clear();
        }

        parent.getKeys().add(childPos, separator);
        parent.getChildren().add(childPos + 1, siblingIndex);
        logger.trace("Split node {} at {}, new sibling {}", full.getId(), separator, sibling.getId());
    }

    // ==================== 查找 ====================

    /**
     * 等值查找
     *
     * 从根开始,每个节点线性扫描键,找到第一个大于目标的键后下降;
     * 每访问一个节点记录一步。键只存在于叶子中,所以只在叶子上报告found/not_found。
     *
     * @param key 目标键
     * @return 找到的值(重复键返回第一个)和遍历轨迹
     */
    public SearchResult search(Value key) {
        List<TraversalStep> trace = new ArrayList<>();
        BTreeNode current = node(root);

        while (!current.isLeaf()) {
            List<String> comparisons = new ArrayList<>();
            int pos = 0;
            List<Value> keys = current.getKeys();
            while (pos < keys.size() && key.compareTo(keys.get(pos)) >= 0) {
                comparisons.add(key + " >= " + keys.get(pos));
                pos++;
            }
            if (pos < keys.size()) {
                comparisons.add(key + " < " + keys.get(pos));
            }
            trace.add(new TraversalStep(current.getId(), keys,
                    String.join(", ", comparisons) + " -> descend to child " + pos, TraversalAction.DESCEND));
            current = node(current.getChildren().get(pos));
        }

        List<Value> keys = current.getKeys();
        List<String> comparisons = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            int cmp = key.compareTo(keys.get(i));
            if (cmp == 0) {
                comparisons.add(key + " = " + keys.get(i));
                trace.add(new TraversalStep(current.getId(), keys,
                        String.join(", ", comparisons), TraversalAction.FOUND));
                return new SearchResult(current.getValues().get(i), trace);
            }
            if (cmp < 0) {
                comparisons.add(key + " < " + keys.get(i));
                break;
            }
            comparisons.add(key + " > " + keys.get(i));
        }

        String description = keys.isEmpty() ? "empty leaf" : String.join(", ", comparisons);
        trace.add(new TraversalStep(current.getId(), keys,
                description + " -> " + key + " not in index", TraversalAction.NOT_FOUND));
        return new SearchResult(null, trace);
    }

    /**
     * 闭区间范围查找 [low, high]
     */
    public RangeResult rangeSearch(Value low, Value high) {
        return rangeSearch(low, true, high, true);
    }

    /**
     * 范围查找
     *
     * 先下降到可能包含下界的最左叶子,然后沿叶子链表向右扫描,
     * 直到遇到超过上界的键。
     *
     * @param low 下界(null表示无下界)
     * @param lowInclusive 是否包含下界
     * @param high 上界(null表示无上界)
     * @param highInclusive 是否包含上界
     * @return 范围内的(键, 值),按键升序
     */
    public RangeResult rangeSearch(Value low, boolean lowInclusive, Value high, boolean highInclusive) {
        List<TraversalStep> trace = new ArrayList<>();
        List<IndexEntry> entries = new ArrayList<>();
        String range = (low == null ? "(-inf" : (lowInclusive ? "[" : "(") + low) + ", "
                + (high == null ? "+inf)" : high + (highInclusive ? "]" : ")"));

        if (low != null && high != null && low.compareTo(high) > 0) {
            trace.add(new TraversalStep(node(root).getId(), node(root).getKeys(),
                    low + " > " + high + " -> empty range " + range, TraversalAction.COMPARE));
            return new RangeResult(entries, trace);
        }

        BTreeNode current = node(root);
        while (!current.isLeaf()) {
            int pos = low == null ? 0 : current.lowerBound(low);
            trace.add(new TraversalStep(current.getId(), current.getKeys(),
                    "Finding start " + (low == null ? "at leftmost leaf" : ">= " + low)
                            + " -> descend to child " + pos,
                    TraversalAction.DESCEND));
            current = node(current.getChildren().get(pos));
        }

        while (true) {
            boolean pastHigh = false;
            StringJoiner matched = new StringJoiner(", ");
            List<Value> keys = current.getKeys();
            for (int i = 0; i < keys.size(); i++) {
                Value key = keys.get(i);
                if (high != null && (highInclusive ? key.compareTo(high) > 0 : key.compareTo(high) >= 0)) {
                    pastHigh = true;
                    break;
                }
                if (low == null || (lowInclusive ? key.compareTo(low) >= 0 : key.compareTo(low) > 0)) {
                    entries.add(new IndexEntry(key, current.getValues().get(i)));
                    matched.add(key.toString());
                }
            }
            trace.add(new TraversalStep(current.getId(), keys,
                    "Scanning leaf for values in " + range + ", matched [" + matched + "]",
                    TraversalAction.SCAN));

            if (pastHigh || current.getNextLeaf() == BTreeNode.NO_NODE) {
                break;
            }
            current = node(current.getNextLeaf());
        }
        return new RangeResult(entries, trace);
    }

    // ==================== 结构视图 ====================

    /**
     * 所有节点的快照(按创建顺序)
     */
    public List<NodeSnapshot> getAllNodes() {
        List<NodeSnapshot> snapshots = new ArrayList<>(nodes.size());
        for (BTreeNode current : nodes) {
            List<Long> childIds = new ArrayList<>();
            for (int child : current.getChildren()) {
                childIds.add(node(child).getId());
            }
            Long nextLeafId = current.getNextLeaf() == BTreeNode.NO_NODE ? null : node(current.getNextLeaf()).getId();
            snapshots.add(new NodeSnapshot(current.getId(), current.getKeys(),
                    current.isLeaf() ? current.getValues() : List.of(), current.isLeaf(), childIds, nextLeafId));
        }
        return snapshots;
    }

    /**
     * 从根开始的递归树视图
     */
    public TreeView getTreeStructure() {
        return view(root, 0, 0);
    }

    private TreeView view(int index, int level, int position) {
        BTreeNode current = node(index);
        List<TreeView> children = new ArrayList<>();
        List<Integer> childIndexes = current.getChildren();
        for (int i = 0; i < childIndexes.size(); i++) {
            children.add(view(childIndexes.get(i), level + 1, i));
        }
        return new TreeView(current.getId(), current.getKeys(), current.isLeaf(), level, position, children);
    }

    public int getOrder() {
        return order;
    }

    /**
     * 树高(只有一个叶子根时为1)
     */
    public int getHeight() {
        return height;
    }

    /**
     * 已插入的键值对个数
     */
    public int size() {
        return size;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public long getRootId() {
        return node(root).getId();
    }

    @Override
    public String toString() {
        return "BTree{order=" + order + ", height=" + height + ", size=" + size + ", nodes=" + nodes.size() + '}';
    }
}
