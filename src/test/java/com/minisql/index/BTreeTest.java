package com.minisql.index;

import com.minisql.table.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BTreeTest - B+树模拟器测试
 *
 * 测试内容:
 * - 分裂和树高
 * - 等值查找的遍历轨迹
 * - 沿叶子链表的范围查找
 * - 重复键
 * - 结构不变式
 */
@DisplayName("B+树模拟器测试")
class BTreeTest {

    private BTree tree;

    @BeforeEach
    void setUp() {
        tree = new BTree(4);
        for (int i = 1; i <= 20; i++) {
            tree.insert(Value.ofInt(i * 10L), Value.ofInt(i));
        }
    }

    @Test
    @DisplayName("测试阶数小于3抛出异常")
    void testInvalidOrder() {
        assertThrows(IllegalArgumentException.class, () -> new BTree(2));
        assertThrows(IllegalArgumentException.class, () -> tree.insert(Value.NULL, Value.ofInt(1)));
    }

    @Test
    @DisplayName("测试根分裂: 3阶树插入3个键后高度为2")
    void testRootSplit() {
        BTree small = new BTree(3);
        small.insert(Value.ofInt(1), Value.ofInt(1));
        small.insert(Value.ofInt(2), Value.ofInt(2));
        assertEquals(1, small.getHeight());

        small.insert(Value.ofInt(3), Value.ofInt(3));

        TreeView root = small.getTreeStructure();
        assertAll(
                () -> assertEquals(2, small.getHeight()),
                () -> assertEquals(List.of(Value.ofInt(2)), root.getKeys()),
                () -> assertFalse(root.isLeaf()),
                () -> assertEquals(List.of(Value.ofInt(1)), root.getChildren().get(0).getKeys()),
                () -> assertEquals(List.of(Value.ofInt(2), Value.ofInt(3)), root.getChildren().get(1).getKeys()),
                () -> assertEquals(3, small.getNodeCount())
        );
    }

    @Test
    @DisplayName("测试节点键数和子节点数不变式")
    void testInvariants() {
        assertEquals(20, tree.size());
        assertTrue(tree.getHeight() > 2);

        for (NodeSnapshot node : tree.getAllNodes()) {
            assertTrue(node.getKeys().size() <= tree.getOrder() - 1, "too many keys in " + node);
            if (node.isLeaf()) {
                assertEquals(node.getKeys().size(), node.getValues().size());
                assertTrue(node.getChildIds().isEmpty());
            } else {
                assertEquals(node.getKeys().size() + 1, node.getChildIds().size());
            }
        }
        assertEquals(tree.getRootId(), tree.getTreeStructure().getId());
    }

    @Test
    @DisplayName("测试叶子链表按顺序串起所有键")
    void testLeafChain() {
        Map<Long, NodeSnapshot> byId = new HashMap<>();
        for (NodeSnapshot node : tree.getAllNodes()) {
            byId.put(node.getId(), node);
        }
        TreeView view = tree.getTreeStructure();
        while (!view.isLeaf()) {
            view = view.getChildren().get(0);
        }

        List<Value> keys = new ArrayList<>();
        NodeSnapshot current = byId.get(view.getId());
        while (current != null) {
            keys.addAll(current.getKeys());
            current = current.getNextLeafId().map(byId::get).orElse(null);
        }

        assertEquals(20, keys.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(Value.ofInt((i + 1) * 10L), keys.get(i));
        }
    }

    @Test
    @DisplayName("测试等值查找: 每层一步,最后一步为FOUND")
    void testSearchFound() {
        SearchResult result = tree.search(Value.ofInt(70));

        assertTrue(result.isFound());
        assertEquals(Value.ofInt(7), result.getValue().orElseThrow());
        assertEquals(tree.getHeight(), result.getTrace().size());

        List<TraversalStep> trace = result.getTrace();
        for (int i = 0; i < trace.size() - 1; i++) {
            assertEquals(TraversalAction.DESCEND, trace.get(i).getAction());
            assertTrue(trace.get(i).getComparison().contains("descend to child"));
        }
        TraversalStep last = trace.get(trace.size() - 1);
        assertEquals(TraversalAction.FOUND, last.getAction());
        assertTrue(last.getComparison().endsWith("70 = 70"));
        assertEquals(tree.getRootId(), trace.get(0).getNodeId());
    }

    @Test
    @DisplayName("测试查找不存在的键")
    void testSearchNotFound() {
        SearchResult result = tree.search(Value.ofInt(75));

        assertFalse(result.isFound());
        assertTrue(result.getValue().isEmpty());
        TraversalStep last = result.getTrace().get(result.getTrace().size() - 1);
        assertEquals(TraversalAction.NOT_FOUND, last.getAction());
        assertTrue(last.getComparison().contains("75 not in index"));
        assertEquals("not_found", last.getAction().label());
    }

    @Test
    @DisplayName("测试空树查找")
    void testEmptyTree() {
        SearchResult result = new BTree(4).search(Value.ofInt(1));

        assertFalse(result.isFound());
        assertEquals(1, result.getTrace().size());
        assertTrue(result.getTrace().get(0).getComparison().startsWith("empty leaf"));
    }

    @Test
    @DisplayName("测试跨叶子的闭区间范围查找")
    void testRangeAcrossLeaves() {
        RangeResult range = tree.rangeSearch(Value.ofInt(30), Value.ofInt(90));

        assertEquals(7, range.size());
        assertEquals(Value.ofInt(30), range.getEntries().get(0).getKey());
        assertEquals(Value.ofInt(90), range.getEntries().get(6).getKey());
        assertTrue(range.getLeavesScanned() > 1);

        List<TraversalStep> trace = range.getTrace();
        assertEquals(TraversalAction.DESCEND, trace.get(0).getAction());
        assertEquals(TraversalAction.SCAN, trace.get(trace.size() - 1).getAction());
    }

    @Test
    @DisplayName("测试开区间和无界范围")
    void testOpenRanges() {
        assertEquals(5, tree.rangeSearch(Value.ofInt(30), false, Value.ofInt(90), false).size());
        assertEquals(3, tree.rangeSearch(Value.ofInt(180), true, null, false).size());
        assertEquals(2, tree.rangeSearch(null, false, Value.ofInt(30), false).size());
        assertEquals(20, tree.rangeSearch(null, false, null, false).size());
    }

    @Test
    @DisplayName("测试下界大于上界返回空结果")
    void testInvertedRange() {
        RangeResult range = tree.rangeSearch(Value.ofInt(90), Value.ofInt(30));

        assertEquals(0, range.size());
        assertEquals(1, range.getTrace().size());
        assertEquals(TraversalAction.COMPARE, range.getTrace().get(0).getAction());
    }

    @Test
    @DisplayName("测试重复键全部保留")
    void testDuplicates() {
        BTree duplicates = new BTree(3);
        for (int i = 1; i <= 5; i++) {
            duplicates.insert(Value.ofText("x"), Value.ofInt(i));
        }
        duplicates.insert(Value.ofText("a"), Value.ofInt(6));
        duplicates.insert(Value.ofText("z"), Value.ofInt(7));

        RangeResult range = duplicates.rangeSearch(Value.ofText("x"), Value.ofText("x"));
        assertEquals(5, range.size());
        assertEquals(7, duplicates.size());
    }

    @Test
    @DisplayName("测试从列值构建索引跳过NULL")
    void testBuilderSkipsNulls() {
        List<IndexEntry> entries = List.of(
                new IndexEntry(Value.ofInt(30), Value.ofInt(1)),
                new IndexEntry(Value.NULL, Value.ofInt(2)),
                new IndexEntry(Value.ofInt(10), Value.ofInt(3)));

        BTree built = BTreeIndexBuilder.build(entries, 4);

        assertEquals(2, built.size());
        assertEquals(Value.ofInt(3), built.search(Value.ofInt(10)).getValue().orElseThrow());
    }

    @Test
    @DisplayName("测试树的文本渲染")
    void testRender() {
        String rendered = tree.getTreeStructure().render();

        assertTrue(rendered.startsWith("node "));
        assertTrue(rendered.contains("\n  "));
        assertTrue(rendered.contains("leaf "));
    }

    @Test
    @DisplayName("测试逐个插入时轨迹长度随树高严格增长")
    void testTraceLengthFollowsHeight() {
        for (int order = 3; order <= 6; order++) {
            BTree growing = new BTree(order);
            int previousHeight = 0;
            int previousTrace = 0;
            for (int k = 1; k <= 200; k++) {
                growing.insert(Value.ofInt(k), Value.ofInt(k));
                int traceLength = growing.search(Value.ofInt(1)).getTrace().size();

                assertEquals(growing.getHeight(), traceLength, "order " + order + ", keys " + k);
                if (growing.getHeight() > previousHeight) {
                    assertTrue(traceLength > previousTrace, "order " + order + ", keys " + k);
                } else {
                    assertEquals(previousTrace, traceLength, "order " + order + ", keys " + k);
                }
                previousHeight = growing.getHeight();
                previousTrace = traceLength;
            }
            assertTrue(previousHeight >= 3, "order " + order);
        }
    }

    @Test
    @DisplayName("测试随机整数键: 每个已插入的键都能找到,其余键都找不到")
    void testRandomIntegerKeys() {
        Random random = new Random(42);
        for (int order = 3; order <= 6; order++) {
            List<Integer> candidates = new ArrayList<>();
            for (int k = 0; k <= 400; k++) {
                candidates.add(k);
            }
            Collections.shuffle(candidates, random);
            Map<Integer, Integer> inserted = new HashMap<>();
            BTree randomTree = new BTree(order);
            for (int i = 0; i < 120; i++) {
                int key = candidates.get(i);
                inserted.put(key, i);
                randomTree.insert(Value.ofInt(key), Value.ofInt(i));
            }

            for (int k = -1; k <= 401; k++) {
                SearchResult result = randomTree.search(Value.ofInt(k));
                if (inserted.containsKey(k)) {
                    assertEquals(Value.ofInt(inserted.get(k)), result.getValue().orElseThrow(),
                            "order " + order + ", key " + k);
                } else {
                    assertFalse(result.isFound(), "order " + order + ", key " + k);
                }
            }
        }
    }

    @Test
    @DisplayName("测试随机浮点键: 命中和未命中")
    void testRandomFloatKeys() {
        Random random = new Random(7);
        for (int order = 3; order <= 6; order++) {
            BTree floatTree = new BTree(order);
            Map<Double, Integer> inserted = new HashMap<>();
            for (int i = 0; i < 80; i++) {
                double key = random.nextInt(1000) / 4.0;
                if (inserted.putIfAbsent(key, i) == null) {
                    floatTree.insert(Value.ofFloat(key), Value.ofInt(i));
                }
            }

            for (int k = 0; k < 1000; k++) {
                double key = k / 4.0;
                SearchResult result = floatTree.search(Value.ofFloat(key));
                if (inserted.containsKey(key)) {
                    assertEquals(Value.ofInt(inserted.get(key)), result.getValue().orElseThrow(),
                            "order " + order + ", key " + key);
                } else {
                    assertFalse(result.isFound(), "order " + order + ", key " + key);
                }
                assertFalse(floatTree.search(Value.ofFloat(key + 0.125)).isFound());
            }
        }
    }
}
