package org.codelibs.rcmd.itemset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.codelibs.rcmd.model.FrequentItemset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;

/**
 * <p>
 * Frequent itemset mining by pattern growth. Transactions are compressed into
 * an FP-tree, items ordered by descending support, and every frequent item is
 * grown recursively over the conditional tree of its prefix paths, so
 * infrequent candidates are never enumerated.
 * </p>
 *
 * <p>
 * An itemset is frequent when the number of transactions containing it is at
 * least the smallest count whose ratio to the transaction count reaches
 * {@code minSupport}. Results are sorted by length, then by items.
 * </p>
 */
public class FPGrowth {

    private static final Logger log = LoggerFactory.getLogger(FPGrowth.class);

    private final double minSupport;

    private final int maxLength;

    public FPGrowth(final double minSupport, final int maxLength) {
        Preconditions.checkArgument(minSupport > 0.0 && minSupport <= 1.0,
                "minSupport must be in (0, 1]: %s", minSupport);
        Preconditions.checkArgument(maxLength >= 1,
                "maxLength must be at least 1");
        this.minSupport = minSupport;
        this.maxLength = maxLength;
    }

    public List<FrequentItemset> mine(final PresenceTable table) {
        Preconditions.checkArgument(table != null, "table is null");
        final int numTransactions = table.getNumTransactions();
        if (numTransactions == 0) {
            return Lists.newArrayList();
        }
        final int minCount = minCount(minSupport, numTransactions);

        final int[] counts = table.getColumnCounts();
        final int[] rank = rank(counts, minCount);
        final FPTree tree = new FPTree();
        for (int row = 0; row < numTransactions; row++) {
            final int[] path = orderByRank(table.getPresentColumns(row), rank);
            if (path.length > 0) {
                tree.add(path, 1);
            }
        }

        final List<int[]> itemsets = new ArrayList<>();
        final List<Integer> supports = new ArrayList<>();
        grow(tree, new int[0], minCount, itemsets, supports);

        final List<FrequentItemset> results = Lists
                .newArrayListWithCapacity(itemsets.size());
        for (int i = 0; i < itemsets.size(); i++) {
            final List<Long> items = new ArrayList<>();
            for (final int column : itemsets.get(i)) {
                items.add(table.getItemID(column));
            }
            results.add(new FrequentItemset(items, (double) supports.get(i)
                    / numTransactions));
        }
        results.sort(BY_LENGTH_THEN_ITEMS);
        log.info("Mined {} frequent itemsets from {} transactions"
                + " (min count {}, max length {})", results.size(),
                numTransactions, minCount, maxLength);
        return results;
    }

    static int minCount(final double minSupport, final int numTransactions) {
        int count = Math.max(1, (int) Math.ceil(minSupport * numTransactions));
        while (count > 1 && (double) (count - 1) / numTransactions >= minSupport) {
            count--;
        }
        return count;
    }

    private void grow(final FPTree tree, final int[] suffix,
            final int minCount, final List<int[]> itemsets,
            final List<Integer> supports) {
        for (final Map.Entry<Integer, Integer> entry : tree.supports
                .entrySet()) {
            final int item = entry.getKey();
            final int support = entry.getValue();
            if (support < minCount) {
                continue;
            }
            final int[] itemset = Arrays.copyOf(suffix, suffix.length + 1);
            itemset[suffix.length] = item;
            itemsets.add(itemset);
            supports.add(support);
            if (itemset.length >= maxLength) {
                continue;
            }

            // conditional pattern base of the item
            final List<int[]> paths = new ArrayList<>();
            final List<Integer> pathCounts = new ArrayList<>();
            final Map<Integer, Integer> conditionalCounts = new HashMap<>();
            for (FPNode node = tree.headers.get(item); node != null; node = node.next) {
                final List<Integer> path = new ArrayList<>();
                for (FPNode parent = node.parent; parent.parent != null; parent = parent.parent) {
                    path.add(parent.item);
                    conditionalCounts.merge(parent.item, node.count,
                            Integer::sum);
                }
                if (!path.isEmpty()) {
                    paths.add(Ints.toArray(path));
                    pathCounts.add(node.count);
                }
            }

            final int[] conditionalRank = rank(conditionalCounts, minCount);
            final FPTree conditionalTree = new FPTree();
            for (int i = 0; i < paths.size(); i++) {
                final int[] path = orderByRank(paths.get(i), conditionalRank);
                if (path.length > 0) {
                    conditionalTree.add(path, pathCounts.get(i));
                }
            }
            if (!conditionalTree.isEmpty()) {
                grow(conditionalTree, itemset, minCount, itemsets, supports);
            }
        }
    }

    private static int[] rank(final int[] counts, final int minCount) {
        final Map<Integer, Integer> countMap = new HashMap<>();
        for (int i = 0; i < counts.length; i++) {
            countMap.put(i, counts[i]);
        }
        return rank(countMap, minCount);
    }

    /**
     * @return position of each frequent item in descending count order (ties by
     *         ascending item), -1 for infrequent items
     */
    private static int[] rank(final Map<Integer, Integer> counts,
            final int minCount) {
        final List<Integer> frequent = new ArrayList<>();
        int maxItem = -1;
        for (final Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            maxItem = Math.max(maxItem, entry.getKey());
            if (entry.getValue() >= minCount) {
                frequent.add(entry.getKey());
            }
        }
        frequent.sort((o1, o2) -> ComparisonChain.start()
                .compare(counts.get(o2), counts.get(o1)).compare(o1, o2)
                .result());
        final int[] rank = new int[maxItem + 1];
        Arrays.fill(rank, -1);
        for (int i = 0; i < frequent.size(); i++) {
            rank[frequent.get(i)] = i;
        }
        return rank;
    }

    private static int[] orderByRank(final int[] items, final int[] rank) {
        final List<Integer> kept = new ArrayList<>();
        for (final int item : items) {
            if (item < rank.length && rank[item] >= 0) {
                kept.add(item);
            }
        }
        kept.sort(Comparator.comparingInt(item -> rank[item]));
        return Ints.toArray(kept);
    }

    private static final Comparator<FrequentItemset> BY_LENGTH_THEN_ITEMS = (
            o1, o2) -> ComparisonChain
            .start()
            .compare(o1.length(), o2.length())
            .compare(o1.getItems(), o2.getItems(),
                    Ordering.<Long> natural().lexicographical()).result();

    private static final class FPNode {

        final int item;

        final FPNode parent;

        final Map<Integer, FPNode> children = new HashMap<>();

        int count;

        FPNode next;

        FPNode(final int item, final FPNode parent) {
            this.item = item;
            this.parent = parent;
        }
    }

    private static final class FPTree {

        final FPNode root = new FPNode(-1, null);

        // node-links per item, and total counts in ascending item order
        final Map<Integer, FPNode> headers = new HashMap<>();

        final Map<Integer, Integer> supports = new TreeMap<>();

        void add(final int[] path, final int count) {
            FPNode node = root;
            for (final int item : path) {
                FPNode child = node.children.get(item);
                if (child == null) {
                    child = new FPNode(item, node);
                    node.children.put(item, child);
                    child.next = headers.get(item);
                    headers.put(item, child);
                }
                child.count += count;
                supports.merge(item, count, Integer::sum);
                node = child;
            }
        }

        boolean isEmpty() {
            return root.children.isEmpty();
        }
    }
}
