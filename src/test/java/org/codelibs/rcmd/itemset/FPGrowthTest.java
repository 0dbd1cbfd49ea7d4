package org.codelibs.rcmd.itemset;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.Transaction;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

public class FPGrowthTest {

    private static List<Transaction> createTransactions() {
        return Arrays.asList(new Transaction(1, Arrays.asList(1L, 2L, 3L)),
                new Transaction(2, Arrays.asList(1L, 2L)), new Transaction(3,
                        Arrays.asList(1L, 2L, 3L, 4L)), new Transaction(4,
                        Arrays.asList(2L, 3L)));
    }

    @Test
    public void encode() {
        final PresenceTable table = TransactionEncoder
                .encode(createTransactions());

        assertArrayEquals(new long[] { 1, 2, 3, 4 }, table.getItemIDs());
        assertEquals(4, table.getNumTransactions());
        assertArrayEquals(new int[] { 3, 4, 3, 1 }, table.getColumnCounts());
        assertArrayEquals(new int[] { 1, 2 }, table.getPresentColumns(3));
        assertArrayEquals(new int[] { 0, 1, 2, 3 }, table.getPresentColumns(2));
        assertEquals(4, table.getItemID(3));
    }

    @Test
    public void mineAll() {
        final List<FrequentItemset> itemsets = new FPGrowth(0.25, 10)
                .mine(TransactionEncoder.encode(createTransactions()));

        // every subset of {1,2,3,4} occurs at least once
        assertEquals(15, itemsets.size());
        final Map<Set<Long>, Double> supports = toMap(itemsets);
        assertEquals(0.5, supports.get(ImmutableSet.of(1L, 2L, 3L)), 0.0);
        assertEquals(1.0, supports.get(ImmutableSet.of(2L)), 0.0);
        assertEquals(0.75, supports.get(ImmutableSet.of(1L, 2L)), 0.0);
        assertEquals(0.25, supports.get(ImmutableSet.of(1L, 2L, 3L, 4L)), 0.0);

        // ordered by length, then items
        assertEquals(ImmutableSet.of(1L), itemsets.get(0).getItems());
        assertEquals(ImmutableSet.of(1L, 2L), itemsets.get(4).getItems());
        assertEquals(4, itemsets.get(14).length());
    }

    @Test
    public void mineWithSupport() {
        final List<FrequentItemset> itemsets = new FPGrowth(0.5, 10)
                .mine(TransactionEncoder.encode(createTransactions()));

        final Map<Set<Long>, Double> supports = toMap(itemsets);
        assertEquals(7, supports.size());
        assertEquals(0.75, supports.get(ImmutableSet.of(1L)), 0.0);
        assertEquals(0.5, supports.get(ImmutableSet.of(1L, 3L)), 0.0);
        assertEquals(0.5, supports.get(ImmutableSet.of(1L, 2L, 3L)), 0.0);
        assertFalse(supports.containsKey(ImmutableSet.of(4L)));
    }

    @Test
    public void mineWithMaxLength() {
        final List<FrequentItemset> itemsets = new FPGrowth(0.25, 2)
                .mine(TransactionEncoder.encode(createTransactions()));

        assertEquals(10, itemsets.size());
        for (final FrequentItemset itemset : itemsets) {
            assertTrue(itemset.length() <= 2);
        }
    }

    @Test
    public void sameAsExhaustiveCount() {
        final Random random = new Random(1);
        final List<Transaction> transactions = Lists.newArrayList();
        for (int i = 0; i < 40; i++) {
            final Set<Long> items = new TreeSet<>();
            final int size = 1 + random.nextInt(6);
            while (items.size() < size) {
                items.add((long) random.nextInt(8));
            }
            transactions.add(new Transaction(i, items));
        }
        final PresenceTable table = TransactionEncoder.encode(transactions);

        for (final double minSupport : new double[] { 0.05, 0.1, 0.3 }) {
            final List<FrequentItemset> itemsets = new FPGrowth(minSupport, 4)
                    .mine(table);
            assertEquals(countAll(transactions, minSupport, 4),
                    toMap(itemsets));
        }
    }

    @Test
    public void minCount() {
        assertEquals(1, FPGrowth.minCount(0.25, 4));
        assertEquals(1, FPGrowth.minCount(0.0001, 10));
        assertEquals(2, FPGrowth.minCount(0.5, 3));
        assertEquals(3, FPGrowth.minCount(0.3, 10));
        assertEquals(10, FPGrowth.minCount(1.0, 10));
    }

    private static Map<Set<Long>, Double> toMap(
            final List<FrequentItemset> itemsets) {
        final Map<Set<Long>, Double> map = Maps.newHashMap();
        for (final FrequentItemset itemset : itemsets) {
            map.put(itemset.getItems(), itemset.getSupport());
        }
        return map;
    }

    private static Map<Set<Long>, Double> countAll(
            final List<Transaction> transactions, final double minSupport,
            final int maxLength) {
        final int n = transactions.size();
        final Map<Set<Long>, Double> map = Maps.newHashMap();
        for (int mask = 1; mask < 1 << 8; mask++) {
            final Set<Long> items = new TreeSet<>();
            for (int bit = 0; bit < 8; bit++) {
                if ((mask & 1 << bit) != 0) {
                    items.add((long) bit);
                }
            }
            if (items.size() > maxLength) {
                continue;
            }
            int count = 0;
            for (final Transaction transaction : transactions) {
                if (transaction.getItems().containsAll(items)) {
                    count++;
                }
            }
            if (count > 0 && (double) count / n >= minSupport) {
                map.put(ImmutableSet.copyOf(items), (double) count / n);
            }
        }
        return map;
    }
}
