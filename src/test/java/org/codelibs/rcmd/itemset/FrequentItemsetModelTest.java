package org.codelibs.rcmd.itemset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.codelibs.rcmd.exception.InsufficientSupportItemsetsException;
import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.Transaction;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

public class FrequentItemsetModelTest {

    private static final List<Transaction> TRANSACTIONS = Arrays.asList(
            new Transaction(1, Arrays.asList(1L, 2L, 3L)), new Transaction(2,
                    Arrays.asList(1L, 2L)), new Transaction(3, Arrays.asList(
                    1L, 2L, 3L, 4L)),
            new Transaction(4, Arrays.asList(2L, 3L)));

    @Test
    public void keepLongItemsets() {
        final List<FrequentItemset> itemsets = new FrequentItemsetModel(0.25,
                10, 2).compute(TRANSACTIONS);

        assertEquals(5, itemsets.size());
        assertEquals(ImmutableSet.of(1L, 2L, 3L), itemsets.get(0).getItems());
        assertEquals(0.5, itemsets.get(0).getSupport(), 0.0);
        assertEquals(ImmutableSet.of(1L, 2L, 4L), itemsets.get(1).getItems());
        assertEquals(ImmutableSet.of(1L, 2L, 3L, 4L), itemsets.get(4)
                .getItems());
        assertEquals(0.25, itemsets.get(4).getSupport(), 0.0);
    }

    @Test
    public void maxLength() {
        final List<FrequentItemset> itemsets = new FrequentItemsetModel(0.25,
                3, 2).compute(TRANSACTIONS);

        assertEquals(4, itemsets.size());
    }

    @Test
    public void insufficientSupport() {
        try {
            new FrequentItemsetModel(0.75, 10, 2).compute(TRANSACTIONS);
            fail();
        } catch (final InsufficientSupportItemsetsException e) {
            // only {1}, {2}, {3}, {1,2} and {2,3} are frequent
        }
    }
}
