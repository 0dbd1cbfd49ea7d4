package org.codelibs.rcmd.model;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.codelibs.rcmd.exception.EmptyInteractionDataException;
import org.junit.Test;

public class TransactionBuilderTest {

    @Test
    public void groupsItemsByOrder() {
        final List<Transaction> transactions = TransactionBuilder.build(Arrays
                .asList(InteractionEvent.ofOrder(100, 2),
                        InteractionEvent.ofOrder(100, 1),
                        InteractionEvent.ofOrder(100, 2),
                        InteractionEvent.ofOrder(50, 3),
                        InteractionEvent.ofUser(7, 4)));

        assertEquals(2, transactions.size());
        assertEquals(50, transactions.get(0).getOrderID());
        assertEquals(Arrays.asList(3L), transactions.get(0).getItems()
                .asList());
        assertEquals(100, transactions.get(1).getOrderID());
        assertEquals(Arrays.asList(1L, 2L), transactions.get(1).getItems()
                .asList());
        assertEquals(2, transactions.get(1).size());
        assertEquals(3, transactions.get(1).getLineCount());
    }

    @Test(expected = EmptyInteractionDataException.class)
    public void noOrders() {
        TransactionBuilder.build(Collections.<InteractionEvent> emptyList());
    }
}
