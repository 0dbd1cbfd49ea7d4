package org.codelibs.rcmd.recommender;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class TopItemsTest {

    @Test
    public void topItems() {
        final long[] itemIDs = { 5, 3, 9, 1, 7 };
        final List<RecommendedItem> items = TopItems.getTopItems(3, itemIDs,
                itemID -> itemID == 9 ? 0.1 : itemID * 0.1);

        assertEquals(3, items.size());
        assertEquals(7, items.get(0).getItemID());
        assertEquals(0.7, items.get(0).getValue(), 1.0e-12);
        assertEquals(5, items.get(1).getItemID());
        assertEquals(3, items.get(2).getItemID());
    }

    @Test
    public void tiesByItemID() {
        final long[] itemIDs = { 8, 2, 6, 4 };
        final List<RecommendedItem> items = TopItems.getTopItems(2, itemIDs,
                itemID -> 1.0);

        assertEquals(2, items.get(0).getItemID());
        assertEquals(4, items.get(1).getItemID());
    }

    @Test
    public void skipNaN() {
        final long[] itemIDs = { 1, 2, 3 };
        final List<RecommendedItem> items = TopItems.getTopItems(5, itemIDs,
                itemID -> itemID == 2 ? Double.NaN : 0.5);

        assertEquals(2, items.size());
        assertEquals(1, items.get(0).getItemID());
        assertEquals(3, items.get(1).getItemID());

        assertTrue(TopItems.getTopItems(1, itemIDs, itemID -> Double.NaN)
                .isEmpty());
    }
}
