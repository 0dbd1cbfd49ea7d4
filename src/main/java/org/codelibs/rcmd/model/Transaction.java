package org.codelibs.rcmd.model;

import java.util.Collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

/**
 * The distinct items bought together in one order, with the number of order
 * lines they came from.
 */
public final class Transaction {

    private final long orderID;

    private final ImmutableSortedSet<Long> items;

    private final int lineCount;

    public Transaction(final long orderID, final Collection<Long> items) {
        this(orderID, items, items == null ? 0 : items.size());
    }

    /**
     * @param lineCount order lines including repeated items
     */
    public Transaction(final long orderID, final Collection<Long> items,
            final int lineCount) {
        Preconditions.checkArgument(items != null, "items is null");
        this.orderID = orderID;
        this.items = ImmutableSortedSet.copyOf(items);
        Preconditions.checkArgument(lineCount >= this.items.size(),
                "lineCount %s is less than %s items", lineCount,
                this.items.size());
        this.lineCount = lineCount;
    }

    public long getOrderID() {
        return orderID;
    }

    public ImmutableSortedSet<Long> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public int getLineCount() {
        return lineCount;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof Transaction)) {
            return false;
        }
        final Transaction other = (Transaction) obj;
        return orderID == other.orderID && lineCount == other.lineCount
                && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return (Long.hashCode(orderID) * 31 + items.hashCode()) * 31 + lineCount;
    }

    @Override
    public String toString() {
        return "Transaction[orderID:" + orderID + ",items:" + items
                + ",lineCount:" + lineCount + ']';
    }
}
