package org.codelibs.rcmd.model;

import java.util.Collection;
import java.util.Comparator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;

/**
 * A set of items together with the fraction of transactions containing all of them.
 */
public final class FrequentItemset {

    /** Highest support first, then longest, then lexicographic items. */
    public static final Comparator<FrequentItemset> BY_SUPPORT_THEN_LENGTH = (
            o1, o2) -> ComparisonChain.start()
            .compare(o2.support, o1.support)
            .compare(o2.length(), o1.length())
            .compare(o1.items, o2.items,
                    Ordering.<Long> natural().lexicographical())
            .result();

    private final ImmutableSortedSet<Long> items;

    private final double support;

    public FrequentItemset(final Collection<Long> items, final double support) {
        Preconditions.checkArgument(items != null && !items.isEmpty(),
                "items is empty");
        Preconditions.checkArgument(support > 0.0 && support <= 1.0,
                "support must be in (0, 1]: %s", support);
        this.items = ImmutableSortedSet.copyOf(items);
        this.support = support;
    }

    public ImmutableSortedSet<Long> getItems() {
        return items;
    }

    public double getSupport() {
        return support;
    }

    public int length() {
        return items.size();
    }

    public boolean contains(final long itemID) {
        return items.contains(itemID);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof FrequentItemset)) {
            return false;
        }
        final FrequentItemset other = (FrequentItemset) obj;
        return items.equals(other.items)
                && Double.compare(support, other.support) == 0;
    }

    @Override
    public int hashCode() {
        return items.hashCode() * 31 + Double.hashCode(support);
    }

    @Override
    public String toString() {
        return "FrequentItemset[items:" + items + ",support:" + support + ']';
    }
}
