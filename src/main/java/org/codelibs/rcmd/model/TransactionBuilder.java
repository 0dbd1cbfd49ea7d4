package org.codelibs.rcmd.model;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.codelibs.rcmd.exception.EmptyInteractionDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Groups raw events by order ID into {@link Transaction}s, ordered by order ID.
 */
public final class TransactionBuilder {

    private static final Logger log = LoggerFactory
            .getLogger(TransactionBuilder.class);

    private TransactionBuilder() {
    }

    public static List<Transaction> build(
            final Iterable<InteractionEvent> events) {
        Preconditions.checkArgument(events != null, "events is null");

        // order lines, repeated items included
        final Map<Long, List<Long>> itemsByOrder = new TreeMap<>();
        int processed = 0;
        int skipped = 0;
        for (final InteractionEvent event : events) {
            processed++;
            if (event == null || event.getOrderID() == null
                    || event.getItemID() == null) {
                skipped++;
                continue;
            }
            itemsByOrder.computeIfAbsent(event.getOrderID(),
                    k -> Lists.newArrayList()).add(event.getItemID());
        }
        log.info("Processed {} events, skipped {} without order or item",
                processed, skipped);

        if (itemsByOrder.isEmpty()) {
            throw new EmptyInteractionDataException("No orders in "
                    + processed + " events.");
        }

        final List<Transaction> transactions = Lists
                .newArrayListWithCapacity(itemsByOrder.size());
        for (final Map.Entry<Long, List<Long>> entry : itemsByOrder.entrySet()) {
            transactions.add(new Transaction(entry.getKey(), entry.getValue(),
                    entry.getValue().size()));
        }
        log.info("Transaction list generated: {} orders", transactions.size());
        return transactions;
    }
}
