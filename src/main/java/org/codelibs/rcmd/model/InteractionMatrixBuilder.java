package org.codelibs.rcmd.model;

import org.codelibs.rcmd.exception.EmptyInteractionDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * Counts (item, user) occurrences in raw events and pivots them into an
 * {@link InteractionMatrix}. Pairs never observed stay absent.
 */
public final class InteractionMatrixBuilder {

    private static final Logger log = LoggerFactory
            .getLogger(InteractionMatrixBuilder.class);

    private InteractionMatrixBuilder() {
    }

    public static InteractionMatrix build(
            final Iterable<InteractionEvent> events) {
        Preconditions.checkArgument(events != null, "events is null");

        final Table<Long, Long, Integer> counts = HashBasedTable.create();
        int processed = 0;
        int skipped = 0;
        for (final InteractionEvent event : events) {
            processed++;
            if (event == null || event.getItemID() == null
                    || event.getUserID() == null) {
                skipped++;
                continue;
            }
            final Integer count = counts.get(event.getItemID(),
                    event.getUserID());
            counts.put(event.getItemID(), event.getUserID(),
                    count == null ? 1 : count + 1);
        }
        log.info("Processed {} events, skipped {} without user or item",
                processed, skipped);

        if (counts.isEmpty()) {
            throw new EmptyInteractionDataException(
                    "No user-item interactions in " + processed + " events.");
        }

        final InteractionMatrix matrix = InteractionMatrix.of(counts);
        log.info("Raw user-item matrix generated: {}", matrix);
        return matrix;
    }
}
