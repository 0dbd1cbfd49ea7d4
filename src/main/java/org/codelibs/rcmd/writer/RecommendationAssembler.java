package org.codelibs.rcmd.writer;

import java.util.Comparator;
import java.util.Date;
import java.util.List;

import org.codelibs.rcmd.model.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Normalizes recommendations of either model into {@link RecommendationRecord}s
 * stamped with the caller's time, ordered by entity ID, then recommended item
 * ID, then model type.
 */
public final class RecommendationAssembler {

    private static final Logger log = LoggerFactory
            .getLogger(RecommendationAssembler.class);

    static final Comparator<RecommendationRecord> RECORD_ORDER = (o1, o2) -> ComparisonChain
            .start().compare(o1.getEntityID(), o2.getEntityID())
            .compare(o1.getRecommendedItemID(), o2.getRecommendedItemID())
            .compare(o1.getModelType(), o2.getModelType()).result();

    private RecommendationAssembler() {
    }

    public static List<RecommendationRecord> assemble(
            final Iterable<Recommendation> recommendations,
            final Date updatedAt) {
        Preconditions.checkArgument(recommendations != null,
                "recommendations is null");
        Preconditions.checkArgument(updatedAt != null, "updatedAt is null");

        final List<RecommendationRecord> records = Lists.newArrayList();
        for (final Recommendation recommendation : recommendations) {
            records.add(new RecommendationRecord(recommendation
                    .getSourceEntityID(), recommendation
                    .getRecommendedItemID(), recommendation.getScore(),
                    recommendation.getModelType(), updatedAt, true));
        }
        records.sort(RECORD_ORDER);
        log.info("Assembled {} recommendation records", records.size());
        return ImmutableList.copyOf(records);
    }
}
