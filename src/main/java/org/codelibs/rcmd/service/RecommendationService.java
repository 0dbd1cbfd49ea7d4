package org.codelibs.rcmd.service;

import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.codelibs.rcmd.itemset.FrequentItemsetModel;
import org.codelibs.rcmd.model.FrequentItemset;
import org.codelibs.rcmd.model.InteractionEvent;
import org.codelibs.rcmd.model.InteractionMatrix;
import org.codelibs.rcmd.model.InteractionMatrixBuilder;
import org.codelibs.rcmd.model.Transaction;
import org.codelibs.rcmd.model.TransactionBuilder;
import org.codelibs.rcmd.preprocess.SparsityReducer;
import org.codelibs.rcmd.recommender.GenerationReport;
import org.codelibs.rcmd.recommender.ItemsetRecommender;
import org.codelibs.rcmd.recommender.PairwiseRecommender;
import org.codelibs.rcmd.recommender.RecommendationGenerator;
import org.codelibs.rcmd.similarity.ItemSimilarityMatrix;
import org.codelibs.rcmd.similarity.PairwiseSimilarityModel;
import org.codelibs.rcmd.writer.RecommendationAssembler;
import org.codelibs.rcmd.writer.RecommendationRecord;
import org.codelibs.rcmd.writer.RecommendationWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.io.Closeables;

/**
 * Batch pipelines from raw events to recommendation records. Structural errors
 * (no usable data, everything pruned, no itemset) abort the run; failures of
 * single entities are only reported.
 */
public class RecommendationService {

    private static final Logger logger = LoggerFactory
            .getLogger(RecommendationService.class);

    private final RecommenderConfig config;

    private final RecommendationGenerator generator = new RecommendationGenerator();

    public RecommendationService(final Map<String, Object> settings) {
        this(RecommenderConfig.load(settings));
    }

    public RecommendationService(final RecommenderConfig config) {
        Preconditions.checkArgument(config != null, "config is null");
        this.config = config;
        logger.info("CREATE RecommendationService: {}", config);
    }

    public RecommenderConfig getConfig() {
        return config;
    }

    /**
     * Item-based collaborative filtering: recommends items to every user.
     *
     * @param events (user, item) events
     * @param updatedAt time stamped on every record
     */
    public RecommendationResult recommendForUsers(
            final Iterable<InteractionEvent> events, final Date updatedAt) {
        final Stopwatch stopwatch = Stopwatch.createStarted();

        final InteractionMatrix rawMatrix = InteractionMatrixBuilder
                .build(events);
        logger.info("Raw user-item matrix generated at {}", stopwatch);

        final InteractionMatrix matrix = SparsityReducer.reduce(rawMatrix);
        logger.info("Processing on user-item matrix complete at {}", stopwatch);

        final ItemSimilarityMatrix similarity = new PairwiseSimilarityModel(
                config.getSimilarityMetric()).compute(matrix);
        logger.info("Item similarity matrix generated at {}", stopwatch);

        final GenerationReport report = generator
                .generate(new PairwiseRecommender(matrix, similarity, config
                        .getTopNRecommendations()));
        return assemble(report, updatedAt, stopwatch);
    }

    /**
     * Frequent itemsets: recommends items to every item of a surviving itemset.
     *
     * @param events (order, item) events
     * @param updatedAt time stamped on every record
     */
    public RecommendationResult recommendForItems(
            final Iterable<InteractionEvent> events, final Date updatedAt) {
        final Stopwatch stopwatch = Stopwatch.createStarted();

        final List<Transaction> transactions = SparsityReducer.reduce(
                TransactionBuilder.build(events), config.getMinBasketSize());
        logger.info("Pre-processing done at {}: {} orders", stopwatch,
                transactions.size());

        final List<FrequentItemset> itemsets = new FrequentItemsetModel(
                config.getMinSupport(), config.getMaxItemsetLength(),
                config.getMinItemsetLengthFilter()).compute(transactions);
        logger.info("Result set post processed at {}", stopwatch);

        final GenerationReport report = generator
                .generate(new ItemsetRecommender(itemsets, config
                        .getTopItemsetsPerCandidate()));
        return assemble(report, updatedAt, stopwatch);
    }

    /**
     * Opens the writer, writes the records in order and closes the writer.
     *
     * @return number of records written
     */
    public int write(final List<RecommendationRecord> records,
            final RecommendationWriter writer) throws IOException {
        Preconditions.checkArgument(records != null, "records is null");
        Preconditions.checkArgument(writer != null, "writer is null");
        final Stopwatch stopwatch = Stopwatch.createStarted();
        boolean threw = true;
        try {
            writer.open();
            for (final RecommendationRecord record : records) {
                writer.write(record);
            }
            threw = false;
        } finally {
            Closeables.close(writer, threw);
        }
        logger.info("Time taken for writing {} records: {}", records.size(),
                stopwatch);
        return records.size();
    }

    private RecommendationResult assemble(final GenerationReport report,
            final Date updatedAt, final Stopwatch stopwatch) {
        if (report.getFailure() > 0) {
            logger.warn("{} entities could not be processed: {}",
                    report.getFailure(), report.getFailures().keySet());
        }
        final List<RecommendationRecord> records = RecommendationAssembler
                .assemble(report.getRecommendations(), updatedAt);
        logger.info("Final recommendations generated at {}", stopwatch);
        return new RecommendationResult(records, report);
    }
}
