package org.codelibs.rcmd.recommender;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.codelibs.rcmd.exception.RecommendationGenerationException;
import org.codelibs.rcmd.model.Recommendation;

import com.google.common.collect.Lists;

public class GenerationReport {

    private final List<Recommendation> recommendations = Lists.newArrayList();

    private final Map<Long, RecommendationGenerationException> failures = new TreeMap<>();

    private int successful = 0;

    private int noRecommendation = 0;

    private long totalProcessingTime = 0;

    private long maxProcessingTime = 0;

    void addSuccess(final List<Recommendation> entityRecommendations,
            final long processingTime) {
        successful++;
        if (entityRecommendations.isEmpty()) {
            noRecommendation++;
        }
        recommendations.addAll(entityRecommendations);
        addProcessingTime(processingTime);
    }

    void addFailure(final RecommendationGenerationException e,
            final long processingTime) {
        failures.put(e.getEntityID(), e);
        addProcessingTime(processingTime);
    }

    private void addProcessingTime(final long processingTime) {
        totalProcessingTime += processingTime;
        if (processingTime > maxProcessingTime) {
            maxProcessingTime = processingTime;
        }
    }

    public List<Recommendation> getRecommendations() {
        return Collections.unmodifiableList(recommendations);
    }

    public Map<Long, RecommendationGenerationException> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFailure() {
        return failures.size();
    }

    public int getNoRecommendation() {
        return noRecommendation;
    }

    public long getTotalProcessingTime() {
        return totalProcessingTime;
    }

    public long getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public long getAverageProcessingTime() {
        final int processed = successful + failures.size();
        return processed == 0 ? 0 : totalProcessingTime / processed;
    }

    @Override
    public String toString() {
        return "GenerationReport[successful:" + successful + ",failure:"
                + failures.size() + ",noRecommendation:" + noRecommendation
                + ",recommendations:" + recommendations.size()
                + ",totalProcessingTime:" + totalProcessingTime + "ms]";
    }
}
