package org.codelibs.rcmd.service;

import java.util.List;

import org.codelibs.rcmd.recommender.GenerationReport;
import org.codelibs.rcmd.writer.RecommendationRecord;

import com.google.common.collect.ImmutableList;

public class RecommendationResult {

    private final List<RecommendationRecord> records;

    private final GenerationReport report;

    public RecommendationResult(final List<RecommendationRecord> records,
            final GenerationReport report) {
        this.records = ImmutableList.copyOf(records);
        this.report = report;
    }

    public List<RecommendationRecord> getRecords() {
        return records;
    }

    public GenerationReport getReport() {
        return report;
    }
}
