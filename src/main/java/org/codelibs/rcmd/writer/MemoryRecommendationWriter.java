package org.codelibs.rcmd.writer;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Collects written records as field maps, for callers that persist rows
 * themselves.
 */
public class MemoryRecommendationWriter implements RecommendationWriter {

    private final List<Map<String, Object>> rows = Lists.newArrayList();

    private boolean opened = false;

    @Override
    public void open() {
        rows.clear();
        opened = true;
    }

    @Override
    public void write(final RecommendationRecord record) {
        Preconditions.checkState(opened, "writer is not opened");
        rows.add(record.toMap());
    }

    @Override
    public void close() {
        opened = false;
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }
}
