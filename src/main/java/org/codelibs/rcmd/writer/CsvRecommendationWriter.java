package org.codelibs.rcmd.writer;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;

import org.codelibs.rcmd.RcmdConstants;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.io.Closeables;

/**
 * Writes recommendation records as CSV with a header line. A missing score is
 * written as an empty field.
 */
public class CsvRecommendationWriter implements RecommendationWriter {

    private static final Joiner JOINER = Joiner.on(',').useForNull("");

    private final File file;

    private Writer writer;

    public CsvRecommendationWriter(final File file) {
        this.file = file;
    }

    public CsvRecommendationWriter(final Writer writer) {
        file = null;
        this.writer = writer;
    }

    @Override
    public void open() throws IOException {
        if (file != null) {
            writer = new BufferedWriter(new OutputStreamWriter(
                    new FileOutputStream(file), Charsets.UTF_8));
        }
        writer.write(JOINER.join(RcmdConstants.ENTITY_ID_FIELD,
                RcmdConstants.RECOMMENDED_ITEM_ID_FIELD,
                RcmdConstants.SCORE_FIELD, RcmdConstants.MODEL_TYPE_FIELD,
                RcmdConstants.UPDATED_AT_FIELD, RcmdConstants.IS_CURRENT_FIELD));
        writer.write('\n');
    }

    @Override
    public void write(final RecommendationRecord record) throws IOException {
        final Double score = record.getScore();
        writer.write(JOINER.join(record.getEntityID(),
                record.getRecommendedItemID(), score == null ? null
                        : BigDecimal.valueOf(score).toPlainString(),
                record.getModelType().getValue(), record.getUpdatedAt()
                        .toInstant(), record.isCurrent()));
        writer.write('\n');
    }

    @Override
    public void close() throws IOException {
        Closeables.close(writer, false);
    }
}
