package org.codelibs.rcmd.writer;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.StringWriter;
import java.util.Date;
import java.util.List;

import org.codelibs.rcmd.model.ModelType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

public class CsvRecommendationWriterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void writeRecords() throws Exception {
        final StringWriter out = new StringWriter();
        try (RecommendationWriter writer = new CsvRecommendationWriter(out)) {
            writer.open();
            writer.write(new RecommendationRecord(1, 2, 0.28284,
                    ModelType.PAIRWISE, new Date(0L), true));
            writer.write(new RecommendationRecord(3, 4, null,
                    ModelType.ITEMSET, new Date(0L), true));
        }

        assertEquals(
                "entity_id,recommended_item_id,score,model_type,updated_at,is_current\n"
                        + "1,2,0.28284,pairwise,1970-01-01T00:00:00Z,true\n"
                        + "3,4,,itemset,1970-01-01T00:00:00Z,true\n",
                out.toString());
    }

    @Test
    public void plainScores() throws Exception {
        final StringWriter out = new StringWriter();
        try (RecommendationWriter writer = new CsvRecommendationWriter(out)) {
            writer.open();
            writer.write(new RecommendationRecord(1, 2, 0.00001,
                    ModelType.PAIRWISE, new Date(0L), true));
        }

        final String[] lines = out.toString().split("\n");
        assertEquals("1,2,0.000010,pairwise,1970-01-01T00:00:00Z,true",
                lines[1]);
    }

    @Test
    public void writeFile() throws Exception {
        final File file = folder.newFile("recommendations.csv");
        try (RecommendationWriter writer = new CsvRecommendationWriter(file)) {
            writer.open();
            writer.write(new RecommendationRecord(10, 20, 1.0,
                    ModelType.PAIRWISE, new Date(1000L), true));
        }

        final List<String> lines = Files.readLines(file, Charsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("10,20,1.0,pairwise,1970-01-01T00:00:01Z,true",
                lines.get(1));
    }
}
