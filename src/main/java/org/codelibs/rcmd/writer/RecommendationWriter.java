package org.codelibs.rcmd.writer;

import java.io.Closeable;
import java.io.IOException;

public interface RecommendationWriter extends Closeable {

    void open() throws IOException;

    void write(RecommendationRecord record) throws IOException;

}
