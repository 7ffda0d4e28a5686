package infrastructure.io;

import domain.model.FailureSequence;
import domain.model.WarningSign;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction for persisting discovery results.
 *
 * @see JsonResultWriter
 */
public interface ResultWriter {

    /**
     * Writes the discovered sequences into {@code outputDir}.
     *
     * @return the written file
     */
    Path writeSequences(List<FailureSequence> sequences, Path outputDir) throws IOException;

    /**
     * Writes the ranked warning signs into {@code outputDir}.
     *
     * @return the written file
     */
    Path writeWarningSigns(List<WarningSign> warningSigns, Path outputDir) throws IOException;
}
