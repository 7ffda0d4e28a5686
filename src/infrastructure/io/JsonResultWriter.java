package infrastructure.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import domain.model.FailureSequence;
import domain.model.WarningSign;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes discovery results as pretty-printed JSON.
 *
 * <ul>
 *   <li>{@code sequences.json}: {@code {"sequences": [{"sequence", "frequency",
 *       "avg_time_to_failure", "machines"}]}}</li>
 *   <li>{@code warning_signs.json}: {@code {"warning_signs": [{"pattern",
 *       "predictive_score", "frequency", "false_positive_rate"}]}}</li>
 * </ul>
 *
 * <p>The output directory is created when missing; existing files are overwritten.
 */
public final class JsonResultWriter implements ResultWriter {

    public static final String SEQUENCES_FILE = "sequences.json";
    public static final String WARNING_SIGNS_FILE = "warning_signs.json";

    private final ObjectMapper mapper;

    public JsonResultWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path writeSequences(List<FailureSequence> sequences, Path outputDir) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray("sequences");
        for (FailureSequence sequence : sequences) {
            ObjectNode node = array.addObject();
            ArrayNode states = node.putArray("sequence");
            sequence.describeStates().forEach(states::add);
            node.put("frequency", sequence.getFrequency());
            node.put("avg_time_to_failure", sequence.getAvgTimeToFailure());
            ArrayNode machines = node.putArray("machines");
            sequence.getMachines().forEach(machines::add);
        }
        return write(root, outputDir.resolve(SEQUENCES_FILE));
    }

    @Override
    public Path writeWarningSigns(List<WarningSign> warningSigns, Path outputDir) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode array = root.putArray("warning_signs");
        for (WarningSign sign : warningSigns) {
            array.addObject()
                .put("pattern", sign.getPattern())
                .put("predictive_score", sign.getPredictiveScore())
                .put("frequency", sign.getFrequency())
                .put("false_positive_rate", sign.getFalsePositiveRate());
        }
        return write(root, outputDir.resolve(WARNING_SIGNS_FILE));
    }

    private Path write(ObjectNode root, Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), root);
        return file;
    }
}
