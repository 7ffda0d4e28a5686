package infrastructure.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.model.FailureSequence;
import domain.model.State;
import domain.model.WarningSign;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResultWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void writesSequencesFile() throws IOException {
        FailureSequence sequence = new FailureSequence(
            Arrays.asList(new State("M-1", Arrays.asList("low", "low")),
                          new State("M-1", Arrays.asList("high", "low"))),
            4,
            new LinkedHashSet<>(Arrays.asList("M-1", "M-2")),
            0.0);

        Path file = new JsonResultWriter().writeSequences(Collections.singletonList(sequence), tempDir.resolve("out"));

        JsonNode root = om.readTree(file.toFile());
        JsonNode first = root.path("sequences").get(0);
        assertThat(file.getFileName().toString()).isEqualTo(JsonResultWriter.SEQUENCES_FILE);
        assertThat(first.path("sequence").get(1).asText()).isEqualTo("M-1[high, low]");
        assertThat(first.path("frequency").asInt()).isEqualTo(4);
        assertThat(first.path("avg_time_to_failure").asDouble()).isZero();
        assertThat(first.path("machines").size()).isEqualTo(2);
    }

    @Test
    void writesWarningSignsFile() throws IOException {
        WarningSign sign = new WarningSign("State transition: [low] -> [high] (2 steps)", 0.3, 3, 0.0);

        Path file = new JsonResultWriter().writeWarningSigns(Collections.singletonList(sign), tempDir);

        JsonNode first = om.readTree(file.toFile()).path("warning_signs").get(0);
        assertThat(first.path("pattern").asText()).startsWith("State transition");
        assertThat(first.path("predictive_score").asDouble()).isEqualTo(0.3);
        assertThat(first.path("frequency").asInt()).isEqualTo(3);
        assertThat(first.path("false_positive_rate").asDouble()).isZero();
    }

    @Test
    void emptyResultsStillProduceArrays() throws IOException {
        Path file = new JsonResultWriter().writeWarningSigns(Collections.emptyList(), tempDir);

        assertThat(om.readTree(file.toFile()).path("warning_signs").isArray()).isTrue();
    }
}
