package infrastructure.io;

import application.GraphConfiguration;
import application.SearchParameters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link GraphConfiguration} and {@link SearchParameters} from JSON files.
 *
 * <h3>Graph configuration</h3>
 * <pre>
 *   {
 *     "discretization": {
 *       "Temperature": { "bins": [0, 60, 80, 200], "labels": ["low", "medium", "high"] }
 *     },
 *     "state_components": ["Temperature"]
 *   }
 * </pre>
 *
 * <h3>Search parameters</h3>
 * Keys {@code max_depth}, {@code lookback_window}, {@code min_pattern_length},
 * {@code heuristic}, {@code a_star_weight}; missing keys keep the builder defaults.
 *
 * <p>Syntax errors surface as {@link IOException} (from Jackson); structurally valid JSON
 * with invalid values fails in the configuration builders with
 * {@link IllegalArgumentException}.
 */
public final class JsonConfigurationReader {

    private final ObjectMapper mapper;

    public JsonConfigurationReader() {
        this(new ObjectMapper());
    }

    public JsonConfigurationReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GraphConfiguration readGraphConfiguration(Path file) throws IOException {
        JsonNode root = readRoot(file);
        GraphConfiguration.Builder builder = new GraphConfiguration.Builder();

        JsonNode discretization = root.path("discretization");
        if (!discretization.isObject()) {
            throw new IllegalArgumentException("'discretization' must be an object in " + file);
        }
        Iterator<Map.Entry<String, JsonNode>> sensors = discretization.fields();
        while (sensors.hasNext()) {
            Map.Entry<String, JsonNode> sensor = sensors.next();
            JsonNode scheme = sensor.getValue();
            builder.addScheme(sensor.getKey(),
                readNumbers(scheme.path("bins"), sensor.getKey() + ".bins"),
                readStrings(scheme.path("labels"), sensor.getKey() + ".labels"));
        }

        builder.setStateComponents(readStrings(root.path("state_components"), "state_components"));
        return builder.build();
    }

    public SearchParameters readSearchParameters(Path file) throws IOException {
        return readSearchParameters(file, new SearchParameters.Builder());
    }

    /**
     * Applies the keys present in {@code file} on top of {@code builder}.
     */
    public SearchParameters readSearchParameters(Path file, SearchParameters.Builder builder) throws IOException {
        JsonNode root = readRoot(file);

        if (root.has("max_depth")) {
            builder.setMaxDepth(readInt(root, "max_depth"));
        }
        if (root.has("lookback_window")) {
            builder.setLookbackWindow(readInt(root, "lookback_window"));
        }
        if (root.has("min_pattern_length")) {
            builder.setMinPatternLength(readInt(root, "min_pattern_length"));
        }
        if (root.has("heuristic")) {
            builder.setHeuristic(SearchParameters.HeuristicType.fromName(root.path("heuristic").asText()));
        }
        if (root.has("a_star_weight")) {
            JsonNode weight = root.path("a_star_weight");
            if (!weight.isNumber()) {
                throw new IllegalArgumentException("'a_star_weight' must be a number, got: " + weight);
            }
            builder.setAStarWeight(weight.asDouble());
        }
        return builder.build();
    }

    private JsonNode readRoot(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object in " + file);
        }
        return root;
    }

    private static int readInt(JsonNode root, String key) {
        JsonNode node = root.path(key);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + node);
        }
        return node.asInt();
    }

    private static List<Double> readNumbers(JsonNode node, String name) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + name + "' must be an array");
        }
        List<Double> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isNumber()) {
                throw new IllegalArgumentException("'" + name + "' must contain numbers, got: " + element);
            }
            values.add(element.asDouble());
        }
        return values;
    }

    private static List<String> readStrings(JsonNode node, String name) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + name + "' must be an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("'" + name + "' must contain strings, got: " + element);
            }
            values.add(element.asText());
        }
        return values;
    }
}
