package cli;

import application.GraphConfiguration;
import application.SearchParameters;
import domain.model.SensorRecord;
import infrastructure.io.CsvSensorRecordReader;
import infrastructure.io.JsonConfigurationReader;
import infrastructure.io.SensorRecordReader;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Loads the three CLI inputs: records, graph configuration and search parameters.
 *
 * <p>All file I/O errors are propagated as {@link IOException}; invalid configuration
 * values as {@link IllegalArgumentException}.
 *
 * <h3>Usage example</h3>
 * <pre>
 *   DataLoader loader = new DataLoader();
 *   DiscoveryInput input = loader.loadAll("records.csv", "graph.json", "search.json",
 *       new SearchParameters.Builder());
 * </pre>
 */
public final class DataLoader {

    /**
     * Immutable container for loaded discovery inputs.
     */
    public static final class DiscoveryInput {
        private final List<SensorRecord> records;
        private final GraphConfiguration graphConfiguration;
        private final SearchParameters searchParameters;

        public DiscoveryInput(List<SensorRecord> records,
                              GraphConfiguration graphConfiguration,
                              SearchParameters searchParameters) {
            if (records == null || graphConfiguration == null || searchParameters == null) {
                throw new IllegalArgumentException("records and configurations cannot be null");
            }
            this.records = records;
            this.graphConfiguration = graphConfiguration;
            this.searchParameters = searchParameters;
        }

        public List<SensorRecord> getRecords() { return records; }
        public GraphConfiguration getGraphConfiguration() { return graphConfiguration; }
        public SearchParameters getSearchParameters() { return searchParameters; }

        /**
         * @return number of loaded records (before sampling)
         */
        public int getRecordCount() { return records.size(); }
    }

    private final SensorRecordReader recordReader;
    private final JsonConfigurationReader configReader;

    public DataLoader() {
        this(new CsvSensorRecordReader(), new JsonConfigurationReader());
    }

    public DataLoader(SensorRecordReader recordReader, JsonConfigurationReader configReader) {
        this.recordReader = recordReader;
        this.configReader = configReader;
    }

    public List<SensorRecord> loadRecords(String recordsPath) throws IOException {
        validateFilePath(recordsPath, "Records file path");
        return recordReader.readRecords(recordsPath);
    }

    public GraphConfiguration loadGraphConfiguration(String configPath) throws IOException {
        validateFilePath(configPath, "Graph configuration path");
        return configReader.readGraphConfiguration(Paths.get(configPath));
    }

    /**
     * @param defaults builder holding values for keys the file leaves out
     */
    public SearchParameters loadSearchParameters(String paramsPath, SearchParameters.Builder defaults)
            throws IOException {
        validateFilePath(paramsPath, "Search parameters path");
        return configReader.readSearchParameters(Paths.get(paramsPath), defaults);
    }

    /**
     * Loads configuration first, so malformed configuration fails before the records
     * file is read.
     */
    public DiscoveryInput loadAll(String recordsPath,
                                  String graphConfigPath,
                                  String searchParamsPath,
                                  SearchParameters.Builder defaults) throws IOException {
        GraphConfiguration graphConfig = loadGraphConfiguration(graphConfigPath);
        SearchParameters params = loadSearchParameters(searchParamsPath, defaults);
        List<SensorRecord> records = loadRecords(recordsPath);
        return new DiscoveryInput(records, graphConfig, params);
    }

    private void validateFilePath(String path, String paramName) {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " cannot be null or empty");
        }
    }
}
