package cli;

import application.SearchParameters;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentParserTest {

    @Test
    void parsesPositionalArgumentsAndFlags() {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(new String[] {
            "records.csv", "graph.json", "search.json",
            "--debug", "--strategy", "a_star", "--seed", "42", "-o", "out", "--max-records", "500", "--parallel"
        });

        assertThat(parser.getRecordsFile()).isEqualTo("records.csv");
        assertThat(parser.getGraphConfigFile()).isEqualTo("graph.json");
        assertThat(parser.getSearchParamsFile()).isEqualTo("search.json");
        assertThat(parser.isDebugMode()).isTrue();
        assertThat(parser.getStrategy()).isEqualTo(SearchParameters.DiscoveryStrategy.A_STAR);
        assertThat(parser.getSeed()).isEqualTo(42L);
        assertThat(parser.getOutputDir()).isEqualTo("out");
        assertThat(parser.getMaxRecords()).isEqualTo(500);
        assertThat(parser.isParallel()).isTrue();
    }

    @Test
    void overridesApplyOnTopOfBuilder() {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(new String[] {"r.csv", "g.json", "s.json", "--strategy", "DEPTH_FIRST"});

        SearchParameters params = parser.applyOverrides(new SearchParameters.Builder().setMaxDepth(9)).build();

        assertThat(params.getMaxDepth()).isEqualTo(9);
        assertThat(params.getDiscoveryStrategy()).isEqualTo(SearchParameters.DiscoveryStrategy.DEPTH_FIRST);
        assertThat(params.getMaxRecords()).isEqualTo(1000);
        assertThat(parser.getSeed()).isNull();
    }

    @Test
    void helpNeedsNoOtherArguments() {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(new String[] {"--help"});

        assertThat(parser.isHelpRequested()).isTrue();
    }

    @Test
    void rejectsMissingAndInvalidArguments() {
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r.csv", "g.json"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Missing required arguments");
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r", "g", "s", "--strategy", "BEST"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown strategy: BEST");
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r", "g", "s", "--seed", "x"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid seed");
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r", "g", "s", "--max-records", "0"}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r", "g", "s", "--output-dir"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("--output-dir");
        assertThatThrownBy(() -> new ArgumentParser().parse(new String[] {"r", "g", "s", "--verbose"}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown argument: --verbose");
    }
}
