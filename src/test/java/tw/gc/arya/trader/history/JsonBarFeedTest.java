package tw.gc.arya.trader.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.arya.trader.entities.Bar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonBarFeedTest {

    private static final BigDecimal DEFAULT_TICK = new BigDecimal("0.0001");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @Test
    void stream_readsBarsInFileOrder() throws IOException {
        Path file = write("""
                [
                  {"timestamp": "2024-03-04T18:00:00", "open": 1.0842, "high": 1.0851,
                   "low": 1.0839, "close": 1.0848, "tickSize": 0.00005},
                  {"timestamp": "2024-03-04T18:30:00", "open": 1.0848, "high": 1.0860,
                   "low": 1.0845, "close": 1.0857}
                ]
                """);
        JsonBarFeed feed = new JsonBarFeed(file, objectMapper, DEFAULT_TICK);

        List<Bar> bars;
        try (Stream<Bar> stream = feed.stream()) {
            bars = stream.collect(Collectors.toList());
        }

        assertThat(bars).hasSize(2);
        Bar first = bars.get(0);
        assertThat(first.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 4, 18, 0));
        assertThat(first.getOpen()).isEqualByComparingTo("1.0842");
        assertThat(first.getHigh()).isEqualByComparingTo("1.0851");
        assertThat(first.getLow()).isEqualByComparingTo("1.0839");
        assertThat(first.getClose()).isEqualByComparingTo("1.0848");
        assertThat(first.getTickSize()).isEqualByComparingTo("0.00005");
        assertThat(bars.get(1).getTickSize()).isEqualByComparingTo(DEFAULT_TICK);
    }

    @Test
    void stream_canBeReplayed() throws IOException {
        Path file = write("""
                [
                  {"timestamp": "2024-03-04T18:00:00", "open": 1.1, "high": 1.2, "low": 1.0, "close": 1.1},
                  {"timestamp": "2024-03-04T18:30:00", "open": 1.1, "high": 1.2, "low": 1.0, "close": 1.1},
                  {"timestamp": "2024-03-04T19:00:00", "open": 1.1, "high": 1.2, "low": 1.0, "close": 1.1}
                ]
                """);
        JsonBarFeed feed = new JsonBarFeed(file, objectMapper, DEFAULT_TICK);

        try (Stream<Bar> first = feed.stream(); Stream<Bar> second = feed.stream()) {
            assertThat(first.count()).isEqualTo(3);
            assertThat(second.count()).isEqualTo(3);
        }
    }

    @Test
    void stream_emptyArrayYieldsNoBars() throws IOException {
        JsonBarFeed feed = new JsonBarFeed(write("[]"), objectMapper, DEFAULT_TICK);

        try (Stream<Bar> stream = feed.stream()) {
            assertThat(stream.count()).isZero();
        }
    }

    @Test
    void stream_missingFileThrows() {
        JsonBarFeed feed = new JsonBarFeed(tempDir.resolve("missing.json"), objectMapper, DEFAULT_TICK);

        assertThatThrownBy(feed::stream)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.json");
    }

    @Test
    void describe_namesFile() throws IOException {
        Path file = write("[]");

        assertThat(new JsonBarFeed(file, objectMapper, DEFAULT_TICK).describe()).contains("bars.json");
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("bars.json");
        Files.writeString(file, json);
        return file;
    }
}
