package tw.gc.arya.trader.history;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tw.gc.arya.trader.entities.Bar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads bars from a JSON array file, one element at a time.
 *
 * <pre>
 * [
 *   {"timestamp": "2024-03-04T18:00:00", "open": 1.0842, "high": 1.0851,
 *    "low": 1.0839, "close": 1.0848, "tickSize": 0.0001},
 *   ...
 * ]
 * </pre>
 *
 * {@code tickSize} may be omitted, in which case the instrument default is used.
 */
@Slf4j
public class JsonBarFeed implements BarFeed {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final BigDecimal defaultTickSize;

    public JsonBarFeed(Path file, ObjectMapper objectMapper, BigDecimal defaultTickSize) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.defaultTickSize = Objects.requireNonNull(defaultTickSize, "defaultTickSize");
    }

    @Override
    public Stream<Bar> stream() {
        if (!Files.isReadable(file)) {
            throw new UncheckedIOException(new IOException("Bar file not readable: " + file.toAbsolutePath()));
        }
        try {
            MappingIterator<Bar> iterator = objectMapper.readerFor(Bar.class).readValues(file.toFile());
            log.debug("Opened bar feed {}", file);
            return StreamSupport.stream(
                            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                            false)
                    .map(this::withTickSize)
                    .onClose(() -> closeQuietly(iterator));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open bar file " + file, e);
        }
    }

    @Override
    public String describe() {
        return "JSON bars " + file;
    }

    private Bar withTickSize(Bar bar) {
        if (bar.getTickSize() != null) {
            return bar;
        }
        return bar.toBuilder().tickSize(defaultTickSize).build();
    }

    private void closeQuietly(MappingIterator<Bar> iterator) {
        try {
            iterator.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close bar file {}: {}", file, e.getMessage());
        }
    }
}
