package infrastructure.io;

import domain.model.SensorRecord;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction for loading batches of sensor records.
 *
 * <p>Implementations parse the physical format and produce canonical
 * {@link SensorRecord}s ready for graph construction. The default file-based
 * implementation is {@link CsvSensorRecordReader}.
 *
 * @see CsvSensorRecordReader
 */
public interface SensorRecordReader {

    /**
     * Reads all records from the specified source.
     *
     * @param source source identifier (e.g., file path)
     * @return records in source order; never {@code null}
     * @throws IOException if the source cannot be read or is malformed
     */
    List<SensorRecord> readRecords(String source) throws IOException;
}
