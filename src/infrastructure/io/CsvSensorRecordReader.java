package infrastructure.io;

import domain.model.SensorRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * CSV implementation of {@link SensorRecordReader}.
 *
 * <p>The first line is a header. Three columns are required (names configurable):
 * <pre>
 *   Timestamp,Machine_ID,Failure_Status,Temperature,Vibration_Level,...
 * </pre>
 * All other columns are sensors, unless an explicit sensor list was given.
 *
 * <h3>Time key</h3>
 * ISO-8601 date or date-time first: {@code 'T'} or a space between date and time,
 * optional fractional seconds, optional {@code Z}/{@code +HH:MM} offset. Values without
 * an offset are read as UTC and a bare date as its midnight; the key is epoch
 * milliseconds. Otherwise a plain number (runtime hours, row order, ...). An unparseable
 * time value fails the whole read.
 *
 * <h3>Error handling</h3>
 * <ul>
 *   <li>Missing required column → {@link IOException}.</li>
 *   <li>Empty or non-numeric sensor cell → sensor omitted from that record.</li>
 *   <li>Short rows keep the cells they have; missing trailing sensors are absent.
 *       A row without a required cell → {@link IOException}.</li>
 *   <li>Empty lines are ignored.</li>
 * </ul>
 */
public final class CsvSensorRecordReader implements SensorRecordReader {

    public static final String DEFAULT_TIME_COLUMN = "Timestamp";
    public static final String DEFAULT_MACHINE_COLUMN = "Machine_ID";
    public static final String DEFAULT_FAILURE_COLUMN = "Failure_Status";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT)
        .withChronology(IsoChronology.INSTANCE);

    private final String timeColumn;
    private final String machineColumn;
    private final String failureColumn;
    /** {@code null} means every non-required column is a sensor. */
    private final List<String> sensorColumns;

    public CsvSensorRecordReader() {
        this(DEFAULT_TIME_COLUMN, DEFAULT_MACHINE_COLUMN, DEFAULT_FAILURE_COLUMN, null);
    }

    /**
     * @param sensorColumns sensors to read, or {@code null} for all remaining columns
     */
    public CsvSensorRecordReader(String timeColumn,
                                 String machineColumn,
                                 String failureColumn,
                                 List<String> sensorColumns) {
        this.timeColumn = Objects.requireNonNull(timeColumn, "timeColumn");
        this.machineColumn = Objects.requireNonNull(machineColumn, "machineColumn");
        this.failureColumn = Objects.requireNonNull(failureColumn, "failureColumn");
        this.sensorColumns = sensorColumns == null ? null : new ArrayList<>(sensorColumns);
    }

    @Override
    public List<SensorRecord> readRecords(String filePath) throws IOException {
        List<SensorRecord> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new IOException("Empty records file: " + filePath);
            }
            List<String> header = splitLine(stripBom(headerLine));

            int timeIdx = requireColumn(header, timeColumn, filePath);
            int machineIdx = requireColumn(header, machineColumn, filePath);
            int failureIdx = requireColumn(header, failureColumn, filePath);
            Map<String, Integer> sensorIdx = resolveSensors(header, timeIdx, machineIdx, failureIdx, filePath);

            String line;
            int lineNumber = 1;
            int row = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) continue;

                List<String> cells = splitLine(line);
                double timeKey = parseTimeKey(requireCell(cells, timeIdx, timeColumn, lineNumber), row, lineNumber);
                String machineId = requireCell(cells, machineIdx, machineColumn, lineNumber).trim();
                boolean failure = parseFailure(requireCell(cells, failureIdx, failureColumn, lineNumber));

                Map<String, Double> sensors = new LinkedHashMap<>();
                for (Map.Entry<String, Integer> e : sensorIdx.entrySet()) {
                    if (e.getValue() >= cells.size()) continue;
                    Double value = parseSensor(cells.get(e.getValue()));
                    if (value != null) {
                        sensors.put(e.getKey(), value);
                    }
                }

                records.add(new SensorRecord(machineId, timeKey, sensors, failure));
                row++;
            }
        }

        return records;
    }

    private Map<String, Integer> resolveSensors(List<String> header,
                                                int timeIdx, int machineIdx, int failureIdx,
                                                String filePath) throws IOException {
        Map<String, Integer> sensorIdx = new LinkedHashMap<>();
        if (sensorColumns != null) {
            for (String sensor : sensorColumns) {
                sensorIdx.put(sensor, requireColumn(header, sensor, filePath));
            }
            return sensorIdx;
        }
        for (int i = 0; i < header.size(); i++) {
            if (i == timeIdx || i == machineIdx || i == failureIdx) continue;
            sensorIdx.put(header.get(i), i);
        }
        return sensorIdx;
    }

    private static int requireColumn(List<String> header, String column, String filePath) throws IOException {
        int idx = header.indexOf(column);
        if (idx < 0) {
            throw new IOException("Missing required column '" + column + "' in " + filePath);
        }
        return idx;
    }

    private static String requireCell(List<String> cells, int idx, String column, int lineNumber)
            throws IOException {
        if (idx >= cells.size()) {
            throw new IOException("Line " + lineNumber + " has no value for column '" + column + "'");
        }
        return cells.get(idx);
    }

    /**
     * Parses a time cell; an empty cell falls back to the row index.
     */
    static double parseTimeKey(String raw, int row, int lineNumber) throws IOException {
        String value = raw.trim();
        if (value.isEmpty()) {
            return row;
        }

        DateTimeParseException notTimestamp;
        try {
            return toEpochMillis(TIMESTAMP_FORMAT.parseBest(value,
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from));
        } catch (DateTimeParseException e) {
            notTimestamp = e;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            IOException failure = new IOException(
                "Unparseable time value '" + value + "' on line " + lineNumber, e);
            failure.addSuppressed(notTimestamp);
            throw failure;
        }
    }

    private static long toEpochMillis(TemporalAccessor parsed) {
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant().toEpochMilli();
        }
        if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    static Double parseSensor(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) return null;
        try {
            double parsed = Double.parseDouble(value);
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            // Malformed cell: sensor is omitted from this record
            return null;
        }
    }

    static boolean parseFailure(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return value.equals("1") || value.equals("true") || value.equals("yes");
    }

    /**
     * Splits one CSV line on commas, honoring double-quoted cells ({@code ""} escapes a quote).
     */
    static List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
