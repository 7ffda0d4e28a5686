package domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical historical sensor reading, the single input format of the discovery engine.
 *
 * <p>Every data source (timestamped, runtime-based, row-ordered) is normalized to this
 * shape by a {@link infrastructure.io.SensorRecordReader} before graph construction.
 *
 * <ul>
 *   <li><b>machineId</b>: equipment identifier; records are grouped by it.</li>
 *   <li><b>timeKey</b>: totally ordered position in time: epoch milliseconds for
 *       timestamps, elapsed hours for runtime data, or a row index. Only comparable
 *       between records of the same machine.</li>
 *   <li><b>sensors</b>: sensor name → numeric value (insertion-ordered).</li>
 *   <li><b>failure</b>: whether this reading coincides with a failure event.</li>
 * </ul>
 *
 * <p>Immutable.
 */
public final class SensorRecord {

    private final String machineId;
    private final double timeKey;
    private final Map<String, Double> sensors;
    private final boolean failure;

    public SensorRecord(String machineId, double timeKey, Map<String, Double> sensors, boolean failure) {
        if (machineId == null || machineId.isEmpty()) {
            throw new IllegalArgumentException("machineId cannot be null or empty");
        }
        this.machineId = machineId;
        this.timeKey = timeKey;
        this.sensors = Collections.unmodifiableMap(
            sensors == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sensors));
        this.failure = failure;
    }

    public String getMachineId() { return machineId; }
    public double getTimeKey() { return timeKey; }
    public Map<String, Double> getSensors() { return sensors; }
    public boolean isFailure() { return failure; }

    @Override
    public String toString() {
        return "SensorRecord{machine=" + machineId + ", time=" + timeKey
            + ", sensors=" + sensors.size() + ", failure=" + failure + "}";
    }
}
