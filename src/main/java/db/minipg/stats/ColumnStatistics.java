package db.minipg.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.annotations.SerializedName;

/**
 * Per-column statistics over the non-null values of a full scan. {@code valFreq} is keyed
 * by the value's JSON text, in the order values were first seen; {@code mode} is the most
 * frequent value (earliest seen on ties).
 */
public record ColumnStatistics(Object min, Object max, long count, Object mode,
                               @SerializedName("val_freq") Map<String, Long> valFreq) {

    public ColumnStatistics {
        valFreq = Collections.unmodifiableMap(new LinkedHashMap<>(valFreq == null ? Map.of() : valFreq));
    }

    public long frequency(String valueKey) {
        return valFreq.getOrDefault(valueKey, 0L);
    }
}
