package db.minipg.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.annotations.SerializedName;

/** Statistics document of one table, recomputed wholesale by a full scan. */
public record TableStatistics(@SerializedName("row_count") long rowCount,
                              @SerializedName("column_stats") Map<String, ColumnStatistics> columnStats) {

    public TableStatistics {
        columnStats = Collections.unmodifiableMap(new LinkedHashMap<>(columnStats == null ? Map.of() : columnStats));
    }

    public ColumnStatistics column(String name) {
        return columnStats.get(name);
    }
}
