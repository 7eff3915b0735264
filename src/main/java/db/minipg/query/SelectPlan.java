package db.minipg.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled SELECT. {@code joins} is keyed by joined table in statement order.
 * {@code where} is the clause text without the WHERE keyword; {@code groupBy},
 * {@code orderBy} and {@code limit} are null when absent. Order and group entries keep
 * their {@code "<column> [ASC|DESC]"} text.
 */
public record SelectPlan(List<String> select, String from, Map<String, JoinSpec> joins, String where,
                         List<String> groupBy, List<String> orderBy, Integer limit) implements Plan {

    public SelectPlan {
        select = List.copyOf(select);
        joins = Collections.unmodifiableMap(new LinkedHashMap<>(joins == null ? Map.of() : joins));
        groupBy = groupBy == null ? null : List.copyOf(groupBy);
        orderBy = orderBy == null ? null : List.copyOf(orderBy);
    }

    public boolean hasJoins() {
        return !joins.isEmpty();
    }

    public boolean isSelectAll() {
        return select.equals(List.of("*"));
    }
}
