package db.minipg.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import db.minipg.exec.GroupAggregateOperator.GroupKey;
import db.minipg.exec.GroupAggregateOperator.OutputColumn;

public class GroupAggregateOperatorTest {

    private ListOperator users() {
        return new ListOperator(
            Map.of("id", 1L, "name", "John", "age", 50L),
            Map.of("id", 2L, "name", "Jane", "age", 51L),
            Map.of("id", 3L, "name", "John", "age", 20L));
    }

    @Test
    void groupsInFirstSeenOrderWithCounts() {
        GroupAggregateOperator op = new GroupAggregateOperator(users(),
            List.of(new GroupKey("name", "name")),
            List.of(OutputColumn.plain("name", "name"), OutputColumn.aggregate("COUNT(*)", AggregateFunction.COUNT, null)),
            null);

        List<Row> rows = ListOperator.drain(op);

        assertEquals(2, rows.size());
        assertEquals(Map.of("name", "John", "COUNT(*)", 2L), rows.get(0).values());
        assertEquals(Map.of("name", "Jane", "COUNT(*)", 1L), rows.get(1).values());
        assertEquals(List.of("name", "COUNT(*)"), List.copyOf(rows.get(0).columns()));
    }

    @Test
    void filterAppliesPerGroupAndDropsEmptyGroups() {
        Predicate adults = new ComparisonPredicate("age", ComparisonPredicate.Op.GTE, 50.0);
        GroupAggregateOperator op = new GroupAggregateOperator(users(),
            List.of(new GroupKey("name", "name")),
            List.of(OutputColumn.aggregate("MIN(age)", AggregateFunction.MIN, "age")),
            adults);

        List<Row> rows = ListOperator.drain(op);

        assertEquals(2, rows.size());
        assertEquals(50L, rows.get(0).get("MIN(age)"));
        assertEquals(51L, rows.get(1).get("MIN(age)"));

        Predicate nobody = new ComparisonPredicate("age", ComparisonPredicate.Op.GT, 100.0);
        GroupAggregateOperator none = new GroupAggregateOperator(users(),
            List.of(new GroupKey("name", "name")),
            List.of(OutputColumn.aggregate("COUNT(*)", AggregateFunction.COUNT, null)),
            nobody);
        assertTrue(ListOperator.drain(none).isEmpty());
    }

    @Test
    void ungroupedAggregateAlwaysEmitsOneRow() {
        GroupAggregateOperator op = new GroupAggregateOperator(new ListOperator(),
            List.of(),
            List.of(OutputColumn.aggregate("COUNT(*)", AggregateFunction.COUNT, null)),
            null);
        List<Row> rows = ListOperator.drain(op);
        assertEquals(1, rows.size());
        assertEquals(0L, rows.get(0).get("COUNT(*)"));
    }
}
