package db.minipg.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class FilterOperatorTest {

    private ListOperator students() {
        return new ListOperator(
            Map.of("id", 1L, "name", "Alice", "active", true),
            Map.of("id", 2L, "name", "Bob", "active", false),
            Map.of("id", 5L, "name", "Carol", "active", true),
            Map.of("id", 8L, "name", "Heidi", "active", true));
    }

    @Test
    void filterKeepsMatchingRowsInOrder() {
        Predicate p = CompoundPredicate.and(List.of(
            new ComparisonPredicate("active", ComparisonPredicate.Op.EQ, true),
            new ComparisonPredicate("id", ComparisonPredicate.Op.GTE, 5.0)));
        List<Row> rows = ListOperator.drain(new FilterOperator(students(), p));
        assertEquals(List.of("Carol", "Heidi"), rows.stream().map(r -> r.get("name")).toList());
    }

    @Test
    void limitStopsPullingOnceReached() {
        ListOperator source = students();
        List<Row> rows = ListOperator.drain(new LimitOperator(source, 2));
        assertEquals(2, rows.size());
        assertEquals(1L, rows.get(0).get("id"));
        assertTrue(ListOperator.drain(new LimitOperator(students(), 0)).isEmpty());
    }

    @Test
    void projectionRenamesAndExpandsTableWildcards() {
        ListOperator joined = new ListOperator(
            Map.of("u.id", 1L, "u.name", "Alice", "o.id", 10L, "o.total", 9.5));
        ProjectionOperator projection = new ProjectionOperator(joined, List.of(
            ProjectionOperator.Item.column("u.name", "u.name"),
            ProjectionOperator.Item.tableWildcard("o"),
            ProjectionOperator.Item.column("missing", "u.missing")));

        Row row = ListOperator.drain(projection).get(0);

        assertEquals("Alice", row.get("u.name"));
        assertEquals(10L, row.get("o.id"));
        assertEquals(9.5, row.get("o.total"));
        assertTrue(row.has("missing"));
        assertNull(row.get("missing"));
        assertFalse(row.has("u.id"));
    }

    @Test
    void rejectedRowsAreCountedPerOpen() {
        FilterOperator filter = new FilterOperator(students(),
            new ComparisonPredicate("active", ComparisonPredicate.Op.EQ, true));
        assertEquals(3, ListOperator.drain(filter).size());
        assertEquals(1, filter.rejectedRows());

        assertEquals(3, ListOperator.drain(filter).size());
        assertEquals(1, filter.rejectedRows());
    }
}
