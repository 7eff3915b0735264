package db.minipg.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.catalog.CatalogManager;
import db.minipg.catalog.TableSchema;
import db.minipg.exec.AggregateFunction;
import db.minipg.exec.FilterOperator;
import db.minipg.exec.GroupAggregateOperator;
import db.minipg.exec.GroupAggregateOperator.GroupKey;
import db.minipg.exec.GroupAggregateOperator.OutputColumn;
import db.minipg.exec.JoinOperator;
import db.minipg.exec.LimitOperator;
import db.minipg.exec.Operator;
import db.minipg.exec.Predicate;
import db.minipg.exec.ProjectionOperator;
import db.minipg.exec.SortOperator;
import db.minipg.exec.SortOperator.SortKey;
import db.minipg.exec.TableScanOperator;
import db.minipg.storage.StorageBackend;

/**
 * Builds the operator pipeline for a {@link SelectPlan}.
 *
 * Strategy:
 * <ol>
 *   <li>validate every referenced table and column against the catalog;</li>
 *   <li>scan the base table (columns prefixed with the table name when there are joins);</li>
 *   <li>nested-loop join each joined table;</li>
 *   <li>sort, unless the requested order is the table's declared order;</li>
 *   <li>GROUP BY: group, filtering each group with WHERE; otherwise filter, then
 *       aggregate or project;</li>
 *   <li>limit.</li>
 * </ol>
 */
public class SelectPlanner {
    private static final Logger log = LoggerFactory.getLogger(SelectPlanner.class);

    private final CatalogManager catalog;
    private final StorageBackend storage;
    private final PredicateCompiler predicateCompiler;

    public SelectPlanner(CatalogManager catalog, StorageBackend storage, PredicateCompiler predicateCompiler) {
        this.catalog = catalog;
        this.storage = storage;
        this.predicateCompiler = predicateCompiler;
    }

    public Operator plan(SelectPlan plan) {
        Scope scope = resolveTables(plan);
        validateSelectList(plan, scope);

        Operator root = new TableScanOperator(storage, plan.from(), scope.prefixed ? plan.from() : null);
        for (Map.Entry<String, JoinSpec> e : plan.joins().entrySet()) {
            String joinTable = e.getKey();
            JoinSpec spec = e.getValue();
            String leftTable = spec.leftTable() != null ? spec.leftTable() : plan.from();
            Operator right = new TableScanOperator(storage, joinTable, joinTable);
            root = new JoinOperator(root, right, leftTable + "." + spec.leftColumn(), joinTable + "." + spec.rightColumn());
        }

        root = order(plan, scope, root);

        Predicate where = predicateCompiler.compile(plan.where(), scope::key);
        if (plan.groupBy() != null) {
            root = group(plan, scope, root, where);
        } else {
            if (where != null) root = new FilterOperator(root, where);
            root = hasAggregate(plan)
                ? new GroupAggregateOperator(root, List.of(), outputColumns(plan, scope), null)
                : project(plan, scope, root);
        }

        if (plan.limit() != null) {
            if (plan.limit() < 0) throw DbException.planError("LIMIT must not be negative: " + plan.limit());
            root = new LimitOperator(root, plan.limit());
        }
        return root;
    }

    private Scope resolveTables(SelectPlan plan) {
        Map<String, TableSchema> tables = new LinkedHashMap<>();
        TableSchema base = catalog.getTableSchema(plan.from());
        if (base == null) throw DbException.tableNotFound(plan.from());
        tables.put(plan.from(), base);
        for (Map.Entry<String, JoinSpec> e : plan.joins().entrySet()) {
            String joinTable = e.getKey();
            TableSchema joined = catalog.getTableSchema(joinTable);
            if (joined == null) throw DbException.tableNotFound(joinTable);

            JoinSpec spec = e.getValue();
            String leftTable = spec.leftTable() != null ? spec.leftTable() : plan.from();
            TableSchema left = tables.get(leftTable);
            if (left == null) throw DbException.planError("Join condition references table '" + leftTable + "' before it is joined");
            if (!left.hasColumn(spec.leftColumn())) throw DbException.columnNotFound(spec.leftColumn(), leftTable);
            if (spec.rightTable() != null && !spec.rightTable().equals(joinTable)) {
                throw DbException.planError("Join condition for '" + joinTable + "' does not reference it");
            }
            if (!joined.hasColumn(spec.rightColumn())) throw DbException.columnNotFound(spec.rightColumn(), joinTable);
            tables.put(joinTable, joined);
        }
        return new Scope(plan.from(), tables, plan.hasJoins());
    }

    private void validateSelectList(SelectPlan plan, Scope scope) {
        for (String item : plan.select()) {
            if (item.equals("*")) continue;
            if (item.endsWith(".*")) {
                String table = item.substring(0, item.length() - 2);
                if (!scope.tables.containsKey(table)) throw DbException.tableNotFound(table);
                continue;
            }
            AggregateFunction.Call call = AggregateFunction.parse(item);
            if (call != null) {
                if (call.isStar()) {
                    if (call.function() != AggregateFunction.COUNT) {
                        throw DbException.planError(call.function() + "(*) requires a column argument");
                    }
                } else {
                    scope.requireColumn(call.argument());
                }
                continue;
            }
            scope.requireColumn(item);
        }
        if (hasAggregate(plan) && plan.groupBy() == null && plan.select().size() > 1) {
            throw new DbException(ErrorKind.AGGREGATE_REQUIRES_GROUP_BY,
                "Aggregate functions require GROUP BY when more than one column is selected");
        }
        if (plan.groupBy() != null) {
            for (String entry : plan.groupBy()) scope.requireColumn(stripDirection(entry));
        }
        if (plan.orderBy() != null) {
            for (String entry : plan.orderBy()) scope.requireColumn(stripDirection(entry));
        }
    }

    private Operator order(SelectPlan plan, Scope scope, Operator root) {
        if (plan.orderBy() == null || plan.orderBy().isEmpty()) return root;
        if (plan.orderBy().size() == 1 && matchesDeclaredSort(plan.orderBy().get(0), scope)) {
            log.debug("ORDER BY {} matches declared sort of {}, streaming", plan.orderBy(), plan.from());
            return root;
        }
        List<SortKey> keys = new ArrayList<>();
        for (String entry : plan.orderBy()) {
            keys.add(new SortKey(scope.key(stripDirection(entry)), isDescending(entry)));
        }
        log.debug("Sorting {} by {}", plan.from(), keys);
        return new SortOperator(root, keys);
    }

    private static boolean matchesDeclaredSort(String entry, Scope scope) {
        String declared = scope.base().sort();
        if (declared == null) return false;
        String column = stripDirection(entry);
        String qualifier = scope.from + ".";
        if (column.startsWith(qualifier)) column = column.substring(qualifier.length());
        String requested = column + (isDescending(entry) ? " DESC" : " ASC");
        return requested.equalsIgnoreCase(declared.trim().replaceAll("\\s+", " "));
    }

    private Operator group(SelectPlan plan, Scope scope, Operator root, Predicate where) {
        List<GroupKey> keys = new ArrayList<>();
        for (String entry : plan.groupBy()) {
            String column = stripDirection(entry);
            keys.add(new GroupKey(column, scope.key(column)));
        }
        return new GroupAggregateOperator(root, keys, outputColumns(plan, scope), where);
    }

    private List<OutputColumn> outputColumns(SelectPlan plan, Scope scope) {
        List<OutputColumn> outputs = new ArrayList<>();
        for (String item : plan.select()) {
            if (item.equals("*")) {
                outputs.add(OutputColumn.all());
                continue;
            }
            if (item.endsWith(".*")) {
                throw DbException.planError("'" + item + "' cannot be combined with aggregation");
            }
            AggregateFunction.Call call = AggregateFunction.parse(item);
            if (call != null) {
                outputs.add(OutputColumn.aggregate(item, call.function(), call.isStar() ? null : scope.key(call.argument())));
            } else {
                outputs.add(OutputColumn.plain(item, scope.key(item)));
            }
        }
        return outputs;
    }

    private Operator project(SelectPlan plan, Scope scope, Operator root) {
        if (plan.isSelectAll()) return root;
        List<ProjectionOperator.Item> items = new ArrayList<>();
        for (String item : plan.select()) {
            if (item.equals("*")) {
                for (String table : scope.tables.keySet()) items.addAll(tableItems(table, scope));
            } else if (item.endsWith(".*")) {
                items.addAll(tableItems(item.substring(0, item.length() - 2), scope));
            } else {
                items.add(ProjectionOperator.Item.column(item, scope.key(item)));
            }
        }
        return new ProjectionOperator(root, items);
    }

    // Unprefixed rows carry bare column names, so a table wildcard expands to its columns.
    private static List<ProjectionOperator.Item> tableItems(String table, Scope scope) {
        if (scope.prefixed) return List.of(ProjectionOperator.Item.tableWildcard(table));
        List<ProjectionOperator.Item> items = new ArrayList<>();
        items.add(ProjectionOperator.Item.column(TableSchema.ID_COLUMN, TableSchema.ID_COLUMN));
        for (String column : scope.tables.get(table).columns().keySet()) {
            if (!column.equals(TableSchema.ID_COLUMN)) items.add(ProjectionOperator.Item.column(column, column));
        }
        return items;
    }

    private static boolean hasAggregate(SelectPlan plan) {
        for (String item : plan.select()) {
            if (AggregateFunction.isAggregate(item)) return true;
        }
        return false;
    }

    static String stripDirection(String entry) {
        String e = entry.trim();
        String upper = e.toUpperCase(Locale.ROOT);
        if (upper.endsWith(" DESC")) return e.substring(0, e.length() - 5).trim();
        if (upper.endsWith(" ASC")) return e.substring(0, e.length() - 4).trim();
        return e;
    }

    static boolean isDescending(String entry) {
        return entry.trim().toUpperCase(Locale.ROOT).endsWith(" DESC");
    }

    /**
     * Tables visible to one SELECT and the mapping from written column names to row keys.
     * Without joins rows carry bare column names; with joins every key is {@code table.column}.
     */
    private static final class Scope {
        private final String from;
        private final Map<String, TableSchema> tables;
        private final boolean prefixed;

        Scope(String from, Map<String, TableSchema> tables, boolean prefixed) {
            this.from = from;
            this.tables = tables;
            this.prefixed = prefixed;
        }

        TableSchema base() {
            return tables.get(from);
        }

        String key(String column) {
            int dot = column.lastIndexOf('.');
            if (dot >= 0) {
                String table = column.substring(0, dot);
                String name = column.substring(dot + 1);
                if (!prefixed && table.equals(from)) return name;
                return column;
            }
            if (!prefixed) return column;
            for (Map.Entry<String, TableSchema> e : tables.entrySet()) {
                if (e.getValue().hasColumn(column)) return e.getKey() + "." + column;
            }
            return column;
        }

        void requireColumn(String column) {
            int dot = column.lastIndexOf('.');
            if (dot >= 0) {
                String table = column.substring(0, dot);
                String name = column.substring(dot + 1);
                TableSchema schema = tables.get(table);
                if (schema == null) throw DbException.tableNotFound(table);
                if (!schema.hasColumn(name)) throw DbException.columnNotFound(name, table);
                return;
            }
            for (TableSchema schema : tables.values()) {
                if (schema.hasColumn(column)) return;
            }
            throw DbException.columnNotFound(column, from);
        }
    }
}
