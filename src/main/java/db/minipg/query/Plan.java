package db.minipg.query;

/** Compiled form of one statement: a {@link SelectPlan}, {@link InsertPlan} or {@link CreateTablePlan}. */
public interface Plan {}
