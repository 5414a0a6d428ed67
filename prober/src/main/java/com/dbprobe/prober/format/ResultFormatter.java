package com.dbprobe.prober.format;

import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.TableInfo;

import java.util.List;

/**
 * Renders operation results for printing. Implementations never touch the database.
 */
public interface ResultFormatter {

    String tableInfo(TableInfo info);

    String columnMatches(List<ColumnMatch> matches);

    String procedureMatches(List<ProcedureMatch> matches);

    String queryResult(QueryResult result);

    String executionPlan(ExecutionPlan plan);
}
