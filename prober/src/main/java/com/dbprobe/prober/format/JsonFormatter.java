package com.dbprobe.prober.format;

import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.TableInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.List;

public class JsonFormatter implements ResultFormatter {
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String tableInfo(TableInfo info) {
        return write(info);
    }

    @Override
    public String columnMatches(List<ColumnMatch> matches) {
        return write(matches);
    }

    @Override
    public String procedureMatches(List<ProcedureMatch> matches) {
        return write(matches);
    }

    @Override
    public String queryResult(QueryResult result) {
        return write(result);
    }

    @Override
    public String executionPlan(ExecutionPlan plan) {
        return write(plan);
    }

    private static String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON", e);
        }
    }
}
