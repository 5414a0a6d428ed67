package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A stored program found by a source search, with its complete source.
 *
 * @param matchCount          number of source lines that matched a search term; 0 for lookups by name
 * @param matchingLineNumbers the first matching line numbers, in line order
 * @param lines               the whole source body, possibly cut to a per-object line limit
 */
public record ProcedureMatch(
        @JsonProperty("schema") String schema,
        @JsonProperty("name") String name,
        @JsonProperty("type") ObjectType type,
        @JsonProperty("match_count") int matchCount,
        @JsonProperty("matching_line_numbers") List<Integer> matchingLineNumbers,
        @JsonProperty("lines") List<SourceLine> lines
) {
    public ProcedureMatch {
        matchingLineNumbers = List.copyOf(matchingLineNumbers);
        lines = List.copyOf(lines);
    }
}
