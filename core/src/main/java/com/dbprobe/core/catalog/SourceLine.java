package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SourceLine(
        @JsonProperty("line") int line,
        @JsonProperty("text") String text
) {}
