package com.dbprobe.prober.format;

public enum OutputFormat {
    TEXT,
    MARKDOWN,
    JSON;

    public ResultFormatter formatter() {
        return switch (this) {
            case TEXT -> new TextFormatter();
            case MARKDOWN -> new MarkdownFormatter();
            case JSON -> new JsonFormatter();
        };
    }
}
