package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.sql.NamedSql;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * A catalog statement whose shape varies per request: optional filters, IN lists of
 * generated bind markers. Templates only ever produce SQL structure; values travel as
 * {@code :name} binds of the rendered {@link NamedSql}. Use triple-stash for inserted
 * fragments so Handlebars does not HTML-escape quotes.
 */
public final class SqlTemplate {
    private static final Handlebars handlebars = new Handlebars();

    private final String source;
    private final Template template;

    private SqlTemplate(String source, Template template) {
        this.source = source;
        this.template = template;
    }

    public static SqlTemplate compile(String source) {
        try {
            return new SqlTemplate(source, handlebars.compileInline(source));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compile SQL template", e);
        }
    }

    public NamedSql render(Map<String, ?> context) {
        try {
            return NamedSql.parse(template.apply(context));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to apply SQL template", e);
        }
    }

    public String source() {
        return source;
    }
}
