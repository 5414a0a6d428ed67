package com.dbprobe.prober.connect;

import com.dbprobe.core.DialectKind;

/**
 * Everything needed to open a JDBC connection for one alias.
 *
 * @param username null when the URL carries the credentials
 */
public record ConnectionSettings(
        String alias,
        DialectKind dialect,
        String url,
        String username,
        String password
) {
    @Override
    public String toString() {
        return "ConnectionSettings[alias=" + alias + ", dialect=" + dialect + ", url=" + url
                + ", username=" + username + "]";
    }
}
