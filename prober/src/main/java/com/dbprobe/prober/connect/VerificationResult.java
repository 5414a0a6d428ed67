package com.dbprobe.prober.connect;

import com.dbprobe.core.DialectKind;

/**
 * @param error null when the ping succeeded
 */
public record VerificationResult(String alias, DialectKind dialect, String error) {

    public boolean ok() {
        return error == null;
    }
}
