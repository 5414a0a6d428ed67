package com.dbprobe.prober.connect;

import com.dbprobe.core.DialectKind;

public record ConfiguredAlias(String alias, DialectKind dialect) {}
