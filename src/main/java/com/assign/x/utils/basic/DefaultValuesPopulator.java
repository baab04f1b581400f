package com.assign.x.utils.basic;

import java.time.LocalDateTime;
import java.util.UUID;

public final class DefaultValuesPopulator {

    private DefaultValuesPopulator() {
        throw new UnsupportedOperationException("Operation not supported");
    }

    public static LocalDateTime getCurrentTimestamp() {
        return LocalDateTime.now();
    }

    public static String getUid() {
        return UUID.randomUUID().toString();
    }
}
