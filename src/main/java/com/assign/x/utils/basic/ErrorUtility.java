package com.assign.x.utils.basic;

import com.assign.x.models.Error;
import org.springframework.http.HttpStatus;

public final class ErrorUtility {

    private ErrorUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Gets error.
     *
     * @param errorMsg the error msg
     * @param status   the status
     * @return the error
     */
    public static Error getError(String errorMsg, HttpStatus status) {
        return Error.builder()
                .errorMsg(errorMsg).uid(DefaultValuesPopulator.getUid())
                .status(status).timestamp(DefaultValuesPopulator.getCurrentTimestamp())
                .build();
    }
}
