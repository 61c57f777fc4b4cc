package com.questrail.lantern.sync;

/**
 * Response of the scoring service. The status code is informational; a
 * non-2xx code is not treated as a failure.
 */
public record SyncReceipt(int statusCode) {

    public boolean isSuccessStatus() {
        return statusCode >= 200 && statusCode < 300;
    }
}
