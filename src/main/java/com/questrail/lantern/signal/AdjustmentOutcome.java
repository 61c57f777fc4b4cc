package com.questrail.lantern.signal;

import com.questrail.lantern.api.ExternalSyncException;
import com.questrail.lantern.sync.SyncReceipt;

import java.util.Objects;

/**
 * AdjustmentOutcome
 * -----------------------------------------------------------------------------
 * Result of a signal write that was committed to the store.
 *
 * <p>The write and the push to the scoring service are two steps with separate
 * outcomes. {@link SyncFailed} means the new value <b>is</b> persisted but
 * the scoring service does not know about it; nothing is rolled back.</p>
 *
 * <p>Failures before the write (unknown station, store error) are thrown and
 * never produce an outcome.</p>
 */
public sealed interface AdjustmentOutcome
        permits AdjustmentOutcome.Committed, AdjustmentOutcome.SyncFailed
{
    int stationId();

    int previousValue();

    int newValue();

    /** Value persisted and pushed. */
    record Committed(int stationId, int previousValue, int newValue, SyncReceipt receipt)
            implements AdjustmentOutcome
    {
        public Committed {
            Objects.requireNonNull(receipt, "receipt");
        }
    }

    /** Value persisted, push failed. */
    record SyncFailed(int stationId, int previousValue, int newValue, ExternalSyncException failure)
            implements AdjustmentOutcome
    {
        public SyncFailed {
            Objects.requireNonNull(failure, "failure");
        }
    }
}
