package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * Counters of one reconciliation pass.
 *
 * @param checked       credentials looked at
 * @param present       confirmed present remotely
 * @param markedMissing first missing observation recorded
 * @param cleared       missing mark cleared because the credential came back
 * @param deleted       deleted after the grace window
 * @param unknown       remote check failed; nothing changed
 * @param skipped       changed concurrently or still within the grace window
 */
public record ReconciliationReport(
        int checked,
        int present,
        int markedMissing,
        int cleared,
        int deleted,
        int unknown,
        int skipped
) {

    public static ReconciliationReport empty() {
        return new ReconciliationReport(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Adds one credential's transition to the counters.
     *
     * @param t transition
     * @return new report
     */
    public ReconciliationReport plus(Transition t) {
        return new ReconciliationReport(
                checked + 1,
                present + (t == Transition.PRESENT ? 1 : 0),
                markedMissing + (t == Transition.MARKED_MISSING ? 1 : 0),
                cleared + (t == Transition.CLEARED ? 1 : 0),
                deleted + (t == Transition.DELETED ? 1 : 0),
                unknown + (t == Transition.UNKNOWN ? 1 : 0),
                skipped + (t == Transition.SKIPPED ? 1 : 0)
        );
    }

    /**
     * What reconciliation did to one credential.
     */
    public enum Transition {
        PRESENT,
        CLEARED,
        MARKED_MISSING,
        DELETED,
        UNKNOWN,
        SKIPPED
    }
}
