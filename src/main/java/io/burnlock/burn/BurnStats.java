package io.burnlock.burn;

import java.util.List;

/**
 * Diagnostic snapshot of the pending-burn index. Stale the moment it is returned.
 */
public record BurnStats(int scheduledCount, List<Entry> scheduled) {

    public record Entry(
            String messageId,
            String conversationId,
            long scheduledBurnAt,
            long remainingMs,
            int failedAttempts,
            String state
    ) {
    }
}
