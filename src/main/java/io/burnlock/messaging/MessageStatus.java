package io.burnlock.messaging;

import io.burnlock.model.LockVerdict;
import io.burnlock.model.MessageView;

/**
 * Message metadata plus its time-lock verdict at {@code evaluatedAtHeight}. Never carries the body.
 */
public record MessageStatus(MessageView message, LockVerdict lock, long evaluatedAtHeight) {
}
