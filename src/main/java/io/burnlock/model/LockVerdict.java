package io.burnlock.model;

public enum LockVerdict {
    LOCKED,
    UNLOCKED
}
