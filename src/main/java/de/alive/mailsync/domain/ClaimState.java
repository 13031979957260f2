package de.alive.mailsync.domain;

public enum ClaimState {
    IDLE,
    CLAIMED
}
