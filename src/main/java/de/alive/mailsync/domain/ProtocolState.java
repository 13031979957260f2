package de.alive.mailsync.domain;

public enum ProtocolState {
    DISCONNECTED,
    AUTHENTICATED,
    FOLDER_SELECTED
}
