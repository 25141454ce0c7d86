package com.vidnyan.tfguard.domain.session;

public enum VersionAuthor {
    USER,
    AGENT,
    SYNC
}
