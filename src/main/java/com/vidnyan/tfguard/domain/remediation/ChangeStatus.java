package com.vidnyan.tfguard.domain.remediation;

public enum ChangeStatus {
    PROPOSED,
    ACCEPTED,
    REJECTED,
    APPLIED
}
