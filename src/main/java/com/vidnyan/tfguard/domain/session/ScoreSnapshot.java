package com.vidnyan.tfguard.domain.session;

public record ScoreSnapshot(int securityScore, double monthlyCost) {
}
