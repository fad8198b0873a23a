package com.questboard.auth.model;

import java.time.Instant;

public record VerifiedSession(long userId, Instant issuedAt, Instant expiresAt) {}
