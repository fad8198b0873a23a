package com.questboard.auth.model;

public record ResolvedAccount(LinkedIdentityRecord identity, UserRecord user) {}
