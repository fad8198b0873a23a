package com.questboard.auth.model;

public enum CharacterCode {
    TRAECHAN,
    MASTER
}
