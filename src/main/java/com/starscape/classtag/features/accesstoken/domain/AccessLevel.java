package com.starscape.classtag.features.accesstoken.domain;

public enum AccessLevel {
    FULL,
    READ_ONLY
}
