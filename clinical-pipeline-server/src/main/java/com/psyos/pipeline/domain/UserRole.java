package com.psyos.pipeline.domain;

public enum UserRole {
    ADMIN,
    PSYCHOLOGIST,
    PATIENT
}
