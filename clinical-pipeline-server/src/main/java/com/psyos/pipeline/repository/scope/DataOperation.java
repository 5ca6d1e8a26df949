package com.psyos.pipeline.repository.scope;

public enum DataOperation {
    CREATE,
    CREATE_MANY,
    FIND_FIRST,
    FIND_MANY,
    FIND_UNIQUE,
    COUNT,
    UPDATE,
    UPDATE_MANY,
    DELETE,
    DELETE_MANY,
    UPSERT;

    public boolean writesPayload() {
        return this == CREATE || this == CREATE_MANY || this == UPSERT;
    }

    public boolean needsFilter() {
        return this != CREATE && this != CREATE_MANY;
    }
}
