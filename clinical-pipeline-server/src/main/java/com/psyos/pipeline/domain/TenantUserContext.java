package com.psyos.pipeline.domain;

import lombok.Value;

/**
 * Authenticated caller of a pipeline entry point.
 */
@Value
public class TenantUserContext {

    String tenantId;
    String userId;
    UserRole role;

    public boolean hasRole(UserRole... roles) {
        for (UserRole candidate : roles) {
            if (candidate == role) {
                return true;
            }
        }
        return false;
    }
}
