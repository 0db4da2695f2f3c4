package com.flagship.telehealth_booking.identity;

import com.flagship.telehealth_booking.common.exception.ForbiddenException;
import lombok.Value;

import java.util.UUID;

/**
 * The authenticated user behind the current request.
 */
@Value
public class Caller {
    UUID userId;
    Role role;

    public boolean can(Capability capability) {
        return role.can(capability);
    }

    /**
     * @throws ForbiddenException if the caller's role lacks the capability
     */
    public void require(Capability capability, String action) {
        if (!can(capability)) {
            throw new ForbiddenException(String.format("Role %s is not allowed to %s", role, action));
        }
    }

    public boolean is(Role other) {
        return role == other;
    }
}
