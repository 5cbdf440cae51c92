package com.prodomme.session;

import com.prodomme.models.Role;

/**
 * Thrown when a caller tries to send a message that is not from the user.
 */
public class InvalidRoleException extends IllegalArgumentException {

    private final Role role;

    public InvalidRoleException(Role role) {
        super("Can only send messages with user role when querying model (got " + role.wireName() + ").");
        this.role = role;
    }

    public Role getRole() {
        return role;
    }
}
