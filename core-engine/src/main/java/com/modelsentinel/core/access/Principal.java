package com.modelsentinel.core.access;

import java.io.Serializable;
import java.util.Objects;

/**
 * An authenticated user.
 *
 * @since 1.0.0
 */
public final class Principal implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final Role role;
    private final boolean active;

    public Principal(String id, Role role, boolean active) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.active = active;
    }

    public static Principal active(String id, Role role) {
        return new Principal(id, role, true);
    }

    public String getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Principal that))
            return false;
        return active == that.active && id.equals(that.id) && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, role, active);
    }

    @Override
    public String toString() {
        return "Principal{id='" + id + "', role=" + role.wireValue() + ", active=" + active + '}';
    }
}
