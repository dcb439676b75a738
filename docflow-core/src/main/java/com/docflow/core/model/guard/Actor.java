package com.docflow.core.model.guard;

import java.util.Set;

/**
 * Who triggered a stimulus. Guards only read it; authentication happens elsewhere.
 *
 * ADMIN implies every other permission.
 */
public record Actor(
    String id,
    Set<String> roles,
    Set<String> permissions
) {
    public static final String SYSTEM_ID = "system";

    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Actor id cannot be empty");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public static Actor of(String id) {
        return new Actor(id, Set.of(), Set.of());
    }

    public static Actor system() {
        return new Actor(SYSTEM_ID, Set.of(), Set.of(Permission.ADMIN.name()));
    }

    public static Actor withRoles(String id, String... roles) {
        return new Actor(id, Set.of(roles), Set.of());
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(Permission.ADMIN.name()) || permissions.contains(permission);
    }

    public boolean hasPermission(Permission permission) {
        return hasPermission(permission.name());
    }

    public Actor grant(Permission... granted) {
        var merged = new java.util.HashSet<>(permissions);
        for (Permission p : granted) {
            merged.add(p.name());
        }
        return new Actor(id, roles, merged);
    }
}
