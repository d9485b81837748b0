package com.modelsentinel.core.access;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static role to permission mapping, resolved once at class load.
 *
 * <table>
 * <caption>Capabilities</caption>
 * <tr><th>Role</th><th>Permissions</th></tr>
 * <tr><td>admin</td><td>all</td></tr>
 * <tr><td>data_scientist</td><td>manage_models, view_metrics, generate_reports, manage_alerts</td></tr>
 * <tr><td>ml_engineer</td><td>manage_models, view_metrics, manage_alerts</td></tr>
 * <tr><td>business_analyst</td><td>view_metrics, generate_reports</td></tr>
 * <tr><td>viewer</td><td>view_metrics</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class CapabilityTable {

    private static final Map<Role, Set<Permission>> TABLE;

    static {
        Map<Role, Set<Permission>> table = new EnumMap<>(Role.class);
        table.put(Role.ADMIN, Collections.unmodifiableSet(EnumSet.allOf(Permission.class)));
        table.put(Role.DATA_SCIENTIST, Collections.unmodifiableSet(EnumSet.of(
                Permission.MANAGE_MODELS, Permission.VIEW_METRICS,
                Permission.GENERATE_REPORTS, Permission.MANAGE_ALERTS)));
        table.put(Role.ML_ENGINEER, Collections.unmodifiableSet(EnumSet.of(
                Permission.MANAGE_MODELS, Permission.VIEW_METRICS, Permission.MANAGE_ALERTS)));
        table.put(Role.BUSINESS_ANALYST, Collections.unmodifiableSet(EnumSet.of(
                Permission.VIEW_METRICS, Permission.GENERATE_REPORTS)));
        table.put(Role.VIEWER, Collections.unmodifiableSet(EnumSet.of(Permission.VIEW_METRICS)));
        TABLE = Collections.unmodifiableMap(table);
    }

    private CapabilityTable() {
        // utility class, not instantiable
    }

    /**
     * @return unmodifiable permission set of the role
     */
    public static Set<Permission> permissionsOf(Role role) {
        Objects.requireNonNull(role, "role must not be null");
        return TABLE.get(role);
    }

    public static boolean grants(Role role, Permission permission) {
        Objects.requireNonNull(permission, "permission must not be null");
        return permissionsOf(role).contains(permission);
    }
}
