package com.tracura.plm.domain;

/**
 * Phase-scoped department key, {@code "<phaseId>_<departmentName>"}.
 * Department names are only unique within a phase, so expenses and legacy budget maps
 * reference departments through this key.
 */
public final class DepartmentKey {

    private static final char SEPARATOR = '_';

    private DepartmentKey() {
    }

    public static String of(String phaseId, String departmentName) {
        if (phaseId == null || phaseId.isBlank()) {
            throw new IllegalArgumentException("phaseId is required");
        }
        if (departmentName == null || departmentName.isBlank()) {
            throw new IllegalArgumentException("departmentName is required");
        }
        return phaseId + SEPARATOR + departmentName;
    }

    /**
     * Normalize a stored department reference to the phase-scoped key.
     * References already carrying the phase prefix are returned unchanged.
     */
    public static String normalize(String phaseId, String department) {
        if (department == null) {
            return null;
        }
        return isScopedTo(phaseId, department) ? department : of(phaseId, department);
    }

    public static boolean isScopedTo(String phaseId, String department) {
        return department != null && department.startsWith(phaseId + SEPARATOR);
    }

    /**
     * Display name of a key: the part after the first separator, or the key itself.
     */
    public static String displayName(String key) {
        var idx = key.indexOf(SEPARATOR);
        return idx >= 0 ? key.substring(idx + 1) : key;
    }
}
