package com.liftlog.plugins.trace;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Familia de trazas de diagnóstico: la fila "centro" lleva {@code centerId} y el conjunto
 * completo de ids esperados es {@code memberIds} (incluye al centro).
 */
public record TraceFamily(
        String label,           // "控制" | "管理"
        String centerId,        // ej. "53552"
        List<String> memberIds
) {
    public TraceFamily {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }

    /** Ids esperados, ordenados como texto. */
    public SortedSet<String> expectedIds() {
        return new TreeSet<>(memberIds);
    }

    public boolean isMember(String id) {
        return id != null && memberIds.contains(id);
    }
}
