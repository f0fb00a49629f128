package com.ledgerradar.ingestion.job;

import com.ledgerradar.domain.ImportJob.ImportStatus;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed import job transitions. States only move forward; terminal states have no exits.
 */
public final class ImportJobStateMachine {

    private static final Map<ImportStatus, Set<ImportStatus>> ALLOWED = Map.of(
            ImportStatus.PENDING, EnumSet.of(ImportStatus.PROCESSING, ImportStatus.FAILED),
            ImportStatus.PROCESSING, EnumSet.of(ImportStatus.VERIFIED, ImportStatus.NEEDS_REVIEW, ImportStatus.FAILED),
            ImportStatus.VERIFIED, EnumSet.noneOf(ImportStatus.class),
            ImportStatus.NEEDS_REVIEW, EnumSet.noneOf(ImportStatus.class),
            ImportStatus.FAILED, EnumSet.noneOf(ImportStatus.class));

    private ImportJobStateMachine() {
    }

    public static boolean canTransition(ImportStatus from, ImportStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }

    public static void requireTransition(ImportStatus from, ImportStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalStateException("Illegal import job transition " + from + " -> " + to);
        }
    }

    /** States from which the given target is reachable in one step. */
    public static Set<ImportStatus> sourcesOf(ImportStatus to) {
        Set<ImportStatus> sources = EnumSet.noneOf(ImportStatus.class);
        ALLOWED.forEach((from, targets) -> {
            if (targets.contains(to)) {
                sources.add(from);
            }
        });
        return sources;
    }
}
