package com.notice.evaluation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed vocabulary for the Notice Category field. OTHERS is the catch-all.
 * Impact date and amount only carry meaning for the impact-bearing categories.
 */
public enum NoticeCategory {

    LATE_NOTICE("Late Notice", true),
    MAINTENANCE("Maintenance", false),
    ADDRESS_CHANGE("Address Change", false),
    CHEQUE_RECEIVED("Cheque Received", false),
    DISCONNECT_NOTICE("Disconnect Notice", true),
    RATE_CHANGE("Rate Change", false),
    REVERT_TO_OWNER("Revert to Owner", false),
    THIRD_PARTY_AUDIT("3rd Party Audit", false),
    OTHERS("Others", false);

    private static final List<String> LABELS = Arrays.stream(values())
            .map(NoticeCategory::getLabel)
            .toList();

    private final String label;
    private final boolean impactBearing;

    NoticeCategory(String label, boolean impactBearing) {
        this.label = label;
        this.impactBearing = impactBearing;
    }

    public String getLabel() {
        return label;
    }

    public boolean isImpactBearing() {
        return impactBearing;
    }

    public static List<String> labels() {
        return LABELS;
    }

    /** Exact, case-sensitive lookup. */
    public static Optional<NoticeCategory> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(c -> c.label.equals(label))
                .findFirst();
    }

    /** Bucket used for accuracy counting: unknown or blank labels fall into OTHERS. */
    public static NoticeCategory bucketOf(String label) {
        return fromLabel(label).orElse(OTHERS);
    }

    public static boolean isImpactBearing(String label) {
        return fromLabel(label).map(NoticeCategory::isImpactBearing).orElse(false);
    }
}
