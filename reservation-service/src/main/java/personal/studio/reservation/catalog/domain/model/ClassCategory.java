package personal.studio.reservation.catalog.domain.model;

/**
 * Class Category Enum
 * 수업 종류
 */
public enum ClassCategory {
    YOGA("Yoga"),
    ZUMBA("Zumba"),
    HIIT("HIIT");

    private final String displayName;

    ClassCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
