package com.faktura.billing.domain;

/**
 * Steps of the dunning sequence. Escalation always moves to {@link #next()}.
 */
public enum ReminderLevel {
    NONE("reminder.level.none"),
    FRIENDLY("reminder.level.friendly"),   // Zahlungserinnerung
    FIRST("reminder.level.first"),         // 1. Mahnung
    SECOND("reminder.level.second"),       // 2. Mahnung
    FINAL("reminder.level.final"),         // Letzte Mahnung
    LEGAL("reminder.level.legal");         // Rechtliche Schritte

    private final String labelKey;

    ReminderLevel(String labelKey) {
        this.labelKey = labelKey;
    }

    public String labelKey() {
        return labelKey;
    }

    /**
     * The following level, or null when this level is terminal.
     */
    public ReminderLevel next() {
        return switch (this) {
            case NONE -> FRIENDLY;
            case FRIENDLY -> FIRST;
            case FIRST -> SECOND;
            case SECOND -> FINAL;
            case FINAL -> LEGAL;
            case LEGAL -> null;
        };
    }

    public boolean isTerminal() {
        return this == LEGAL;
    }

    public boolean isAtLeast(ReminderLevel other) {
        return compareTo(other) >= 0;
    }
}
