package com.chatguard.moderation.model;

public enum ActionKind {
    BAN(false, true, true),
    MUTE(true, true, true),
    TEMP_BAN(true, true, true),
    TRUST(false, false, false),
    UNTRUST(false, false, false),
    UNBAN(false, false, false);

    private final boolean timed;
    private final boolean exemptsAdmins;
    private final boolean notifiesAccount;

    ActionKind(boolean timed, boolean exemptsAdmins, boolean notifiesAccount) {
        this.timed = timed;
        this.exemptsAdmins = exemptsAdmins;
        this.notifiesAccount = notifiesAccount;
    }

    /** Timed kinds require a positive duration; every other kind forbids one. */
    public boolean isTimed() {
        return timed;
    }

    public boolean exemptsAdmins() {
        return exemptsAdmins;
    }

    public boolean notifiesAccount() {
        return notifiesAccount;
    }

    /** BAN and TEMP_BAN share one "banned" status per account. */
    public boolean isBan() {
        return this == BAN || this == TEMP_BAN;
    }
}
