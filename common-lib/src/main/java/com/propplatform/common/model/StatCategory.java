package com.propplatform.common.model;

/**
 * Statistical category a proposition's line is set on.
 *
 * <p>Volume categories (yards and attempts) are driven mostly by matchup and
 * usage; touchdown categories carry the highest outcome variance.
 */
public enum StatCategory {
    PASS_YARDS      ("Pass Yds",         Group.PASSING,   true,  false),
    PASS_ATTEMPTS   ("Pass Attempts",    Group.PASSING,   true,  false),
    PASS_COMPLETIONS("Pass Completions", Group.PASSING,   false, false),
    PASS_TDS        ("Pass TDs",         Group.PASSING,   false, true),
    RUSH_YARDS      ("Rush Yds",         Group.RUSHING,   true,  false),
    RUSH_ATTEMPTS   ("Rush Attempts",    Group.RUSHING,   true,  false),
    RUSH_TDS        ("Rush TDs",         Group.RUSHING,   false, true),
    RECEPTIONS      ("Receptions",       Group.RECEIVING, false, false),
    REC_YARDS       ("Rec Yds",          Group.RECEIVING, true,  false),
    REC_TDS         ("Rec TDs",          Group.RECEIVING, false, true);

    public enum Group { PASSING, RUSHING, RECEIVING }

    private final String label;
    private final Group group;
    private final boolean volume;
    private final boolean touchdown;

    StatCategory(String label, Group group, boolean volume, boolean touchdown) {
        this.label     = label;
        this.group     = group;
        this.volume    = volume;
        this.touchdown = touchdown;
    }

    public String label()        { return label; }
    public Group group()         { return group; }
    public boolean isVolume()    { return volume; }
    public boolean isTouchdown() { return touchdown; }
    public boolean isRushing()   { return group == Group.RUSHING; }
    public boolean isReceiving() { return group == Group.RECEIVING; }
    public boolean isPassing()   { return group == Group.PASSING; }
}
