package com.gamefamily.events;

public enum FamilyEventType {
    LINK_CREATED,
    LINK_BROKEN,
    TREE_DISSOLVED,
    REP_GAINED,
    REP_REDEEMED,
    REP_RESET,
    REP_ERROR,
    LINK_ERROR
}
