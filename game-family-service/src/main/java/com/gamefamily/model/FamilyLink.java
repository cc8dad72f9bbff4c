package com.gamefamily.model;

/**
 * A single senior-to-junior relationship.
 */
public record FamilyLink(long seniorId, long juniorId) {}
