package com.gamefamily.model;

/**
 * Reputation credited to {@code member}; {@code amount} is what was actually added after any penalty.
 */
public record RepAward(FamilyMember member, long amount, String source) {}
