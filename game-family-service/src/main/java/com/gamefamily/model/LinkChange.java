package com.gamefamily.model;

import java.util.List;

/**
 * Outcome of an unlink or removal: the surviving records that were rewritten, and the links that
 * no longer exist.
 */
public record LinkChange(
    long characterId,
    List<FamilyMember> updatedMembers,
    List<FamilyLink> brokenLinks
) {
    public LinkChange {
        updatedMembers = List.copyOf(updatedMembers);
        brokenLinks = List.copyOf(brokenLinks);
    }
}
