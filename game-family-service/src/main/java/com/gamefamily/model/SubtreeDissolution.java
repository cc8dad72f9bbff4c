package com.gamefamily.model;

import java.util.List;

/**
 * Work performed by a subtree dissolution: the ids deleted, in removal order, and the surviving
 * records rewritten along the way.
 */
public record SubtreeDissolution(
    long seniorId,
    List<Long> removedIds,
    List<FamilyMember> updatedMembers,
    List<FamilyLink> brokenLinks
) {
    public SubtreeDissolution {
        removedIds = List.copyOf(removedIds);
        updatedMembers = List.copyOf(updatedMembers);
        brokenLinks = List.copyOf(brokenLinks);
    }
}
