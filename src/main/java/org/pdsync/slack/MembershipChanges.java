package org.pdsync.slack;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Changes needed to bring a user group from its current to its expected members.
 */
public record MembershipChanges(
        String fullName,
        Set<String> previousMembers,
        Set<String> addedMembers,
        Set<String> removedMembers,
        Set<String> finalMembers) {

    public static MembershipChanges compute(String resourceName,
            Collection<String> currentMembers, Collection<String> expectedMembers) {

        Set<String> toAdd = new TreeSet<>(expectedMembers);
        toAdd.removeAll(currentMembers);

        Set<String> toRemove = new TreeSet<>(currentMembers);
        toRemove.removeAll(expectedMembers);

        Set<String> finalMembers = new TreeSet<>(currentMembers);
        finalMembers.addAll(toAdd);
        finalMembers.removeAll(toRemove);

        return new MembershipChanges(resourceName, new TreeSet<>(currentMembers), toAdd, toRemove, finalMembers);
    }

    public boolean isEmpty() {
        return addedMembers.isEmpty() && removedMembers.isEmpty();
    }
}
