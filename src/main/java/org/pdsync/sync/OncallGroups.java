package org.pdsync.sync;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.pdsync.slack.SlackUserGroup;

/**
 * Expected members of each user group for one run of a sync.
 * Created fresh for every run.
 */
public class OncallGroups implements Iterable<OncallGroups.OncallGroup> {
    private final Map<String, OncallGroup> groups = new LinkedHashMap<>();

    public OncallGroup getOrCreate(SlackUserGroup userGroup) {
        return groups.computeIfAbsent(userGroup.id(), k -> new OncallGroup(userGroup));
    }

    /**
     * @return expected members of the group, or null if the group is not tracked
     */
    public Set<String> members(String userGroupId) {
        OncallGroup group = groups.get(userGroupId);
        return group == null ? null : group.members();
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    @Override
    public Iterator<OncallGroup> iterator() {
        return Collections.unmodifiableCollection(groups.values()).iterator();
    }

    @Override
    public String toString() {
        return groups.values().toString();
    }

    public static class OncallGroup {
        final SlackUserGroup userGroup;
        final Set<String> members = new LinkedHashSet<>();

        OncallGroup(SlackUserGroup userGroup) {
            this.userGroup = userGroup;
        }

        public SlackUserGroup userGroup() {
            return userGroup;
        }

        public Set<String> members() {
            return Collections.unmodifiableSet(members);
        }

        public void ensureMember(String userId) {
            members.add(userId);
        }

        @Override
        public String toString() {
            return "%s=%s".formatted(userGroup.handle(), members);
        }
    }
}
