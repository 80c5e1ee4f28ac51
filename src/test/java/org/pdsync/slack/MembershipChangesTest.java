package org.pdsync.slack;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class MembershipChangesTest {

    @Test
    void testComputeChanges() {
        MembershipChanges changes = MembershipChanges.compute("oncall",
                List.of("U3", "U2"), List.of("U1", "U2"));

        assertThat(changes.isEmpty()).isFalse();
        assertThat(changes.addedMembers()).containsExactly("U1");
        assertThat(changes.removedMembers()).containsExactly("U3");
        assertThat(changes.finalMembers()).containsExactly("U1", "U2");
        assertThat(changes.previousMembers()).containsExactly("U2", "U3");
    }

    @Test
    void testNoChangesIgnoresOrder() {
        MembershipChanges changes = MembershipChanges.compute("oncall",
                List.of("U2", "U1"), List.of("U1", "U2"));

        assertThat(changes.isEmpty()).isTrue();
    }
}
