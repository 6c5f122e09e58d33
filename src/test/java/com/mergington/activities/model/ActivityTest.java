package com.mergington.activities.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Activity model class.
 */
class ActivityTest {

    // ============================================================================
    // CONSTRUCTOR TESTS
    // ============================================================================

    @Test
    void constructor_WithRoster_ShouldSetCorrectValues() {
        // When
        Activity activity = new Activity("Chess Club", "Learn chess", "Fridays", 12,
                List.of("michael@mergington.edu", "daniel@mergington.edu"));

        // Then
        assertThat(activity.getName()).isEqualTo("Chess Club");
        assertThat(activity.getDescription()).isEqualTo("Learn chess");
        assertThat(activity.getSchedule()).isEqualTo("Fridays");
        assertThat(activity.getMaxParticipants()).isEqualTo(12);
        assertThat(activity.getParticipants()).containsExactly("michael@mergington.edu", "daniel@mergington.edu");
        assertThat(activity.getParticipantCount()).isEqualTo(2);
        assertThat(activity.isFull()).isFalse();
    }

    @Test
    void constructor_WithBlankName_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new Activity("  ", "d", "s", 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void constructor_WithNullName_ThrowsNullPointerException() {
        assertThatThrownBy(() -> new Activity(null, "d", "s", 5))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_WithZeroCapacity_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new Activity("Empty Club", "d", "s", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive capacity");
    }

    @Test
    void constructor_WithDuplicateParticipants_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new Activity("Chess Club", "d", "s", 5,
                List.of("a@mergington.edu", "a@mergington.edu")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    void constructor_WithRosterLargerThanCapacity_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new Activity("Tiny Club", "d", "s", 1,
                List.of("a@mergington.edu", "b@mergington.edu")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity 1");
    }

    @Test
    void copyConstructor_ProducesIndependentRoster() {
        // Given
        Activity original = new Activity("Chess Club", "d", "s", 5, List.of("a@mergington.edu"));

        // When
        Activity copy = new Activity(original);
        original.addParticipant("b@mergington.edu");

        // Then
        assertThat(copy.getParticipants()).containsExactly("a@mergington.edu");
        assertThat(original.getParticipants()).containsExactly("a@mergington.edu", "b@mergington.edu");
    }

    // ============================================================================
    // ROSTER TESTS
    // ============================================================================

    @Test
    void addParticipant_WhenAlreadyPresent_ReturnsFalse() {
        Activity activity = new Activity("Chess Club", "d", "s", 5, List.of("a@mergington.edu"));

        assertThat(activity.addParticipant("a@mergington.edu")).isFalse();
        assertThat(activity.getParticipantCount()).isEqualTo(1);
    }

    @Test
    void removeParticipant_WhenAbsent_ReturnsFalse() {
        Activity activity = new Activity("Chess Club", "d", "s", 5);

        assertThat(activity.removeParticipant("a@mergington.edu")).isFalse();
    }

    @Test
    void isFull_AtCapacity_ReturnsTrue() {
        Activity activity = new Activity("Pair Club", "d", "s", 2, List.of("a@mergington.edu"));
        assertThat(activity.isFull()).isFalse();

        activity.addParticipant("b@mergington.edu");

        assertThat(activity.isFull()).isTrue();
        assertThat(activity.hasParticipant("b@mergington.edu")).isTrue();
    }
}
