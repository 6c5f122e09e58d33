package com.mergington.activities.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An extracurricular activity and its current roster.
 *
 * Capacity is fixed at construction. The roster keeps insertion order for display
 * and never holds the same participant twice. Instances are not thread-safe; the
 * owning roster store serializes access.
 */
public class Activity {

    private final String name;
    private final String description;
    private final String schedule;
    private final int maxParticipants;
    private final Set<String> participants;

    /**
     * @throws IllegalArgumentException if the name is blank or the capacity is not positive
     */
    public Activity(String name, String description, String schedule, int maxParticipants) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Activity name must not be blank");
        }
        if (maxParticipants <= 0) {
            throw new IllegalArgumentException("Activity " + name + " must have a positive capacity, got "
                    + maxParticipants);
        }
        this.name = name;
        this.description = description;
        this.schedule = schedule;
        this.maxParticipants = maxParticipants;
        this.participants = new LinkedHashSet<>();
    }

    /**
     * Create an activity with an initial roster.
     *
     * @throws IllegalArgumentException if the roster repeats a participant or exceeds the capacity
     */
    public Activity(String name, String description, String schedule, int maxParticipants,
                    Collection<String> participants) {
        this(name, description, schedule, maxParticipants);
        for (String email : participants) {
            if (!this.participants.add(email)) {
                throw new IllegalArgumentException("Activity " + name + " lists " + email + " more than once");
            }
        }
        if (this.participants.size() > maxParticipants) {
            throw new IllegalArgumentException(String.format("Activity %s has %d participants but capacity %d",
                    name, this.participants.size(), maxParticipants));
        }
    }

    /**
     * Deep copy, used for snapshots.
     */
    public Activity(Activity other) {
        this(other.name, other.description, other.schedule, other.maxParticipants, other.participants);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getSchedule() {
        return schedule;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public Set<String> getParticipants() {
        return Collections.unmodifiableSet(participants);
    }

    public int getParticipantCount() {
        return participants.size();
    }

    public boolean hasParticipant(String email) {
        return participants.contains(email);
    }

    public boolean isFull() {
        return participants.size() >= maxParticipants;
    }

    /**
     * @return false if the participant was already on the roster
     */
    public boolean addParticipant(String email) {
        return participants.add(email);
    }

    /**
     * @return false if the participant was not on the roster
     */
    public boolean removeParticipant(String email) {
        return participants.remove(email);
    }
}
