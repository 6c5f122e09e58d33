package com.mergington.activities.testutil;

import com.mergington.activities.model.Activity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Test builder for creating Activity instances with sensible defaults.
 */
public class ActivityTestBuilder {

    private String name = "Chess Club";
    private String description = "Learn strategies and compete in chess tournaments";
    private String schedule = "Fridays, 3:30 PM - 5:00 PM";
    private int maxParticipants = 12;
    private List<String> participants = new ArrayList<>();

    public static ActivityTestBuilder anActivity() {
        return new ActivityTestBuilder();
    }

    public static Activity chessClub() {
        return anActivity()
                .withParticipants("michael@mergington.edu", "daniel@mergington.edu")
                .build();
    }

    public static Activity smallClub() {
        return anActivity()
                .withName("Small Club")
                .withDescription("A small test club")
                .withSchedule("Mondays")
                .withMaxParticipants(3)
                .withParticipants("student1@mergington.edu")
                .build();
    }

    public ActivityTestBuilder withName(String name) {
        this.name = name;
        return this;
    }

    public ActivityTestBuilder withDescription(String description) {
        this.description = description;
        return this;
    }

    public ActivityTestBuilder withSchedule(String schedule) {
        this.schedule = schedule;
        return this;
    }

    public ActivityTestBuilder withMaxParticipants(int maxParticipants) {
        this.maxParticipants = maxParticipants;
        return this;
    }

    public ActivityTestBuilder withParticipants(String... participants) {
        this.participants = new ArrayList<>(Arrays.asList(participants));
        return this;
    }

    public Activity build() {
        return new Activity(name, description, schedule, maxParticipants, participants);
    }
}
