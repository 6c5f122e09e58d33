package com.mergington.activities.model;

import java.util.Objects;

/**
 * Confirmation of a roster change: which participant joined or left which activity.
 */
public class Enrollment {

    private final String activityName;
    private final String email;

    public Enrollment(String activityName, String email) {
        this.activityName = activityName;
        this.email = email;
    }

    public String getActivityName() {
        return activityName;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Enrollment that = (Enrollment) o;
        return Objects.equals(activityName, that.activityName) && Objects.equals(email, that.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(activityName, email);
    }

    @Override
    public String toString() {
        return "Enrollment{activityName='" + activityName + "', email='" + email + "'}";
    }
}
