package com.mergington.activities.repository;

import com.mergington.activities.model.Activity;
import com.mergington.activities.model.Enrollment;

import java.util.Map;

/**
 * Authoritative store of the activity catalog and its rosters.
 * Each operation is atomic with respect to every other operation on the store.
 */
public interface RosterStore {

    /**
     * Snapshot of every activity keyed by name, in catalog order.
     * The returned activities are copies and never change after the call returns.
     */
    Map<String, Activity> list();

    /**
     * Add a participant to an activity roster.
     *
     * @throws com.mergington.activities.exception.ActivityNotFoundException if no activity has that name
     * @throws com.mergington.activities.exception.AlreadyEnrolledException if the participant is already on the roster
     * @throws com.mergington.activities.exception.CapacityExceededException if the roster is full
     */
    Enrollment enroll(String activityName, String email);

    /**
     * Remove a participant from an activity roster.
     *
     * @throws com.mergington.activities.exception.ActivityNotFoundException if no activity has that name
     * @throws com.mergington.activities.exception.NotEnrolledException if the participant is not on the roster
     */
    Enrollment withdraw(String activityName, String email);
}
