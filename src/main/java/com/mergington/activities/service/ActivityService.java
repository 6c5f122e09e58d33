package com.mergington.activities.service;

import com.mergington.activities.dto.ActivityDTO;
import com.mergington.activities.model.Enrollment;

import java.util.Map;

/**
 * Service interface for listing activities and managing their rosters.
 */
public interface ActivityService {

    /**
     * Get every activity with its current roster, keyed by activity name in catalog order.
     */
    Map<String, ActivityDTO> getActivities();

    /**
     * Sign a student up for an activity.
     * Fails if the activity does not exist, the student is already on the roster, or the roster is full.
     */
    Enrollment signUp(String activityName, String email);

    /**
     * Remove a student from an activity roster.
     * Fails if the activity does not exist or the student is not on the roster.
     */
    Enrollment unregister(String activityName, String email);
}
