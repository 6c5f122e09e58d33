package com.mergington.activities.repository.impl;

import com.mergington.activities.exception.ActivityNotFoundException;
import com.mergington.activities.exception.AlreadyEnrolledException;
import com.mergington.activities.exception.CapacityExceededException;
import com.mergington.activities.exception.NotEnrolledException;
import com.mergington.activities.model.Activity;
import com.mergington.activities.model.Enrollment;
import com.mergington.activities.repository.RosterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory roster store seeded once with a fixed catalog.
 *
 * Enroll and withdraw run their checks and the roster change under the write lock;
 * list copies every roster under the read lock, so snapshots are consistent across activities.
 * Data is NOT persisted across application restarts.
 */
public class InMemoryRosterStore implements RosterStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRosterStore.class);

    private final Map<String, Activity> activities = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param catalog activities in display order, each with its initial roster
     * @throws IllegalArgumentException if two activities share a name
     */
    public InMemoryRosterStore(List<Activity> catalog) {
        for (Activity seed : catalog) {
            if (activities.putIfAbsent(seed.getName(), new Activity(seed)) != null) {
                throw new IllegalArgumentException("Duplicate activity name: " + seed.getName());
            }
        }
        logger.info("Roster store seeded with {} activities", activities.size());
    }

    @Override
    public Map<String, Activity> list() {
        lock.readLock().lock();
        try {
            Map<String, Activity> snapshot = new LinkedHashMap<>();
            activities.forEach((name, activity) -> snapshot.put(name, new Activity(activity)));
            return Collections.unmodifiableMap(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Enrollment enroll(String activityName, String email) {
        lock.writeLock().lock();
        try {
            Activity activity = getActivity(activityName);

            if (activity.hasParticipant(email)) {
                throw new AlreadyEnrolledException("Student is already signed up for this activity");
            }
            if (activity.isFull()) {
                throw new CapacityExceededException(String.format("Activity is full (%d/%d participants)",
                        activity.getParticipantCount(), activity.getMaxParticipants()));
            }

            activity.addParticipant(email);
            return new Enrollment(activityName, email);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Enrollment withdraw(String activityName, String email) {
        lock.writeLock().lock();
        try {
            Activity activity = getActivity(activityName);

            if (!activity.removeParticipant(email)) {
                throw new NotEnrolledException("Student is not signed up for this activity");
            }
            return new Enrollment(activityName, email);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller must hold the lock.
    private Activity getActivity(String activityName) {
        Activity activity = activityName == null ? null : activities.get(activityName);
        if (activity == null) {
            throw new ActivityNotFoundException("Activity not found");
        }
        return activity;
    }
}
