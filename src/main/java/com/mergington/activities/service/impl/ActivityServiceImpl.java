package com.mergington.activities.service.impl;

import com.mergington.activities.dto.ActivityDTO;
import com.mergington.activities.exception.ActivityNotFoundException;
import com.mergington.activities.exception.AlreadyEnrolledException;
import com.mergington.activities.exception.CapacityExceededException;
import com.mergington.activities.exception.NotEnrolledException;
import com.mergington.activities.model.Enrollment;
import com.mergington.activities.repository.RosterStore;
import com.mergington.activities.service.ActivityService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementation of ActivityService backed by the roster store.
 * Every roster change is counted in {@code activity_roster_change_total} by operation and status.
 */
@Service
public class ActivityServiceImpl implements ActivityService {

    private static final Logger logger = LoggerFactory.getLogger(ActivityServiceImpl.class);

    static final String ROSTER_CHANGE_METRIC = "activity_roster_change_total";

    private final RosterStore rosterStore;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ActivityServiceImpl(RosterStore rosterStore, MeterRegistry meterRegistry) {
        this.rosterStore = rosterStore;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Map<String, ActivityDTO> getActivities() {
        Map<String, ActivityDTO> result = new LinkedHashMap<>();
        rosterStore.list().forEach((name, activity) -> result.put(name, new ActivityDTO(activity)));
        logger.debug("Retrieved {} activities", result.size());
        return result;
    }

    @Override
    public Enrollment signUp(String activityName, String email) {
        logger.info("Signing up {} for activity {}", email, activityName);

        try {
            Enrollment enrollment = rosterStore.enroll(activityName, email);
            recordRosterChange("signup", "success");
            logger.info("Successfully signed up {} for activity {}", email, activityName);
            return enrollment;
        } catch (ActivityNotFoundException e) {
            recordRosterChange("signup", "not_found");
            logger.warn("Sign-up rejected, activity {} does not exist", activityName);
            throw e;
        } catch (AlreadyEnrolledException e) {
            recordRosterChange("signup", "already_enrolled");
            logger.warn("Sign-up rejected, {} is already in activity {}", email, activityName);
            throw e;
        } catch (CapacityExceededException e) {
            recordRosterChange("signup", "full");
            logger.warn("Sign-up rejected for {}: {} ({})", email, activityName, e.getMessage());
            throw e;
        }
    }

    @Override
    public Enrollment unregister(String activityName, String email) {
        logger.info("Unregistering {} from activity {}", email, activityName);

        try {
            Enrollment enrollment = rosterStore.withdraw(activityName, email);
            recordRosterChange("unregister", "success");
            logger.info("Successfully unregistered {} from activity {}", email, activityName);
            return enrollment;
        } catch (ActivityNotFoundException e) {
            recordRosterChange("unregister", "not_found");
            logger.warn("Unregister rejected, activity {} does not exist", activityName);
            throw e;
        } catch (NotEnrolledException e) {
            recordRosterChange("unregister", "not_enrolled");
            logger.warn("Unregister rejected, {} is not in activity {}", email, activityName);
            throw e;
        }
    }

    private void recordRosterChange(String operation, String status) {
        meterRegistry.counter(ROSTER_CHANGE_METRIC, "operation", operation, "status", status).increment();
    }
}
