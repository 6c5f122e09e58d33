package com.mergington.activities.controller;

import com.mergington.activities.dto.ActivityDTO;
import com.mergington.activities.dto.MessageResponse;
import com.mergington.activities.model.Enrollment;
import com.mergington.activities.service.ActivityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for extracurricular activities.
 * Handles listing activities and signing students up for or out of them.
 */
@RestController
@RequestMapping("/activities")
@Validated
@Tag(name = "Activities", description = "Extracurricular activity sign-ups")
public class ActivityController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ActivityController.class);

    private final ActivityService activityService;

    @Autowired
    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @GetMapping
    @Operation(summary = "Get all activities with their participants")
    public ResponseEntity<Map<String, ActivityDTO>> getActivities() {
        Map<String, ActivityDTO> activities = activityService.getActivities();
        logger.debug("Returning {} activities", activities.size());

        return ResponseEntity.ok(activities);
    }

    @PostMapping("/{activityName}/signup")
    @Operation(summary = "Sign up a student for an activity")
    public ResponseEntity<MessageResponse> signUp(
            @PathVariable String activityName,
            @RequestParam @NotBlank(message = "Email is required") String email) {

        Enrollment enrollment = activityService.signUp(activityName, email);

        return ResponseEntity.ok(new MessageResponse(
            "Signed up " + enrollment.getEmail() + " for " + enrollment.getActivityName()));
    }

    @DeleteMapping("/{activityName}/unregister")
    @Operation(summary = "Unregister a student from an activity")
    public ResponseEntity<MessageResponse> unregister(
            @PathVariable String activityName,
            @RequestParam @NotBlank(message = "Email is required") String email) {

        Enrollment enrollment = activityService.unregister(activityName, email);

        return ResponseEntity.ok(new MessageResponse(
            "Unregistered " + enrollment.getEmail() + " from " + enrollment.getActivityName()));
    }
}
