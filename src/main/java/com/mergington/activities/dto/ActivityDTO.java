package com.mergington.activities.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mergington.activities.model.Activity;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for an activity with its roster. The activity name is the key of the enclosing map.
 */
public class ActivityDTO {

    private String description;
    private String schedule;
    private int maxParticipants;
    private List<String> participants;

    public ActivityDTO() {}

    public ActivityDTO(Activity activity) {
        this.description = activity.getDescription();
        this.schedule = activity.getSchedule();
        this.maxParticipants = activity.getMaxParticipants();
        this.participants = new ArrayList<>(activity.getParticipants());
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    @JsonProperty("max_participants")
    public int getMaxParticipants() {
        return maxParticipants;
    }

    @JsonProperty("max_participants")
    public void setMaxParticipants(int maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public List<String> getParticipants() {
        return participants;
    }

    public void setParticipants(List<String> participants) {
        this.participants = participants;
    }
}
