package com.mergington.activities.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed activity catalog, bound from {@code activities.catalog[n].*} properties.
 * Entries keep the order they are declared in.
 */
@Component
@ConfigurationProperties(prefix = "activities")
public class ActivityCatalogProperties {

    private List<ActivitySeed> catalog = new ArrayList<>();

    public List<ActivitySeed> getCatalog() {
        return catalog;
    }

    public void setCatalog(List<ActivitySeed> catalog) {
        this.catalog = catalog;
    }

    public static class ActivitySeed {

        private String name;
        private String description;
        private String schedule;
        private int maxParticipants;
        private List<String> participants = new ArrayList<>();

        public ActivitySeed() {}

        public ActivitySeed(String name, String description, String schedule, int maxParticipants,
                            List<String> participants) {
            this.name = name;
            this.description = description;
            this.schedule = schedule;
            this.maxParticipants = maxParticipants;
            this.participants = participants;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
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

        public int getMaxParticipants() {
            return maxParticipants;
        }

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
}
