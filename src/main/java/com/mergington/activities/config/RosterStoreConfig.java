package com.mergington.activities.config;

import com.mergington.activities.model.Activity;
import com.mergington.activities.repository.RosterStore;
import com.mergington.activities.repository.impl.InMemoryRosterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the process-wide roster store from the configured catalog.
 *
 * Startup fails if the catalog is invalid (duplicate names, non-positive capacity,
 * repeated participants or a roster larger than its capacity).
 */
@Configuration
public class RosterStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(RosterStoreConfig.class);

    @Bean
    public RosterStore rosterStore(ActivityCatalogProperties properties) {
        List<Activity> catalog = properties.getCatalog().stream()
                .map(RosterStoreConfig::toActivity)
                .toList();

        if (catalog.isEmpty()) {
            logger.warn("No activities configured under activities.catalog; the store will be empty");
        }
        return new InMemoryRosterStore(catalog);
    }

    static Activity toActivity(ActivityCatalogProperties.ActivitySeed seed) {
        if (seed.getName() == null) {
            throw new IllegalArgumentException("Every catalog entry needs a name");
        }
        List<String> participants = seed.getParticipants() != null ? seed.getParticipants() : List.of();
        return new Activity(seed.getName(), seed.getDescription(), seed.getSchedule(),
                seed.getMaxParticipants(), participants);
    }
}
