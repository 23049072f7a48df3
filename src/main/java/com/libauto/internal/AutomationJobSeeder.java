package com.libauto.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libauto.config.LibAutoProperties;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creates the jobs listed under {@code libauto.seed-jobs} that do not exist yet.
 * Existing jobs, matched by name, are never modified.
 */
@Component
public class AutomationJobSeeder {

    private static final Logger log = LoggerFactory.getLogger(AutomationJobSeeder.class);

    private final JobStore jobStore;
    private final ObjectMapper objectMapper;
    private final List<LibAutoProperties.SeedJob> seedJobs;

    public AutomationJobSeeder(JobStore jobStore, ObjectMapper objectMapper, LibAutoProperties properties) {
        this.jobStore = jobStore;
        this.objectMapper = objectMapper;
        this.seedJobs = properties.getSeedJobs();
    }

    /**
     * @return number of jobs created
     */
    public int seed() {
        if (seedJobs == null || seedJobs.isEmpty()) {
            return 0;
        }
        log.info("Checking {} configured automation job(s) to seed...", seedJobs.size());
        Set<String> seen = new HashSet<>();
        int created = 0;
        for (LibAutoProperties.SeedJob definition : seedJobs) {
            String name = definition.getName() == null ? "" : definition.getName().trim();
            if (name.isEmpty() || definition.getType() == null || definition.getSchedule() == null) {
                log.error("Ignoring seed job without name, type or schedule: name='{}', type={}",
                        name, definition.getType());
                continue;
            }
            if (!seen.add(name)) {
                throw new IllegalStateException("Seed job '" + name + "' is configured more than once");
            }
            if (seedJob(name, definition)) {
                created++;
            }
        }
        return created;
    }

    private boolean seedJob(String name, LibAutoProperties.SeedJob definition) {
        try {
            if (jobStore.findJobByName(name).isPresent()) {
                log.debug("Automation job {} already exists", name);
                return false;
            }
            String id = definition.getId() == null || definition.getId().isBlank()
                    ? UUID.randomUUID().toString()
                    : definition.getId().trim();
            AutomationJob job = new AutomationJob(id, name, definition.getType(), definition.getSchedule().trim(),
                    objectMapper.valueToTree(definition.getConfig()));
            job.setEnabled(definition.isEnabled());
            try {
                jobStore.createJob(job);
                log.info("Seeded automation job {} ({}) of type {} with cron '{}'",
                        name, id, definition.getType(), definition.getSchedule());
                return true;
            } catch (DataIntegrityViolationException duplicate) {
                log.debug("Skipped duplicate seed of automation job {}", name);
                return false;
            }
        } catch (Exception e) {
            log.error("Failed to seed automation job {}", name, e);
            return false;
        }
    }
}
