package com.drivehr.jobsync.sync.validation;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookPayloadValidatorTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebhookPayloadValidator validator = new WebhookPayloadValidator(new JobSyncProperties());

    @Test
    void acceptsJobsArrayWithValidFirstItem() throws Exception {
        ValidationOutcome outcome = validator.validate(objectMapper.readTree(
            "{\"jobs\":[{\"id\":\"1\",\"title\":\"Driver\"},\"not-an-object\"]}"));

        assertTrue(outcome.valid());
        assertThat(outcome.failedCheck()).isNull();
    }

    @Test
    void acceptsEmptyJobsArray() throws Exception {
        assertTrue(validator.validate(objectMapper.readTree("{\"jobs\":[]}")).valid());
    }

    @Test
    void rejectsNonObjectRootAndMissingJobs() throws Exception {
        assertFalse(validator.validate(objectMapper.readTree("[1,2,3]")).valid());
        assertFalse(validator.validate(objectMapper.readTree("null")).valid());
        assertFalse(validator.validate(null).valid());

        ValidationOutcome missing = validator.validate(objectMapper.readTree("{\"listings\":[]}"));
        assertFalse(missing.valid());
        assertThat(missing.failedCheck()).contains("jobs");

        assertFalse(validator.validate(objectMapper.readTree("{\"jobs\":{\"id\":\"1\"}}")).valid());
    }

    @Test
    void rejectsFirstItemWithoutIdOrTitle() throws Exception {
        assertFalse(validator.validate(objectMapper.readTree("{\"jobs\":[{\"title\":\"Driver\"}]}")).valid());
        assertFalse(validator.validate(objectMapper.readTree("{\"jobs\":[{\"id\":\"1\",\"title\":null}]}")).valid());
        assertFalse(validator.validate(objectMapper.readTree("{\"jobs\":[\"1\"]}")).valid());
    }

    @Test
    void enforcesBatchSizeLimit() {
        JobSyncProperties properties = new JobSyncProperties();
        properties.setMaxJobsPerRequest(2);
        WebhookPayloadValidator small = new WebhookPayloadValidator(properties);

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode jobs = root.putArray("jobs");
        for (int i = 0; i < 3; i++) {
            jobs.addObject().put("id", "job-" + i).put("title", "Title " + i);
        }

        ValidationOutcome outcome = small.validate(root);
        assertFalse(outcome.valid());
        assertThat(outcome.failedCheck()).contains("limit is 2");

        jobs.remove(2);
        assertTrue(small.validate(root).valid());
    }
}
