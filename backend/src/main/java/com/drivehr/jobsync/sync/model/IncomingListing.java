package com.drivehr.jobsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One job as pushed by the upstream feed, before sanitizing. Field aliases are resolved here:
 * the camelCase name is checked first and the first non-null value wins.
 */
public record IncomingListing(
    String id,
    String title,
    String description,
    String summary,
    String department,
    String location,
    String jobType,
    String employmentType,
    String salaryRange,
    String applyUrl,
    String sourceUrl,
    String postedDate,
    String expiryDate,
    ObjectNode raw
) {

    public static IncomingListing from(ObjectNode node) {
        return new IncomingListing(
            text(node, "id"),
            text(node, "title"),
            text(node, "description"),
            text(node, "summary"),
            text(node, "department"),
            text(node, "location"),
            text(node, "type", "jobType"),
            text(node, "employmentType", "employment_type"),
            text(node, "salaryRange", "salary_range"),
            text(node, "applyUrl", "apply_url"),
            text(node, "sourceUrl"),
            text(node, "postedDate", "posted_date"),
            text(node, "expiryDate", "expiry_date"),
            node
        );
    }

    public boolean hasRequiredFields() {
        return id != null && !id.isBlank() && title != null && !title.isBlank();
    }

    public String idOrUnknown() {
        return id == null || id.isBlank() ? "unknown" : id;
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isValueNode()) {
                return value.asText();
            }
            return null;
        }
        return null;
    }
}
