package com.drivehr.jobsync.sync.service;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.model.IncomingListing;
import com.drivehr.jobsync.sync.model.ListingRecord;
import com.drivehr.jobsync.sync.util.JobUrlUtils;
import com.drivehr.jobsync.sync.util.LenientDateParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.stream.Collectors;

@Component
public class ListingSanitizer {
    private static final Document.OutputSettings RAW_OUTPUT = new Document.OutputSettings().prettyPrint(false);

    private final ObjectMapper objectMapper;
    private final JobSyncProperties properties;

    public ListingSanitizer(ObjectMapper objectMapper, JobSyncProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ListingRecord sanitize(IncomingListing listing, Instant syncedAt) {
        Instant postedAt = LenientDateParser.parse(listing.postedDate());
        return new ListingRecord(
            plainText(listing.id()),
            plainText(listing.title()),
            richText(listing.description()),
            multilineText(listing.summary()),
            plainText(listing.department()),
            plainText(listing.location()),
            plainText(listing.jobType()),
            plainText(listing.employmentType()),
            plainText(listing.salaryRange()),
            JobUrlUtils.sanitizeUrl(listing.applyUrl()),
            JobUrlUtils.sanitizeUrl(listing.sourceUrl()),
            plainText(listing.postedDate()),
            plainText(listing.expiryDate()),
            postedAt == null ? syncedAt : postedAt,
            LenientDateParser.parse(listing.expiryDate()),
            properties.getSource(),
            rawData(listing.raw()),
            syncedAt,
            properties.getSyncVersion()
        );
    }

    /**
     * Keeps the markup a job description legitimately needs (paragraphs, lists, emphasis, links,
     * tables, headings) and drops everything else, including scripts and event handlers.
     */
    public String richText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Jsoup.clean(value, "", Safelist.relaxed(), RAW_OUTPUT).trim();
    }

    /**
     * Single-line text: markup removed, entities decoded, whitespace collapsed.
     */
    public String plainText(String value) {
        if (value == null) {
            return null;
        }
        String text = Jsoup.parse(value).text().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Like {@link #plainText(String)} but line breaks survive.
     */
    public String multilineText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String stripped = Jsoup.clean(value, "", Safelist.none(), RAW_OUTPUT);
        String unescaped = Parser.unescapeEntities(stripped, false);
        String text = Arrays.stream(unescaped.replace("\r\n", "\n").split("\n", -1))
            .map(line -> line.replaceAll("[\\t\\x0B\\f ]+", " ").trim())
            .collect(Collectors.joining("\n"))
            .trim();
        return text.isEmpty() ? null : text;
    }

    private String rawData(ObjectNode raw) {
        if (raw == null) {
            return null;
        }
        ObjectNode copy = raw.deepCopy();
        copy.remove("description");
        try {
            return objectMapper.writeValueAsString(copy);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize raw listing payload", e);
        }
    }
}
