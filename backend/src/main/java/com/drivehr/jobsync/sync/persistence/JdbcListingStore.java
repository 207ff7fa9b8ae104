package com.drivehr.jobsync.sync.persistence;

import com.drivehr.jobsync.sync.model.JobListingView;
import com.drivehr.jobsync.sync.model.ListingRecord;
import com.drivehr.jobsync.sync.model.ListingRecordRef;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcListingStore implements ListingStore {
    static final String STATUS_PUBLISH = "publish";
    static final String STATUS_TRASH = "trash";

    private static final RowMapper<JobListingView> VIEW_MAPPER = (rs, rowNum) -> new JobListingView(
        rs.getLong("id"),
        rs.getString("job_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("summary"),
        rs.getString("department"),
        rs.getString("location"),
        rs.getString("job_type"),
        rs.getString("employment_type"),
        rs.getString("salary_range"),
        rs.getString("apply_url"),
        rs.getString("source_url"),
        toInstant(rs.getTimestamp("posted_at")),
        toInstant(rs.getTimestamp("expires_at")),
        toInstant(rs.getTimestamp("last_updated")),
        rs.getString("sync_version")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcListingStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Map<String, Long> findRecordIdsByJobIds(Collection<String> jobIds) {
        Map<String, Long> map = new LinkedHashMap<>();
        if (jobIds == null || jobIds.isEmpty()) {
            return map;
        }
        Set<String> distinct = new LinkedHashSet<>(jobIds);
        jdbc.query(
            """
                SELECT job_id, id
                FROM job_listings
                WHERE job_id IN (:jobIds)
                  AND status <> :trash
                ORDER BY id
                """,
            new MapSqlParameterSource()
                .addValue("jobIds", distinct)
                .addValue("trash", STATUS_TRASH),
            rs -> {
                map.putIfAbsent(rs.getString("job_id"), rs.getLong("id"));
            }
        );
        return map;
    }

    @Override
    public long upsert(ListingRecord listing, Long existingRecordId) {
        MapSqlParameterSource params = listingParams(listing);
        if (existingRecordId != null) {
            params.addValue("id", existingRecordId);
            int updated = jdbc.update(
                """
                    UPDATE job_listings
                    SET job_id = :jobId,
                        title = :title,
                        description = :description,
                        summary = :summary,
                        department = :department,
                        location = :location,
                        job_type = :jobType,
                        employment_type = :employmentType,
                        salary_range = :salaryRange,
                        apply_url = :applyUrl,
                        source_url = :sourceUrl,
                        posted_date = :postedDate,
                        expiry_date = :expiryDate,
                        posted_at = :postedAt,
                        expires_at = :expiresAt,
                        source = :source,
                        raw_data = :rawData,
                        last_updated = :lastUpdated,
                        sync_version = :syncVersion,
                        status = :status
                    WHERE id = :id
                    """,
                params
            );
            if (updated != 1) {
                throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(
                    "update of listing record " + existingRecordId, 1, updated);
            }
            return existingRecordId;
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_listings (
                    job_id, title, description, summary, department, location, job_type,
                    employment_type, salary_range, apply_url, source_url, posted_date, expiry_date,
                    posted_at, expires_at, source, raw_data, last_updated, sync_version, status, created_at
                )
                VALUES (
                    :jobId, :title, :description, :summary, :department, :location, :jobType,
                    :employmentType, :salaryRange, :applyUrl, :sourceUrl, :postedDate, :expiryDate,
                    :postedAt, :expiresAt, :source, :rawData, :lastUpdated, :syncVersion, :status, :lastUpdated
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(
                "insert of listing " + listing.jobId(), 1, 0);
        }
        return key.longValue();
    }

    @Override
    public List<ListingRecordRef> findAllActiveRefs() {
        return jdbc.query(
            """
                SELECT id, job_id
                FROM job_listings
                WHERE status <> :trash
                ORDER BY id
                """,
            new MapSqlParameterSource("trash", STATUS_TRASH),
            (rs, rowNum) -> new ListingRecordRef(rs.getLong("id"), rs.getString("job_id"))
        );
    }

    @Override
    public boolean hardDelete(long recordId) {
        int deleted = jdbc.update(
            "DELETE FROM job_listings WHERE id = :id",
            new MapSqlParameterSource("id", recordId)
        );
        return deleted > 0;
    }

    @Override
    public List<JobListingView> findListings(String department, String location, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("trash", STATUS_TRASH)
            .addValue("limit", Math.max(1, limit));
        StringBuilder sql = new StringBuilder(
            """
                SELECT id, job_id, title, description, summary, department, location, job_type,
                       employment_type, salary_range, apply_url, source_url, posted_at, expires_at,
                       last_updated, sync_version
                FROM job_listings
                WHERE status <> :trash
                """
        );
        if (department != null && !department.isBlank()) {
            sql.append(" AND LOWER(department) = LOWER(:department)");
            params.addValue("department", department.trim());
        }
        if (location != null && !location.isBlank()) {
            sql.append(" AND LOWER(location) = LOWER(:location)");
            params.addValue("location", location.trim());
        }
        sql.append(" ORDER BY posted_at DESC, id DESC LIMIT :limit");
        return jdbc.query(sql.toString(), params, VIEW_MAPPER);
    }

    @Override
    public Optional<JobListingView> findByJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        List<JobListingView> rows = jdbc.query(
            """
                SELECT id, job_id, title, description, summary, department, location, job_type,
                       employment_type, salary_range, apply_url, source_url, posted_at, expires_at,
                       last_updated, sync_version
                FROM job_listings
                WHERE job_id = :jobId
                  AND status <> :trash
                ORDER BY id
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("trash", STATUS_TRASH),
            VIEW_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public long countActive() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_listings WHERE status <> :trash",
            new MapSqlParameterSource("trash", STATUS_TRASH),
            Long.class
        );
        return count == null ? 0L : count;
    }

    @Override
    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    private MapSqlParameterSource listingParams(ListingRecord listing) {
        return new MapSqlParameterSource()
            .addValue("jobId", listing.jobId())
            .addValue("title", listing.title())
            .addValue("description", listing.description())
            .addValue("summary", listing.summary())
            .addValue("department", listing.department())
            .addValue("location", listing.location())
            .addValue("jobType", listing.jobType())
            .addValue("employmentType", listing.employmentType())
            .addValue("salaryRange", listing.salaryRange())
            .addValue("applyUrl", listing.applyUrl())
            .addValue("sourceUrl", listing.sourceUrl())
            .addValue("postedDate", listing.postedDate())
            .addValue("expiryDate", listing.expiryDate())
            .addValue("postedAt", toTimestamp(listing.postedAt()))
            .addValue("expiresAt", toTimestamp(listing.expiresAt()))
            .addValue("source", listing.source())
            .addValue("rawData", listing.rawData())
            .addValue("lastUpdated", toTimestamp(listing.lastUpdated()))
            .addValue("syncVersion", listing.syncVersion())
            .addValue("status", STATUS_PUBLISH);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
