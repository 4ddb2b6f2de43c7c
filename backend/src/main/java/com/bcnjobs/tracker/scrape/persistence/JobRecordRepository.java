package com.bcnjobs.tracker.scrape.persistence;

import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.SubmitResult;
import com.bcnjobs.tracker.scrape.model.WorkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Job record store. Uniqueness of {@code identity_key} and {@code url} is enforced by the database,
 * so concurrent submissions of one posting insert exactly once.
 */
@Repository
public class JobRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(JobRecordRepository.class);

    private static final String COLUMNS = """
        identity_key, company_id, title, url, location, department, posted_date, description,
        discovered_at, is_target_location, is_target_role, mentions_visa, mentions_relocation,
        work_type, is_core_role
        """;

    private static final String INSERT_SQL = """
        INSERT INTO job_records (
            identity_key, company_id, title, url, location, department, posted_date, description,
            discovered_at, is_target_location, is_target_role, mentions_visa, mentions_relocation,
            work_type, is_core_role
        )
        VALUES (
            :identityKey, :companyId, :title, :url, :location, :department, :postedDate, :description,
            :discoveredAt, :targetLocation, :targetRole, :mentionsVisa, :mentionsRelocation,
            :workType, :coreRole
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final boolean postgres;

    public JobRecordRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Inserts the record on first sighting; any later submission with the same identity key or URL
     * is reported as {@link SubmitResult#DUPLICATE} and leaves the stored row untouched.
     */
    public SubmitResult submit(JobRecord record) {
        return submit(record, clock.instant());
    }

    SubmitResult submit(JobRecord record, Instant discoveredAt) {
        MapSqlParameterSource params = toParams(record, discoveredAt.truncatedTo(ChronoUnit.MICROS));
        if (postgres) {
            int rows = jdbc.update(INSERT_SQL + " ON CONFLICT DO NOTHING", params);
            return rows == 1 ? SubmitResult.INSERTED : SubmitResult.DUPLICATE;
        }
        try {
            jdbc.update(INSERT_SQL, params);
            return SubmitResult.INSERTED;
        } catch (DuplicateKeyException e) {
            log.debug("Duplicate job record {} for {}", params.getValue("identityKey"), record.url());
            return SubmitResult.DUPLICATE;
        }
    }

    /**
     * Records discovered at or after {@code since}, newest first.
     */
    public List<JobRecord> queryRecent(Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", toTimestamp(since == null ? Instant.EPOCH : since));
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM job_records
                WHERE discovered_at >= :since
                ORDER BY discovered_at DESC, identity_key ASC
                """,
            params,
            recordMapper()
        );
    }

    /**
     * All records whose persisted location text satisfies {@code locationPredicate}, newest first.
     * A null location is passed to the predicate as an empty string.
     */
    public List<JobRecord> queryAllMatching(Predicate<String> locationPredicate) {
        List<JobRecord> all = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM job_records
                ORDER BY discovered_at DESC, identity_key ASC
                """,
            new MapSqlParameterSource(),
            recordMapper()
        );
        if (locationPredicate == null) {
            return all;
        }
        return all.stream()
            .filter(record -> locationPredicate.test(record.location() == null ? "" : record.location()))
            .toList();
    }

    /**
     * Records whose stored {@code is_target_location} flag is set, newest first. The flag was derived
     * from location, title and description at submit time.
     */
    public List<JobRecord> queryTargetLocation() {
        return jdbc.query(
            "SELECT " + COLUMNS + """
                FROM job_records
                WHERE is_target_location = TRUE
                ORDER BY discovered_at DESC, identity_key ASC
                """,
            new MapSqlParameterSource(),
            recordMapper()
        );
    }

    public JobRecord findByIdentityKey(String identityKey) {
        if (identityKey == null || identityKey.isBlank()) {
            return null;
        }
        List<JobRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + """
                FROM job_records
                WHERE identity_key = :identityKey
                """,
            new MapSqlParameterSource("identityKey", identityKey.trim().toLowerCase(Locale.ROOT)),
            recordMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long count() {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM job_records", Long.class);
        return value == null ? 0L : value;
    }

    private MapSqlParameterSource toParams(JobRecord record, Instant discoveredAt) {
        return new MapSqlParameterSource()
            .addValue("identityKey", record.identityKey())
            .addValue("companyId", record.companyId())
            .addValue("title", record.title())
            .addValue("url", record.url())
            .addValue("location", record.location())
            .addValue("department", record.department())
            .addValue("postedDate", record.postedDate() == null ? null : Date.valueOf(record.postedDate()))
            .addValue("description", record.description())
            .addValue("discoveredAt", toTimestamp(discoveredAt))
            .addValue("targetLocation", record.targetLocation())
            .addValue("targetRole", record.targetRole())
            .addValue("mentionsVisa", record.mentionsVisaSupport())
            .addValue("mentionsRelocation", record.mentionsRelocation())
            .addValue("workType", record.workType() == null ? null : record.workType().name())
            .addValue("coreRole", record.coreRole());
    }

    private RowMapper<JobRecord> recordMapper() {
        return (rs, rowNum) -> new JobRecord(
            rs.getString("company_id"),
            rs.getString("title"),
            rs.getString("url"),
            rs.getString("location"),
            rs.getString("department"),
            toLocalDate(rs.getDate("posted_date")),
            rs.getString("description"),
            toInstant(rs.getTimestamp("discovered_at")),
            rs.getBoolean("is_target_location"),
            rs.getBoolean("is_target_role"),
            rs.getBoolean("mentions_visa"),
            rs.getBoolean("mentions_relocation"),
            parseWorkType(rs),
            rs.getBoolean("is_core_role")
        );
    }

    private WorkType parseWorkType(ResultSet rs) throws SQLException {
        String raw = rs.getString("work_type");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return WorkType.valueOf(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown work_type value in job_records: {}", raw);
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to plain inserts", e);
            return false;
        }
    }
}
