package com.followertracker.crawl.persistence;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.model.CrawlCheckpoint;
import com.followertracker.crawl.model.FollowerProfile;
import com.followertracker.crawl.model.FollowerRecord;
import com.followertracker.crawl.model.FollowerStatus;
import com.followertracker.crawl.model.ProfileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable follower store. Writes are serialized through a single writer lock and each one
 * commits in its own short transaction before returning; with {@code sync-writes} enabled the
 * database is also forced to disk, so callers can rely on a returned write surviving a crash.
 */
@Repository
public class FollowerJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(FollowerJdbcRepository.class);
    private static final int CHECKPOINT_ID = 1;
    private static final int LOOKUP_CHUNK_SIZE = 500;

    private static final RowMapper<FollowerRecord> FOLLOWER_ROW_MAPPER = (rs, rowNum) -> {
        FollowerStatus status = FollowerStatus.fromDbValue(rs.getString("status"));
        return new FollowerRecord(
            rs.getString("follower_id"),
            rs.getLong("discovery_seq"),
            status,
            rs.getTimestamp("last_fetched_at") == null || rs.getString("screen_name") == null
                ? null
                : mapProfile(rs),
            rs.getString("failure_reason"),
            rs.getInt("profile_attempts"),
            toInstant(rs.getTimestamp("discovered_at")),
            toInstant(rs.getTimestamp("last_fetched_at"))
        );
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final CrawlerProperties properties;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FollowerJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        CrawlerProperties properties
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * Ties the store to one tracked account. The first call records the account; later calls
     * for a different account fail.
     */
    public CrawlCheckpoint bindAccount(String account) {
        String normalized = normalizeAccount(account);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Tracked account must not be blank");
        }
        writeLock.lock();
        try {
            CrawlCheckpoint checkpoint = transactionTemplate.execute(status -> {
                CrawlCheckpoint existing = findCheckpoint();
                if (existing != null) {
                    if (!existing.account().equals(normalized)) {
                        throw new StoreAccountMismatchException(existing.account(), normalized);
                    }
                    return existing;
                }
                Instant now = Instant.now();
                jdbc.update(
                    """
                        INSERT INTO crawl_checkpoint (id, account, listing_cursor, pages_fetched, enrichment_marker, updated_at)
                        VALUES (:id, :account, NULL, 0, 0, :now)
                        """,
                    new MapSqlParameterSource()
                        .addValue("id", CHECKPOINT_ID)
                        .addValue("account", normalized)
                        .addValue("now", Timestamp.from(now))
                );
                log.info("Bound store to account {}", normalized);
                return new CrawlCheckpoint(normalized, null, 0, 0, now);
            });
            sync();
            return checkpoint;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Inserts identifiers not yet known with status {@code discovered}; known identifiers are
     * left untouched. The whole page commits atomically.
     *
     * @return number of identifiers that were new to the store
     */
    public int upsertFollowers(List<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return 0;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String identifier : identifiers) {
            if (identifier != null && !identifier.isBlank()) {
                unique.add(identifier.trim());
            }
        }
        if (unique.isEmpty()) {
            return 0;
        }
        writeLock.lock();
        try {
            Integer inserted = transactionTemplate.execute(status -> {
                List<String> ordered = new ArrayList<>(unique);
                int total = 0;
                for (int start = 0; start < ordered.size(); start += LOOKUP_CHUNK_SIZE) {
                    List<String> chunk = ordered.subList(start, Math.min(ordered.size(), start + LOOKUP_CHUNK_SIZE));
                    total += insertMissing(chunk);
                }
                return total;
            });
            sync();
            return inserted == null ? 0 : inserted;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Moves a follower to {@code profile_fetched} or {@code profile_failed}. A fetched profile
     * replaces any earlier snapshot; a failure keeps the last good snapshot and records why.
     */
    public void recordProfile(String followerId, ProfileResult result) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("followerId", followerId)
            .addValue("status", result.status().dbValue())
            .addValue("now", Timestamp.from(now));
        String sql;
        if (result.isFetched()) {
            FollowerProfile profile = result.profile();
            params
                .addValue("screenName", profile.screenName())
                .addValue("displayName", profile.displayName())
                .addValue("bio", profile.bio())
                .addValue("location", profile.location())
                .addValue("url", profile.url())
                .addValue("followersCount", profile.followersCount())
                .addValue("friendsCount", profile.friendsCount())
                .addValue("statusesCount", profile.statusesCount())
                .addValue("listedCount", profile.listedCount())
                .addValue("favouritesCount", profile.favouritesCount())
                .addValue("verified", profile.verified())
                .addValue("protectedAccount", profile.protectedAccount())
                .addValue("accountCreatedAt", toTimestamp(profile.accountCreatedAt()), Types.TIMESTAMP)
                .addValue("lang", profile.lang())
                .addValue("lastStatusId", profile.lastStatusId())
                .addValue("lastStatusText", profile.lastStatusText())
                .addValue("lastStatusAt", toTimestamp(profile.lastStatusAt()), Types.TIMESTAMP);
            sql = """
                UPDATE followers
                SET status = :status,
                    screen_name = :screenName,
                    display_name = :displayName,
                    bio = :bio,
                    location = :location,
                    url = :url,
                    followers_count = :followersCount,
                    friends_count = :friendsCount,
                    statuses_count = :statusesCount,
                    listed_count = :listedCount,
                    favourites_count = :favouritesCount,
                    verified = :verified,
                    protected_account = :protectedAccount,
                    account_created_at = :accountCreatedAt,
                    lang = :lang,
                    last_status_id = :lastStatusId,
                    last_status_text = :lastStatusText,
                    last_status_at = :lastStatusAt,
                    failure_reason = NULL,
                    profile_attempts = profile_attempts + 1,
                    last_fetched_at = :now,
                    updated_at = :now
                WHERE follower_id = :followerId
                """;
        } else {
            params.addValue("failureReason", truncate(result.failureReason(), 64));
            sql = """
                UPDATE followers
                SET status = :status,
                    failure_reason = :failureReason,
                    profile_attempts = profile_attempts + 1,
                    updated_at = :now
                WHERE follower_id = :followerId
                """;
        }

        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                int rows = jdbc.update(sql, params);
                if (rows != 1) {
                    throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(sql, 1, rows);
                }
            });
            sync();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return the stored checkpoint, or a not-started checkpoint with no account when the store
     *     is fresh
     */
    public CrawlCheckpoint loadCheckpoint() {
        CrawlCheckpoint checkpoint = findCheckpoint();
        return checkpoint == null ? CrawlCheckpoint.notStarted(null) : checkpoint;
    }

    /**
     * Durably replaces the singleton checkpoint. Callers must only pass a checkpoint whose
     * records have already been committed.
     */
    public CrawlCheckpoint saveCheckpoint(CrawlCheckpoint checkpoint) {
        if (checkpoint == null || checkpoint.account() == null) {
            throw new IllegalArgumentException("Checkpoint must name the tracked account");
        }
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", CHECKPOINT_ID)
            .addValue("account", checkpoint.account())
            .addValue("listingCursor", checkpoint.listingCursor(), Types.VARCHAR)
            .addValue("pagesFetched", checkpoint.pagesFetched())
            .addValue("enrichmentMarker", checkpoint.enrichmentMarker())
            .addValue("now", Timestamp.from(now));
        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                CrawlCheckpoint existing = findCheckpoint();
                if (existing != null && !existing.account().equals(checkpoint.account())) {
                    throw new StoreAccountMismatchException(existing.account(), checkpoint.account());
                }
                if (existing == null) {
                    jdbc.update(
                        """
                            INSERT INTO crawl_checkpoint (id, account, listing_cursor, pages_fetched, enrichment_marker, updated_at)
                            VALUES (:id, :account, :listingCursor, :pagesFetched, :enrichmentMarker, :now)
                            """,
                        params
                    );
                } else {
                    jdbc.update(
                        """
                            UPDATE crawl_checkpoint
                            SET listing_cursor = :listingCursor,
                                pages_fetched = :pagesFetched,
                                enrichment_marker = :enrichmentMarker,
                                updated_at = :now
                            WHERE id = :id
                            """,
                        params
                    );
                }
            });
            sync();
        } finally {
            writeLock.unlock();
        }
        return new CrawlCheckpoint(
            checkpoint.account(),
            checkpoint.listingCursor(),
            checkpoint.pagesFetched(),
            checkpoint.enrichmentMarker(),
            now
        );
    }

    public List<String> nextIdentifiersNeedingProfile(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", FollowerStatus.DISCOVERED.dbValue())
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT follower_id
                FROM followers
                WHERE status = :status
                ORDER BY discovery_seq ASC
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> rs.getString("follower_id")
        );
    }

    public boolean hasIdentifiersNeedingProfile() {
        return !nextIdentifiersNeedingProfile(1).isEmpty();
    }

    public Optional<FollowerRecord> findFollower(String followerId) {
        List<FollowerRecord> rows = jdbc.query(
            """
                SELECT *
                FROM followers
                WHERE follower_id = :followerId
                """,
            new MapSqlParameterSource().addValue("followerId", followerId),
            FOLLOWER_ROW_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<FollowerRecord> findFollowers(int limit) {
        return jdbc.query(
            """
                SELECT *
                FROM followers
                ORDER BY discovery_seq ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            FOLLOWER_ROW_MAPPER
        );
    }

    public Map<FollowerStatus, Long> countByStatus() {
        Map<FollowerStatus, Long> counts = new EnumMap<>(FollowerStatus.class);
        for (FollowerStatus status : FollowerStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM followers
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(FollowerStatus.fromDbValue(rs.getString("status")), rs.getLong("total"));
            }
        );
        return counts;
    }

    private int insertMissing(List<String> chunk) {
        Set<String> existing = new HashSet<>(jdbc.query(
            """
                SELECT follower_id
                FROM followers
                WHERE follower_id IN (:ids)
                """,
            new MapSqlParameterSource().addValue("ids", chunk),
            (rs, rowNum) -> rs.getString("follower_id")
        ));
        List<SqlParameterSource> batch = new ArrayList<>();
        Timestamp now = Timestamp.from(Instant.now());
        for (String identifier : chunk) {
            if (existing.contains(identifier)) {
                continue;
            }
            batch.add(new MapSqlParameterSource()
                .addValue("followerId", identifier)
                .addValue("status", FollowerStatus.DISCOVERED.dbValue())
                .addValue("now", now));
        }
        if (batch.isEmpty()) {
            return 0;
        }
        jdbc.batchUpdate(
            """
                INSERT INTO followers (follower_id, status, profile_attempts, discovered_at, updated_at)
                VALUES (:followerId, :status, 0, :now, :now)
                """,
            batch.toArray(new SqlParameterSource[0])
        );
        return batch.size();
    }

    private CrawlCheckpoint findCheckpoint() {
        List<CrawlCheckpoint> rows = jdbc.query(
            """
                SELECT account, listing_cursor, pages_fetched, enrichment_marker, updated_at
                FROM crawl_checkpoint
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", CHECKPOINT_ID),
            (rs, rowNum) -> new CrawlCheckpoint(
                rs.getString("account"),
                rs.getString("listing_cursor"),
                rs.getLong("pages_fetched"),
                rs.getLong("enrichment_marker"),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private void sync() {
        if (properties.getStore().isSyncWrites()) {
            jdbc.getJdbcTemplate().execute("CHECKPOINT SYNC");
        }
    }

    private static FollowerProfile mapProfile(ResultSet rs) throws SQLException {
        return new FollowerProfile(
            rs.getString("follower_id"),
            rs.getString("screen_name"),
            rs.getString("display_name"),
            rs.getString("bio"),
            rs.getString("location"),
            rs.getString("url"),
            rs.getLong("followers_count"),
            rs.getLong("friends_count"),
            rs.getLong("statuses_count"),
            rs.getLong("listed_count"),
            rs.getLong("favourites_count"),
            rs.getBoolean("verified"),
            rs.getBoolean("protected_account"),
            toInstant(rs.getTimestamp("account_created_at")),
            rs.getString("lang"),
            rs.getString("last_status_id"),
            rs.getString("last_status_text"),
            toInstant(rs.getTimestamp("last_status_at"))
        );
    }

    static String normalizeAccount(String account) {
        if (account == null) {
            return "";
        }
        String trimmed = account.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
