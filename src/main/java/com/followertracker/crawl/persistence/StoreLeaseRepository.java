package com.followertracker.crawl.persistence;

import com.followertracker.crawl.model.StoreLease;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class StoreLeaseRepository {
    private static final int LEASE_ID = 1;

    private final NamedParameterJdbcTemplate jdbc;

    public StoreLeaseRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Claims the store when it is free, expired, or already held by {@code lockOwner}.
     */
    public boolean tryAcquire(String lockOwner, long ttlSeconds) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", LEASE_ID)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))))
            .addValue("lockOwner", safeOwner(lockOwner));
        int rows = jdbc.update(
            """
                UPDATE store_lease
                SET lock_owner = :lockOwner,
                    locked_until = :lockedUntil,
                    acquired_at = CASE WHEN lock_owner = :lockOwner THEN acquired_at ELSE :now END
                WHERE id = :id
                  AND (lock_owner IS NULL OR locked_until IS NULL OR locked_until < :now OR lock_owner = :lockOwner)
                """,
            params
        );
        return rows == 1;
    }

    /**
     * Replaces {@code previousOwner} with {@code lockOwner}; fails if anyone else touched the lease first.
     */
    public boolean takeOver(String previousOwner, String lockOwner, long ttlSeconds) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", LEASE_ID)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))))
            .addValue("previousOwner", safeOwner(previousOwner))
            .addValue("lockOwner", safeOwner(lockOwner));
        int rows = jdbc.update(
            """
                UPDATE store_lease
                SET lock_owner = :lockOwner,
                    locked_until = :lockedUntil,
                    acquired_at = :now
                WHERE id = :id
                  AND lock_owner = :previousOwner
                """,
            params
        );
        return rows == 1;
    }

    public boolean renew(String lockOwner, long ttlSeconds) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", LEASE_ID)
            .addValue("lockedUntil", Timestamp.from(now.plusSeconds(Math.max(1, ttlSeconds))))
            .addValue("lockOwner", safeOwner(lockOwner));
        int rows = jdbc.update(
            """
                UPDATE store_lease
                SET locked_until = :lockedUntil
                WHERE id = :id
                  AND lock_owner = :lockOwner
                """,
            params
        );
        return rows == 1;
    }

    public void release(String lockOwner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", LEASE_ID)
            .addValue("lockOwner", safeOwner(lockOwner));
        jdbc.update(
            """
                UPDATE store_lease
                SET lock_owner = NULL,
                    locked_until = NULL,
                    acquired_at = NULL
                WHERE id = :id
                  AND lock_owner = :lockOwner
                """,
            params
        );
    }

    public StoreLease findLease() {
        List<StoreLease> rows = jdbc.query(
            """
                SELECT lock_owner, locked_until, acquired_at
                FROM store_lease
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", LEASE_ID),
            (rs, rowNum) -> new StoreLease(
                rs.getString("lock_owner"),
                rs.getTimestamp("locked_until") == null ? null : rs.getTimestamp("locked_until").toInstant(),
                rs.getTimestamp("acquired_at") == null ? null : rs.getTimestamp("acquired_at").toInstant()
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private String safeOwner(String lockOwner) {
        return (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
    }
}
