package in.launchkit.infrastructure.persistence;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launchpack.Channel;
import in.launchkit.domain.launchpack.LaunchClaim;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackInput;
import in.launchkit.domain.launchpack.LaunchPackJson;
import in.launchkit.domain.launchpack.LaunchPackMutations;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.PublishClaim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL implementation of LaunchPackStore.
 *
 * Claims lock the row with SELECT ... FOR UPDATE, check the claim predicate on the locked state and
 * write under the same predicate and row version, so exactly one of any set of concurrent claimers
 * wins, across processes.
 */
public final class PostgresLaunchPackStore implements LaunchPackStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresLaunchPackStore.class);

    private static final String LAUNCH_CLAIM_PREDICATE = """
            launch_status <> 'launched'
            AND (launch_requested_at IS NULL OR launch_status = 'failed')
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresLaunchPackStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public PostgresLaunchPackStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public LaunchPack create(LaunchPackInput input) {
        String key = input.idempotencyKey();
        if (key != null) {
            Optional<LaunchPack> existing = findByIdempotencyKey(key);
            if (existing.isPresent()) {
                log.info("[STORE] Idempotent create hit: key matched {}", existing.get().id());
                return existing.get();
            }
        }

        LaunchPack pack = LaunchPackMutations.create(input, UUID.randomUUID().toString(), clock.instant());

        String sql = """
                INSERT INTO launch_packs (
                    id, idempotency_key, data, version, launch_status, launch_requested_at,
                    created_at, updated_at
                ) VALUES (?, ?, ?::jsonb, ?, ?, ?, ?, ?)
                ON CONFLICT (idempotency_key) DO NOTHING
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, pack.id());
            ps.setString(2, key);
            ps.setString(3, LaunchPackJson.write(pack));
            ps.setInt(4, pack.version());
            ps.setString(5, pack.launch().status().wire());
            setTimestampOrNull(ps, 6, pack.launch().requestedAt());
            ps.setTimestamp(7, Timestamp.from(pack.createdAt()));
            ps.setTimestamp(8, Timestamp.from(pack.updatedAt()));

            int inserted = ps.executeUpdate();
            if (inserted == 0) {
                log.info("[STORE] Concurrent create with key {}, returning winner", key);
                return findByIdempotencyKey(key)
                    .orElseThrow(() -> new IllegalStateException("Idempotency key conflict without a row: " + key));
            }
            log.info("[STORE] Created LaunchPack {} ({})", pack.id(), pack.brand().ticker());
            return pack;

        } catch (LaunchKitException | IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create LaunchPack: {}", e.getMessage());
            throw new RuntimeException("Failed to create LaunchPack", e);
        }
    }

    @Override
    public Optional<LaunchPack> get(String id) {
        String sql = "SELECT data FROM launch_packs WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find LaunchPack {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find LaunchPack", e);
        }
        return Optional.empty();
    }

    private Optional<LaunchPack> findByIdempotencyKey(String key) {
        String sql = "SELECT data FROM launch_packs WHERE idempotency_key = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find LaunchPack by idempotency key: {}", e.getMessage());
            throw new RuntimeException("Failed to find LaunchPack", e);
        }
        return Optional.empty();
    }

    @Override
    public LaunchPack update(String id, LaunchPackPatch patch) {
        String selectSql = "SELECT data FROM launch_packs WHERE id = ? FOR UPDATE";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                LaunchPack current;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            throw LaunchKitException.notFound(id);
                        }
                        current = mapRow(rs);
                    }
                }

                LaunchPack next = LaunchPackMutations.applyPatch(current, patch, clock.instant());
                writeRow(conn, next, null, null, null);

                conn.commit();
                log.debug("[STORE] Updated LaunchPack {} version {} → {}", id, current.version(), next.version());
                return next;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (LaunchKitException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to update LaunchPack {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to update LaunchPack", e);
        }
    }

    @Override
    public Optional<LaunchPack> claimLaunch(String id, LaunchClaim claim) {
        Instant now = clock.instant();
        return claimRow(id, "launch", LAUNCH_CLAIM_PREDICATE, null,
            LaunchPackMutations::canClaimLaunch,
            current -> LaunchPackMutations.claimLaunch(current, claim, now));
    }

    @Override
    public Optional<LaunchPack> claimTelegramPublish(String id, PublishClaim claim) {
        return claimPublish(id, Channel.TELEGRAM, claim);
    }

    @Override
    public Optional<LaunchPack> claimXPublish(String id, PublishClaim claim) {
        return claimPublish(id, Channel.X, claim);
    }

    private Optional<LaunchPack> claimPublish(String id, Channel channel, PublishClaim claim) {
        Instant now = clock.instant();
        String field = channel.opsField();
        String predicate = """
                (COALESCE(data #>> '{ops,%1$s,status}', 'idle') = 'idle'
                 OR (data #>> '{ops,%1$s,status}' = 'failed'
                     AND (?::boolean OR COALESCE((data #>> '{ops,%1$s,failed_at}')::timestamptz, 'epoch'::timestamptz) <= ?::timestamptz)))
                """.formatted(field);
        Instant cutoff = claim.requestedAt().minus(LaunchPackMutations.RETRY_COOLDOWN);

        return claimRow(id, field, predicate, new Object[]{claim.force(), Timestamp.from(cutoff)},
            current -> LaunchPackMutations.canClaimPublish(current.publishState(channel), claim),
            current -> LaunchPackMutations.claimPublish(current, channel, claim, now));
    }

    /**
     * Lock the row, check the claim against the locked state, then write under the same predicate.
     * Concurrent updates wait on the row lock instead of invalidating the claim.
     */
    private Optional<LaunchPack> claimRow(String id, String operation, String predicateSql, Object[] predicateParams,
                                               Predicate<LaunchPack> canClaim,
                                               UnaryOperator<LaunchPack> transition) {
        String selectSql = "SELECT data FROM launch_packs WHERE id = ? FOR UPDATE";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                LaunchPack current;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return Optional.empty();
                        }
                        current = mapRow(rs);
                    }
                }

                if (!canClaim.test(current)) {
                    conn.rollback();
                    log.debug("[STORE] {} slot on {} not claimable", operation, id);
                    return Optional.empty();
                }

                LaunchPack next = transition.apply(current);
                if (writeRow(conn, next, current.version(), predicateSql, predicateParams) != 1) {
                    conn.rollback();
                    log.warn("[STORE] {} claim on {} matched no row while holding the lock", operation, id);
                    return Optional.empty();
                }

                conn.commit();
                log.info("[STORE] Claimed {} slot for {} (version {})", operation, id, next.version());
                return Optional.of(next);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (Exception e) {
            log.error("Failed to claim {} for {}: {}", operation, id, e.getMessage());
            throw new RuntimeException("Failed to claim " + operation, e);
        }
    }

    private int writeRow(Connection conn, LaunchPack next, Integer expectedVersion,
                         String predicateSql, Object[] predicateParams) throws Exception {
        StringBuilder sql = new StringBuilder("""
                UPDATE launch_packs
                SET data = ?::jsonb,
                    version = ?,
                    launch_status = ?,
                    launch_requested_at = ?,
                    updated_at = ?
                WHERE id = ?
                """);
        if (expectedVersion != null) {
            sql.append(" AND version = ?");
        }
        if (predicateSql != null) {
            sql.append(" AND (").append(predicateSql).append(")");
        }

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, LaunchPackJson.write(next));
            ps.setInt(i++, next.version());
            ps.setString(i++, next.launch().status().wire());
            setTimestampOrNull(ps, i++, next.launch().requestedAt());
            ps.setTimestamp(i++, Timestamp.from(next.updatedAt()));
            ps.setString(i++, next.id());
            if (expectedVersion != null) {
                ps.setInt(i++, expectedVersion);
            }
            if (predicateParams != null) {
                for (Object param : predicateParams) {
                    ps.setObject(i++, param);
                }
            }
            return ps.executeUpdate();
        }
    }

    @Override
    public List<LaunchPack> findDueTelegramPublishes(Instant now, int limit) {
        return findDue(Channel.TELEGRAM, now, limit);
    }

    @Override
    public List<LaunchPack> findDueXPublishes(Instant now, int limit) {
        return findDue(Channel.X, now, limit);
    }

    private List<LaunchPack> findDue(Channel channel, Instant now, int limit) {
        String sql = """
                SELECT data FROM launch_packs
                WHERE COALESCE(data #>> '{ops,%1$s,status}', 'idle') NOT IN ('in_progress', 'published')
                  AND EXISTS (
                      SELECT 1
                      FROM jsonb_array_elements(
                          CASE
                              WHEN jsonb_array_length(COALESCE(data #> '{ops,%1$s,schedule_intent}', '[]'::jsonb)) > 0
                                  THEN data #> '{ops,%1$s,schedule_intent}'
                              ELSE COALESCE(data #> '{%2$s,schedule}', '[]'::jsonb)
                          END
                      ) AS item
                      WHERE (item ->> 'when')::timestamptz <= ?
                  )
                ORDER BY updated_at ASC
                LIMIT ?
                """.formatted(channel.opsField(), channel.contentField());

        List<LaunchPack> due = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            ps.setInt(2, Math.max(limit, 0));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    due.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find due {} publishes: {}", channel, e.getMessage());
            throw new RuntimeException("Failed to find due publishes", e);
        }
        return due;
    }

    @Override
    public int countLaunchedSince(Instant since) {
        String sql = """
                SELECT COUNT(*) FROM launch_packs
                WHERE launch_status = 'launched'
                  AND (data #>> '{launch,launched_at}')::timestamptz >= ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (Exception e) {
            log.error("Failed to count launches: {}", e.getMessage());
            throw new RuntimeException("Failed to count launches", e);
        }
    }

    private LaunchPack mapRow(ResultSet rs) throws Exception {
        return LaunchPackJson.read(rs.getString("data"));
    }

    private void setTimestampOrNull(PreparedStatement ps, int index, Instant value) throws Exception {
        if (value != null) {
            ps.setTimestamp(index, Timestamp.from(value));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }
}
