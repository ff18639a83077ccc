package in.launchkit.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Creates the LaunchKit tables on startup if they are missing.
 *
 * - launch_packs: one JSONB document per LaunchPack plus denormalized claim columns
 * - launchkit_secrets: persisted launcher wallet
 */
public final class LaunchKitSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(LaunchKitSchemaMigration.class);

    private final DataSource dataSource;

    public LaunchKitSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Checking LaunchKit schema");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "launch_packs")) {
                log.info("[MIGRATION] Creating launch_packs table...");
                createLaunchPacksTable(conn);
                log.info("[MIGRATION] ✓ launch_packs table created");
            } else {
                log.info("[MIGRATION] launch_packs table already exists");
            }

            if (!tableExists(conn, "launchkit_secrets")) {
                log.info("[MIGRATION] Creating launchkit_secrets table...");
                createSecretsTable(conn);
                log.info("[MIGRATION] ✓ launchkit_secrets table created");
            }

            log.info("[MIGRATION] Schema ready");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("LaunchKit migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createLaunchPacksTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE IF NOT EXISTS launch_packs (
                id TEXT PRIMARY KEY,
                idempotency_key TEXT UNIQUE,
                data JSONB NOT NULL,
                version INT NOT NULL DEFAULT 1,

                -- Denormalized for the launch claim predicate
                launch_status TEXT NOT NULL DEFAULT 'draft',
                launch_requested_at TIMESTAMPTZ,

                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;
        String indexSql = "CREATE INDEX IF NOT EXISTS idx_launch_packs_updated_at ON launch_packs (updated_at)";

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute(indexSql);
        }
    }

    private void createSecretsTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE IF NOT EXISTS launchkit_secrets (
                name TEXT PRIMARY KEY,
                api_key TEXT NOT NULL,
                wallet TEXT NOT NULL,
                wallet_secret TEXT NOT NULL,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
