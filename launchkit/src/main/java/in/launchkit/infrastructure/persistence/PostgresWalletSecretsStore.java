package in.launchkit.infrastructure.persistence;

import in.launchkit.application.port.output.WalletSecretsStore;
import in.launchkit.domain.launch.LauncherWallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

/**
 * Launcher wallet persisted in launchkit_secrets under a single well-known row.
 */
public final class PostgresWalletSecretsStore implements WalletSecretsStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresWalletSecretsStore.class);

    private static final String ROW_NAME = "launcher_wallet";

    private final DataSource dataSource;

    public PostgresWalletSecretsStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<LauncherWallet> load() {
        String sql = "SELECT api_key, wallet, wallet_secret FROM launchkit_secrets WHERE name = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ROW_NAME);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    LauncherWallet wallet = new LauncherWallet(
                        rs.getString("api_key"), rs.getString("wallet"), rs.getString("wallet_secret"));
                    return wallet.isComplete() ? Optional.of(wallet) : Optional.empty();
                }
            }
        } catch (Exception e) {
            log.error("Failed to load launcher wallet: {}", e.getMessage());
            throw new RuntimeException("Failed to load launcher wallet", e);
        }
        return Optional.empty();
    }

    @Override
    public void save(LauncherWallet wallet) {
        String sql = """
                INSERT INTO launchkit_secrets (name, api_key, wallet, wallet_secret, updated_at)
                VALUES (?, ?, ?, ?, NOW())
                ON CONFLICT (name) DO UPDATE
                SET api_key = EXCLUDED.api_key,
                    wallet = EXCLUDED.wallet,
                    wallet_secret = EXCLUDED.wallet_secret,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ROW_NAME);
            ps.setString(2, wallet.apiKey());
            ps.setString(3, wallet.wallet());
            ps.setString(4, wallet.walletSecret());
            ps.executeUpdate();

            log.info("[SECRETS] Launcher wallet {} persisted", wallet.wallet());
        } catch (Exception e) {
            log.error("Failed to save launcher wallet: {}", e.getMessage());
            throw new RuntimeException("Failed to save launcher wallet", e);
        }
    }
}
