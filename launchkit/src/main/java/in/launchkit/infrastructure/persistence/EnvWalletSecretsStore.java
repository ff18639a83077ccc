package in.launchkit.infrastructure.persistence;

import in.launchkit.application.port.output.WalletSecretsStore;
import in.launchkit.config.WalletSettings;
import in.launchkit.domain.launch.LauncherWallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Prefers a wallet supplied through configuration; otherwise defers to a persistent store.
 * Saves always go to the persistent store.
 */
public final class EnvWalletSecretsStore implements WalletSecretsStore {
    private static final Logger log = LoggerFactory.getLogger(EnvWalletSecretsStore.class);

    private final WalletSettings configured;
    private final WalletSecretsStore delegate;

    public EnvWalletSecretsStore(WalletSettings configured, WalletSecretsStore delegate) {
        this.configured = configured;
        this.delegate = delegate;
    }

    @Override
    public Optional<LauncherWallet> load() {
        if (configured.isComplete()) {
            return Optional.of(new LauncherWallet(configured.apiKey(), configured.walletAddress(), configured.walletSecret()));
        }
        return delegate.load();
    }

    @Override
    public void save(LauncherWallet wallet) {
        if (configured.isComplete()) {
            log.warn("[SECRETS] Wallet configured via environment; persisting issued wallet {} anyway", wallet.wallet());
        }
        delegate.save(wallet);
    }
}
