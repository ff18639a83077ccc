package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPortal;
import in.launchkit.application.port.output.WalletSecretsStore;
import in.launchkit.domain.launch.LauncherWallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Returns the cached launcher wallet, provisioning one on first use.
 *
 * Provisioning is serialized within this process and re-checks the store under the lock.
 * Separate processes sharing one secrets store can still each provision a wallet; the last save wins.
 */
public final class LauncherWalletProvider {
    private static final Logger log = LoggerFactory.getLogger(LauncherWalletProvider.class);

    private final WalletSecretsStore secretsStore;
    private final LaunchPortal portal;
    private final Object provisionLock = new Object();

    public LauncherWalletProvider(WalletSecretsStore secretsStore, LaunchPortal portal) {
        this.secretsStore = secretsStore;
        this.portal = portal;
    }

    public LauncherWallet ensureWallet() {
        Optional<LauncherWallet> saved = secretsStore.load();
        if (saved.isPresent()) {
            return saved.get();
        }

        synchronized (provisionLock) {
            saved = secretsStore.load();
            if (saved.isPresent()) {
                return saved.get();
            }
            log.info("[WALLET] No launcher wallet cached, provisioning one");
            LauncherWallet wallet = portal.createWallet();
            secretsStore.save(wallet);
            return wallet;
        }
    }
}
