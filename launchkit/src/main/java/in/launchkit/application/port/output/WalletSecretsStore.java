package in.launchkit.application.port.output;

import in.launchkit.domain.launch.LauncherWallet;

import java.util.Optional;

/**
 * Holds the launcher wallet between launches.
 */
public interface WalletSecretsStore {

    /**
     * @return the wallet when all of its fields are present
     */
    Optional<LauncherWallet> load();

    void save(LauncherWallet wallet);
}
