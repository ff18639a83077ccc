package in.launchkit.infrastructure.persistence;

import in.launchkit.application.port.output.WalletSecretsStore;
import in.launchkit.domain.launch.LauncherWallet;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public final class InMemoryWalletSecretsStore implements WalletSecretsStore {

    private final AtomicReference<LauncherWallet> wallet = new AtomicReference<>();

    @Override
    public Optional<LauncherWallet> load() {
        LauncherWallet current = wallet.get();
        return current != null && current.isComplete() ? Optional.of(current) : Optional.empty();
    }

    @Override
    public void save(LauncherWallet value) {
        wallet.set(value);
    }
}
