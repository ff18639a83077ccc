package in.launchkit.application.port.output;

import in.launchkit.domain.launch.CreateTokenRequest;
import in.launchkit.domain.launch.LauncherWallet;
import in.launchkit.domain.launch.TradeReceipt;

/**
 * Remote launch portal: wallet issuance and token create-and-buy trades.
 *
 * Failures surface as {@link in.launchkit.domain.common.LaunchKitException} with
 * EXTERNAL_CALL_FAILED or RESPONSE_INVALID kinds.
 */
public interface LaunchPortal {

    /**
     * Issue a new custodial wallet. The returned secret is validated as a 64-byte base58 key.
     */
    LauncherWallet createWallet();

    TradeReceipt submitCreate(LauncherWallet wallet, CreateTokenRequest request);
}
