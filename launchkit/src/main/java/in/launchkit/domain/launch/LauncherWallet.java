package in.launchkit.domain.launch;

/**
 * Custodial launcher wallet issued by the launch portal.
 *
 * @param walletSecret base58 64-byte secret key
 */
public record LauncherWallet(String apiKey, String wallet, String walletSecret) {

    public static final int SECRET_KEY_BYTES = 64;

    public boolean isComplete() {
        return notBlank(apiKey) && notBlank(wallet) && notBlank(walletSecret);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "LauncherWallet[wallet=" + wallet + ", apiKey=****, walletSecret=****]";
    }
}
