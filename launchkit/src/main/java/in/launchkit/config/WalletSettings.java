package in.launchkit.config;

/**
 * Pre-provisioned launcher wallet, all three values or none.
 */
public record WalletSettings(String apiKey, String walletAddress, String walletSecret) {

    public static WalletSettings none() {
        return new WalletSettings(null, null, null);
    }

    public boolean isComplete() {
        return notBlank(apiKey) && notBlank(walletAddress) && notBlank(walletSecret);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "WalletSettings[apiKey=" + (apiKey == null ? "unset" : "****")
            + ", walletAddress=" + walletAddress
            + ", walletSecret=" + (walletSecret == null ? "unset" : "****") + "]";
    }
}
