package in.launchkit.domain.launch;

/**
 * @param mint mint address echoed by the portal, null when not echoed
 */
public record TradeReceipt(String signature, String mint) {}
