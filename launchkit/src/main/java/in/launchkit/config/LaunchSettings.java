package in.launchkit.config;

import java.math.BigDecimal;

/**
 * Token launch policy.
 *
 * @param devBuySol          SOL spent on the creator buy; defaults to the cap
 * @param priorityFeeSol     priority fee in SOL; defaults to the cap
 * @param maxLaunchesPerDay  0 disables the daily cap
 * @param slippagePercent    requested slippage, floored before use
 * @param maxSlippagePercent optional ceiling on slippage, null when unset
 */
public record LaunchSettings(
    boolean enabled,
    boolean localWithdrawEnabled,
    BigDecimal devBuySol,
    BigDecimal priorityFeeSol,
    BigDecimal maxDevBuySol,
    BigDecimal maxPriorityFeeSol,
    int maxLaunchesPerDay,
    double slippagePercent,
    Double maxSlippagePercent
) {
    public static final double DEFAULT_SLIPPAGE_PERCENT = 10;

    public static LaunchSettings defaults() {
        return new LaunchSettings(false, false, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            0, DEFAULT_SLIPPAGE_PERCENT, null);
    }

    public LaunchSettings withEnabled(boolean value) {
        return new LaunchSettings(value, localWithdrawEnabled, devBuySol, priorityFeeSol, maxDevBuySol,
            maxPriorityFeeSol, maxLaunchesPerDay, slippagePercent, maxSlippagePercent);
    }

    public LaunchSettings withAmounts(BigDecimal devBuy, BigDecimal priorityFee, BigDecimal maxDevBuy, BigDecimal maxPriorityFee) {
        return new LaunchSettings(enabled, localWithdrawEnabled, devBuy, priorityFee, maxDevBuy,
            maxPriorityFee, maxLaunchesPerDay, slippagePercent, maxSlippagePercent);
    }

    public LaunchSettings withSlippage(double slippage, Double maxSlippage) {
        return new LaunchSettings(enabled, localWithdrawEnabled, devBuySol, priorityFeeSol, maxDevBuySol,
            maxPriorityFeeSol, maxLaunchesPerDay, slippage, maxSlippage);
    }

    public LaunchSettings withMaxLaunchesPerDay(int value) {
        return new LaunchSettings(enabled, localWithdrawEnabled, devBuySol, priorityFeeSol, maxDevBuySol,
            maxPriorityFeeSol, value, slippagePercent, maxSlippagePercent);
    }
}
