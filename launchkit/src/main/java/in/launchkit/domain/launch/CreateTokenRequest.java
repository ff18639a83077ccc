package in.launchkit.domain.launch;

import java.math.BigDecimal;

/**
 * Create-and-buy trade for a new token.
 *
 * @param amountSol      creator buy, denominated in SOL
 * @param slippage       whole percent
 * @param priorityFeeSol priority fee in SOL
 */
public record CreateTokenRequest(
    String name,
    String symbol,
    String metadataUri,
    BigDecimal amountSol,
    int slippage,
    BigDecimal priorityFeeSol,
    MintKeypair mint
) {}
