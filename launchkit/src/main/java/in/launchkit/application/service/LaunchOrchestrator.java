package in.launchkit.application.service;

import in.launchkit.application.port.output.LaunchPackStore;
import in.launchkit.application.port.output.LaunchPortal;
import in.launchkit.application.port.output.TokenAssetGateway;
import in.launchkit.config.LaunchSettings;
import in.launchkit.domain.common.ErrorKind;
import in.launchkit.domain.common.LaunchKitException;
import in.launchkit.domain.launch.CreateTokenRequest;
import in.launchkit.domain.launch.LauncherWallet;
import in.launchkit.domain.launch.LogoImage;
import in.launchkit.domain.launch.MintKeypair;
import in.launchkit.domain.launch.TokenMetadataForm;
import in.launchkit.domain.launch.TradeReceipt;
import in.launchkit.domain.launchpack.AuditEntry;
import in.launchkit.domain.launchpack.Brand;
import in.launchkit.domain.launchpack.LaunchClaim;
import in.launchkit.domain.launchpack.LaunchPack;
import in.launchkit.domain.launchpack.LaunchPackMutations;
import in.launchkit.domain.launchpack.LaunchPackPatch;
import in.launchkit.domain.launchpack.LaunchState;
import in.launchkit.domain.launchpack.LaunchStatus;
import in.launchkit.infrastructure.metrics.LaunchKitMetrics;
import in.launchkit.security.SecureAuditLogger;
import in.launchkit.util.Base58;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives a LaunchPack from draft (or failed) to launched.
 *
 * Sequence: preconditions, caps, slippage, launch claim, launcher wallet, logo + metadata upload,
 * mint keypair, create trade, mint verification. Anything that fails after the claim is persisted
 * as launch.status=failed before the error is rethrown.
 */
public final class LaunchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LaunchOrchestrator.class);

    static final String PUMP_TX_URL_PREFIX = "https://pump.fun/tx/";
    private static final Duration DAILY_WINDOW = Duration.ofHours(24);

    private final LaunchPackStore store;
    private final LaunchSettings settings;
    private final LauncherWalletProvider walletProvider;
    private final TokenAssetGateway assets;
    private final LaunchPortal portal;
    private final LaunchKitMetrics metrics;
    private final Clock clock;
    private final SecureAuditLogger audit = new SecureAuditLogger("LAUNCH");

    public LaunchOrchestrator(LaunchPackStore store, LaunchSettings settings, LauncherWalletProvider walletProvider,
                              TokenAssetGateway assets, LaunchPortal portal, LaunchKitMetrics metrics, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.walletProvider = walletProvider;
        this.assets = assets;
        this.portal = portal;
        this.metrics = metrics;
        this.clock = clock;
    }

    public LaunchPack launch(String id, boolean force) {
        Instant start = clock.instant();
        LaunchPack existing = store.get(id).orElseThrow(() -> LaunchKitException.notFound(id));
        if (existing.launch().isLaunched()) {
            log.info("[LAUNCH] {} already launched, nothing to do", id);
            record("noop", start);
            return existing;
        }

        BigDecimal devBuy;
        BigDecimal priorityFee;
        int slippage;
        try {
            ensureLaunchAllowed(existing, force);
            enforceCaps();
            devBuy = settings.devBuySol();
            priorityFee = settings.priorityFeeSol();
            slippage = resolveSlippage();
        } catch (LaunchKitException e) {
            log.warn("[LAUNCH] {} rejected: {} {}", id, e.getCode(), e.getMessage());
            record("rejected", start);
            throw e;
        }

        LaunchPack claimed = store.claimLaunch(id, LaunchClaim.ready(clock.instant())).orElseThrow(() -> {
            if (metrics != null) {
                metrics.recordClaimRejected("launch");
            }
            record("rejected", start);
            return LaunchKitException.conflict("LAUNCH_IN_PROGRESS", "Launch in progress");
        });
        log.info("[LAUNCH] Claimed launch slot for {} ({})", id, claimed.brand().ticker());

        try {
            LauncherWallet wallet = walletProvider.ensureWallet();
            String metadataUri = uploadMetadata(claimed);

            MintKeypair mint = MintKeypair.generate();
            Brand brand = claimed.brand();
            TradeReceipt receipt = portal.submitCreate(wallet,
                new CreateTokenRequest(brand.name(), brand.ticker(), metadataUri, devBuy, slippage, priorityFee, mint));
            String mintAddress = verifyMint(mint, receipt);

            Instant done = clock.instant();
            LaunchPackPatch patch = LaunchPackPatch.empty()
                .set("launch.status", LaunchStatus.LAUNCHED)
                .set("launch.tx_signature", receipt.signature())
                .set("launch.mint", mintAddress)
                .set("launch.pump_url", PUMP_TX_URL_PREFIX + receipt.signature())
                .set("launch.completed_at", done)
                .set("launch.launched_at", done)
                .set("launch.error_code", null)
                .set("launch.error_message", null)
                .appendAudit(AuditEntry.of(done, "Pump launch complete"));
            LaunchPack saved = store.update(id, patch);

            log.info("[LAUNCH] {} launched: mint={} signature={}", id, mintAddress, receipt.signature());
            record("launched", start);
            return saved;

        } catch (RuntimeException | Error e) {
            recordFailure(id, e);
            record("failed", start);
            throw e;
        }
    }

    private void ensureLaunchAllowed(LaunchPack pack, boolean force) {
        if (!settings.enabled()) {
            throw LaunchKitException.disabled("LAUNCH_DISABLED", "Launch disabled");
        }
        LaunchState launch = pack.launch();
        if (launch.status() == LaunchStatus.LAUNCHED) {
            throw LaunchKitException.conflict("ALREADY_LAUNCHED", "Already launched");
        }
        if (launch.requestedAt() != null && launch.status() != LaunchStatus.FAILED) {
            throw LaunchKitException.conflict("LAUNCH_IN_PROGRESS", "Launch in progress");
        }
        if (launch.status() == LaunchStatus.FAILED && !force) {
            Instant failedAt = launch.failedAt();
            if (failedAt == null || failedAt.plus(LaunchPackMutations.RETRY_COOLDOWN).isAfter(clock.instant())) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("cooldownMinutes", LaunchPackMutations.RETRY_COOLDOWN.toMinutes());
                if (failedAt != null) {
                    details.put("retryAfter", failedAt.plus(LaunchPackMutations.RETRY_COOLDOWN).toString());
                }
                throw new LaunchKitException(ErrorKind.CONFLICT,
                    "LAUNCH_FAILED_RETRY_BLOCKED", "Previous launch failed; retry blocked", details, null);
            }
        }
    }

    private void enforceCaps() {
        BigDecimal requestedDevBuy = settings.devBuySol();
        BigDecimal requestedPriorityFee = settings.priorityFeeSol();
        if (requestedDevBuy.compareTo(settings.maxDevBuySol()) > 0
                || requestedPriorityFee.compareTo(settings.maxPriorityFeeSol()) > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("maxDevBuy", settings.maxDevBuySol());
            details.put("requestedDevBuy", requestedDevBuy);
            details.put("maxPriorityFee", settings.maxPriorityFeeSol());
            details.put("requestedPriorityFee", requestedPriorityFee);
            throw LaunchKitException.policy("CAP_EXCEEDED", "Caps exceeded", details);
        }

        if (settings.maxLaunchesPerDay() > 0) {
            int recent = store.countLaunchedSince(clock.instant().minus(DAILY_WINDOW));
            if (recent >= settings.maxLaunchesPerDay()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("launchesLast24h", recent);
                details.put("maxLaunchesPerDay", settings.maxLaunchesPerDay());
                throw LaunchKitException.policy("CAP_EXCEEDED", "Daily launch cap reached", details);
            }
        }
    }

    /**
     * Configured slippage floored to a whole percent, within [0, 100] and under the optional ceiling.
     */
    int resolveSlippage() {
        double value = settings.slippagePercent();
        if (!Double.isFinite(value) || value < 0 || value > 100) {
            throw LaunchKitException.policy("SLIPPAGE_INVALID", "Slippage percent must be between 0 and 100",
                Map.of("slippage", value));
        }
        Double cap = settings.maxSlippagePercent();
        if (cap != null) {
            if (!Double.isFinite(cap) || cap < 0 || cap > 100) {
                throw LaunchKitException.policy("SLIPPAGE_INVALID", "MAX_SLIPPAGE_PERCENT must be between 0 and 100",
                    Map.of("cap", cap));
            }
            if (value > cap) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("slippage", value);
                details.put("max", cap);
                throw LaunchKitException.policy("SLIPPAGE_INVALID", "Slippage exceeds configured maximum", details);
            }
        }
        return (int) Math.floor(value);
    }

    private String uploadMetadata(LaunchPack pack) {
        String logoUrl = pack.assets().logoUrl();
        if (logoUrl == null || logoUrl.isBlank()) {
            throw LaunchKitException.validation("LOGO_REQUIRED", "Token logo is required", Map.of());
        }
        LogoImage logo = assets.fetchLogo(logoUrl);

        Brand brand = pack.brand();
        String description = !brand.description().isEmpty() ? brand.description() : brand.tagline();
        TokenMetadataForm form = new TokenMetadataForm(brand.name(), brand.ticker(), description,
            pack.links().x(), pack.links().telegram(), pack.links().website());
        return assets.uploadMetadata(form, logo);
    }

    private String verifyMint(MintKeypair generated, TradeReceipt receipt) {
        String returned = receipt.mint();
        if (returned != null && !returned.equals(generated.publicKey())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expected", generated.publicKey());
            details.put("received", returned);
            throw LaunchKitException.invalidResponse("MINT_MISMATCH", "Mint mismatch returned from launch portal", details);
        }
        String mint = returned != null ? returned : generated.publicKey();
        int length = Base58.decodedLength(mint);
        if (length < 0) {
            throw LaunchKitException.invalidResponse("MINT_MISMATCH", "Mint base58 decoding failed", Map.of());
        }
        if (length != MintKeypair.PUBLIC_KEY_BYTES) {
            throw LaunchKitException.invalidResponse("MINT_MISMATCH", "Mint length invalid", Map.of("length", length));
        }
        return mint;
    }

    private void recordFailure(String id, Throwable error) {
        String code = error instanceof LaunchKitException ? ((LaunchKitException) error).getCode() : "LAUNCH_FAILED";
        Map<String, Object> details = error instanceof LaunchKitException
            ? ((LaunchKitException) error).getDetails()
            : Map.of();
        String message = audit.sanitize(String.valueOf(error.getMessage()));
        audit.logError("launch " + id, code, message, details);

        Instant failedAt = clock.instant();
        LaunchPackPatch patch = LaunchPackPatch.empty()
            .set("launch.status", LaunchStatus.FAILED)
            .set("launch.failed_at", failedAt)
            .set("launch.error_code", code)
            .set("launch.error_message", message)
            .appendAudit(AuditEntry.of(failedAt, "Launch failed: " + message));
        try {
            store.update(id, patch);
        } catch (RuntimeException updateError) {
            log.error("[LAUNCH] Could not persist failure for {}: {}", id, updateError.getMessage(), updateError);
            error.addSuppressed(updateError);
        }
    }

    private void record(String outcome, Instant start) {
        if (metrics != null) {
            metrics.recordLaunch(outcome, Duration.between(start, clock.instant()));
        }
    }
}
