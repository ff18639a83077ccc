package in.launchkit.domain.launchpack;

import in.launchkit.domain.common.ValidationResult;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes and validates LaunchPack documents.
 *
 * Pure functions: no I/O, no clock. Normalization trims brand text and upper-cases the ticker;
 * validation reports every violation at once.
 */
public final class LaunchPackValidator {

    public static final int MAX_TICKER_LENGTH = 12;
    public static final int MIN_IDEMPOTENCY_KEY_LENGTH = 8;

    /**
     * Normalize then validate, raising VALIDATION_ERROR on any violation.
     */
    public static LaunchPack normalizeAndValidate(LaunchPack pack) {
        LaunchPack normalized = normalize(pack);
        validate(normalized).throwIfFailed();
        return normalized;
    }

    public static LaunchPack normalize(LaunchPack pack) {
        Brand brand = pack.brand();
        if (brand != null) {
            brand = new Brand(
                trim(brand.name()),
                brand.ticker() == null ? null : brand.ticker().trim().toUpperCase(Locale.ROOT),
                brand.tagline(),
                brand.description(),
                brand.lore());
        }
        return new LaunchPack(pack.id(), pack.idempotencyKey(), pack.version(), brand, pack.links(),
            pack.assets(), pack.tg(), pack.x(), pack.launch(), pack.ops(), pack.createdAt(), pack.updatedAt());
    }

    public static ValidationResult validate(LaunchPack pack) {
        ValidationResult.Builder result = new ValidationResult.Builder();

        if (pack.idempotencyKey() != null && pack.idempotencyKey().length() < MIN_IDEMPOTENCY_KEY_LENGTH) {
            result.addError("idempotency_key", "must be at least " + MIN_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (pack.version() < 1) {
            result.addError("version", "must be >= 1");
        }

        validateBrand(pack.brand(), result);

        Links links = pack.links();
        checkUrl("links.telegram", links.telegram(), result);
        checkUrl("links.x", links.x(), result);
        checkUrl("links.website", links.website(), result);

        Assets assets = pack.assets();
        checkUrl("assets.logo_url", assets.logoUrl(), result);
        checkUrl("assets.banner_url", assets.bannerUrl(), result);
        for (int i = 0; i < assets.memes().size(); i++) {
            Meme meme = assets.memes().get(i);
            if (meme == null || meme.url() == null) {
                result.addError("assets.memes[" + i + "].url", "required");
            } else {
                checkUrl("assets.memes[" + i + "].url", meme.url(), result);
            }
        }

        validateSchedule("tg.schedule", pack.tg().schedule(), result);
        validateSchedule("x.schedule", pack.x().schedule(), result);
        checkUrl("launch.pump_url", pack.launch().pumpUrl(), result);

        List<AuditEntry> audit = pack.ops().auditLog();
        for (int i = 0; i < audit.size(); i++) {
            AuditEntry entry = audit.get(i);
            if (entry == null || entry.at() == null) {
                result.addError("ops.audit_log[" + i + "].at", "required");
            } else if (entry.message() == null || entry.message().isBlank()) {
                result.addError("ops.audit_log[" + i + "].message", "must not be empty");
            }
        }
        validateSchedule("ops.tg_publish.schedule_intent", pack.ops().tgPublish().scheduleIntent(), result);
        validateSchedule("ops.x_publish.schedule_intent", pack.ops().xPublish().scheduleIntent(), result);

        return result.build();
    }

    private static void validateBrand(Brand brand, ValidationResult.Builder result) {
        if (brand == null) {
            result.addError("brand", "required");
            return;
        }
        if (brand.name() == null || brand.name().isEmpty()) {
            result.addError("brand.name", "must not be empty");
        }
        if (brand.ticker() == null || brand.ticker().isEmpty()) {
            result.addError("brand.ticker", "must not be empty");
        } else if (brand.ticker().length() > MAX_TICKER_LENGTH) {
            result.addError("brand.ticker", "must be at most " + MAX_TICKER_LENGTH + " characters");
        }
    }

    private static void validateSchedule(String field, List<ScheduleItem> schedule, ValidationResult.Builder result) {
        for (int i = 0; i < schedule.size(); i++) {
            ScheduleItem item = schedule.get(i);
            String prefix = field + "[" + i + "]";
            if (item == null || item.when() == null) {
                result.addError(prefix + ".when", "required");
                continue;
            }
            if (item.text() == null || item.text().isBlank()) {
                result.addError(prefix + ".text", "must not be empty");
            }
            checkUrl(prefix + ".media_url", item.mediaUrl(), result);
        }
    }

    private static void checkUrl(String field, String value, ValidationResult.Builder result) {
        if (value == null) {
            return;
        }
        if (!isHttpUrl(value)) {
            result.addError(field, "must be an absolute http(s) URL");
        }
    }

    static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && uri.getHost() != null && !uri.getHost().isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private LaunchPackValidator() {}
}
