package in.launchkit.domain.launchpack;

/**
 * Publish channels, each with its own claimable state machine under {@code ops}.
 */
public enum Channel {
    TELEGRAM("tg", "tg_publish", "TG"),
    X("x", "x_publish", "X");

    private final String contentField;
    private final String opsField;
    private final String codePrefix;

    Channel(String contentField, String opsField, String codePrefix) {
        this.contentField = contentField;
        this.opsField = opsField;
        this.codePrefix = codePrefix;
    }

    /** Top-level document field holding this channel's content and schedule. */
    public String contentField() {
        return contentField;
    }

    /** Field name of this channel's publish state inside the ops document. */
    public String opsField() {
        return opsField;
    }

    /** Prefix of this channel's error codes, e.g. TG_PUBLISH_IN_PROGRESS. */
    public String code(String suffix) {
        return codePrefix + "_" + suffix;
    }
}
