package in.launchkit.config;

/**
 * @param url JDBC URL; null selects the in-memory store
 */
public record DatabaseSettings(String url, String user, String password, int poolSize) {

    public static DatabaseSettings inMemory() {
        return new DatabaseSettings(null, null, null, 0);
    }

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }

    /**
     * Accepts both {@code jdbc:postgresql://} and libpq-style {@code postgres://} URLs.
     */
    public String jdbcUrl() {
        if (url == null) return null;
        if (url.startsWith("jdbc:")) return url;
        if (url.startsWith("postgres://")) return "jdbc:postgresql://" + url.substring("postgres://".length());
        if (url.startsWith("postgresql://")) return "jdbc:" + url;
        return url;
    }

    @Override
    public String toString() {
        return "DatabaseSettings[configured=" + isConfigured() + ", poolSize=" + poolSize + "]";
    }
}
