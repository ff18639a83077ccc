package in.launchkit.domain.launch;

/**
 * Fields uploaded with the logo to the metadata store. Social links are optional.
 */
public record TokenMetadataForm(
    String name,
    String symbol,
    String description,
    String twitter,
    String telegram,
    String website
) {}
