package tech.portfoliosync.sdk.dto;

/**
 * An API key issued to a team. Newer servers only return the masked form.
 */
public record ApiKey(
    String key,
    String maskedKey,
    String comment
) {
    public String displayValue() {
        return key != null ? key : maskedKey;
    }
}
