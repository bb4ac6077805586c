package secretscanapp;

/**
 * Renders the masked preview of a secret: a short visible prefix, the rest replaced by '*'.
 * Values no longer than the prefix are masked entirely.
 */
public final class SecretMasker {

    public static final char MASK_CHAR = '*';

    private SecretMasker() {
    }

    public static String mask(String secret) {
        return mask(secret, Shared.MASK_VISIBLE_CHARS);
    }

    public static String mask(String secret, int visibleChars) {
        if (secret == null) {
            return "";
        }
        if (secret.length() <= visibleChars) {
            return String.valueOf(MASK_CHAR).repeat(secret.length());
        }
        return secret.substring(0, visibleChars)
            + String.valueOf(MASK_CHAR).repeat(secret.length() - visibleChars);
    }
}
