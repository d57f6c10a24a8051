package io.github.hongjungwan.zkvault.core.token;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 토큰 식별자/시크릿 생성 및 로그용 마스킹.
 */
public final class TokenIds {

    public static final String SERVICE_TOKEN_PREFIX = "stk_";
    public static final String EPHEMERAL_TOKEN_PREFIX = "etk_";
    public static final String SECRET_PREFIX = "redenv_sk_";

    private static final int PUBLIC_ID_LENGTH = 16;
    private static final int SECRET_LENGTH = 32;

    private TokenIds() {}

    static String newServiceTokenId(SecureRandom random) {
        return SERVICE_TOKEN_PREFIX + randomUrlSafe(random, PUBLIC_ID_LENGTH);
    }

    static String newEphemeralTokenId(SecureRandom random) {
        return EPHEMERAL_TOKEN_PREFIX + randomUrlSafe(random, PUBLIC_ID_LENGTH);
    }

    static String newSecret(SecureRandom random) {
        return SECRET_PREFIX + randomUrlSafe(random, SECRET_LENGTH);
    }

    public static boolean isEphemeral(String publicId) {
        return publicId != null && publicId.startsWith(EPHEMERAL_TOKEN_PREFIX);
    }

    /** {@code stk_...abcd} 형태로 마스킹 */
    public static String mask(String publicId) {
        if (publicId == null || publicId.length() <= 8) {
            return "****";
        }
        return publicId.substring(0, 4) + "..." + publicId.substring(publicId.length() - 4);
    }

    private static String randomUrlSafe(SecureRandom random, int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes).substring(0, length);
    }
}
