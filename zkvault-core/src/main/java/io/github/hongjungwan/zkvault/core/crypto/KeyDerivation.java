package io.github.hongjungwan.zkvault.core.crypto;

import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * PBKDF2-HMAC-SHA256 키 파생. 반복 횟수는 저장 데이터 호환을 위해 고정.
 */
public class KeyDerivation {

    public static final int ITERATIONS = 310_000;
    public static final int SALT_LENGTH = 16;
    private static final int KEY_SIZE = 256;

    private final SecureRandom secureRandom;

    public KeyDerivation() {
        this(new SecureRandom());
    }

    public KeyDerivation(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /** (secret, salt)에 대해 결정적인 256비트 AES 키 */
    public SecretKey deriveKey(String secret, byte[] salt) {
        byte[] password = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(secret.toCharArray());
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(password, salt, ITERATIONS);
            KeyParameter keyParameter = (KeyParameter) generator.generateDerivedParameters(KEY_SIZE);
            byte[] keyBytes = keyParameter.getKey();
            SecretKey key = new SecretKeySpec(keyBytes, "AES");
            Arrays.fill(keyBytes, (byte) 0);
            return key;
        } finally {
            Arrays.fill(password, (byte) 0);
        }
    }

    /** 저장소의 hex salt 사용 */
    public SecretKey deriveKey(String secret, String saltHex) {
        if (saltHex == null || saltHex.isEmpty()) {
            throw new InvalidFormatException("Missing key derivation salt");
        }
        try {
            return deriveKey(secret, Hex.decode(saltHex));
        } catch (DecoderException e) {
            throw new InvalidFormatException("Salt is not valid hex", e);
        }
    }

    public byte[] generateSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);
        return salt;
    }

    public String generateSaltHex() {
        return Hex.toHexString(generateSalt());
    }
}
