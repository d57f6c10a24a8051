package io.github.hongjungwan.zkvault.core.crypto;

import io.github.hongjungwan.zkvault.api.exception.DecryptionFailedException;
import io.github.hongjungwan.zkvault.api.exception.ErrorCode;
import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import io.github.hongjungwan.zkvault.api.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * AES-256-GCM 코덱. 와이어 포맷은 {@code hex(iv).hex(ciphertext||tag)}.
 * 호출마다 SecureRandom으로 새 12바이트 IV 생성 (카운터 파생 금지).
 */
@Slf4j
public class AeadCodec {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final String SEPARATOR = ".";
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");

    private final SecureRandom secureRandom;

    public AeadCodec() {
        this(new SecureRandom());
    }

    public AeadCodec(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * 평문 암호화.
     */
    public String encrypt(String plaintext, SecretKey key) {
        if (plaintext == null) {
            throw new EncryptionException("Cannot encrypt null plaintext", null);
        }

        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return Hex.toHexString(iv) + SEPARATOR + Hex.toHexString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt data", e);
        }
    }

    /**
     * 와이어 포맷 복호화. 형식 오류는 {@link InvalidFormatException},
     * 인증 실패(잘못된 키, 변조, 절단)는 {@link DecryptionFailedException}.
     */
    public String decrypt(String wire, SecretKey key) {
        if (wire == null || wire.isEmpty()) {
            throw new InvalidFormatException("Invalid encrypted string format: input is empty");
        }

        String[] parts = wire.split(Pattern.quote(SEPARATOR), -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new InvalidFormatException("Invalid encrypted string format: expected 'iv.ciphertext'");
        }
        if (!HEX.matcher(parts[0]).matches() || !HEX.matcher(parts[1]).matches()) {
            throw new InvalidFormatException("Invalid encrypted string format: non-hex content");
        }

        byte[] iv = Hex.decode(parts[0]);
        byte[] ciphertext = Hex.decode(parts[1]);
        if (iv.length != GCM_IV_LENGTH) {
            throw new InvalidFormatException("Invalid encrypted string format: IV must be " + GCM_IV_LENGTH + " bytes");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] plaintext = cipher.doFinal(ciphertext);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionFailedException("Decryption failed: authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            log.debug("Cipher rejected ciphertext: {}", e.getClass().getSimpleName());
            throw new DecryptionFailedException("Decryption failed", e);
        }
    }

    public static class EncryptionException extends VaultException {
        public EncryptionException(String message, Throwable cause) {
            super(message, ErrorCode.ENCRYPTION_FAILED, cause);
        }
    }
}
