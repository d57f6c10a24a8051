package io.github.hongjungwan.zkvault.core.keys;

import io.github.hongjungwan.zkvault.api.exception.InvalidFormatException;
import io.github.hongjungwan.zkvault.core.crypto.AeadCodec;
import io.github.hongjungwan.zkvault.core.crypto.KeyDerivation;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 봉투 암호화 키 계층. 프로젝트별 PEK 하나를 여러 래핑 키(마스터 비밀번호, 토큰)로 각각 독립 암호화.
 * PEK는 래핑되지 않은 상태로 저장소에 기록되지 않음.
 */
@Slf4j
public class KeyHierarchy {

    private static final String ALGORITHM = "AES";
    private static final int KEY_SIZE = 256;
    private static final Pattern RAW_KEY_HEX = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final AeadCodec codec;
    private final KeyDerivation keyDerivation;
    private final SecureRandom secureRandom;

    public KeyHierarchy(AeadCodec codec, KeyDerivation keyDerivation) {
        this(codec, keyDerivation, new SecureRandom());
    }

    public KeyHierarchy(AeadCodec codec, KeyDerivation keyDerivation, SecureRandom secureRandom) {
        this.codec = codec;
        this.keyDerivation = keyDerivation;
        this.secureRandom = secureRandom;
    }

    /** 새 256비트 PEK 생성 */
    public SecretKey generatePek() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance(ALGORITHM);
            keyGen.init(KEY_SIZE, secureRandom);
            return keyGen.generateKey();
        } catch (GeneralSecurityException e) {
            throw new AeadCodec.EncryptionException("Failed to generate project encryption key", e);
        }
    }

    /**
     * PEK 래핑. 원시 32바이트를 소문자 hex로 내보낸 뒤 AEAD 암호화.
     */
    public String wrap(SecretKey pek, SecretKey wrappingKey) {
        byte[] raw = pek.getEncoded();
        try {
            return codec.encrypt(Hex.toHexString(raw), wrappingKey);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /**
     * 래핑된 PEK 복원. 복호화 실패는 그대로 전파.
     */
    public SecretKey unwrap(String wrapped, SecretKey wrappingKey) {
        String rawHex = codec.decrypt(wrapped, wrappingKey);
        if (!RAW_KEY_HEX.matcher(rawHex).matches()) {
            throw new InvalidFormatException("Unwrapped key material is not a 256-bit key");
        }
        byte[] raw = Hex.decode(rawHex);
        try {
            return new SecretKeySpec(raw, ALGORITHM);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /** 비밀번호와 hex salt로 래핑 키 파생 후 래핑 */
    public String wrapWithSecret(SecretKey pek, String secret, String saltHex) {
        return wrap(pek, keyDerivation.deriveKey(secret, saltHex));
    }

    /** 비밀번호와 hex salt로 래핑 키 파생 후 복원 */
    public SecretKey unwrapWithSecret(String wrapped, String secret, String saltHex) {
        SecretKey wrappingKey = keyDerivation.deriveKey(secret, saltHex);
        try {
            return unwrap(wrapped, wrappingKey);
        } finally {
            destroyKey(wrappingKey);
        }
    }

    public KeyDerivation keyDerivation() {
        return keyDerivation;
    }

    /**
     * 키 삭제 (best-effort). JVM 한계로 완전 삭제 불가.
     */
    public static void destroyKey(SecretKey key) {
        if (key == null) {
            return;
        }
        if (key instanceof Destroyable) {
            Destroyable destroyable = (Destroyable) key;
            if (!destroyable.isDestroyed()) {
                try {
                    destroyable.destroy();
                    return;
                } catch (DestroyFailedException e) {
                    log.trace("Destroyable.destroy() failed, using best-effort approach");
                }
            }
        }
        // getEncoded()는 복사본이므로 원본은 그대로 남음
        byte[] keyBytes = key.getEncoded();
        if (keyBytes != null) {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }
}
