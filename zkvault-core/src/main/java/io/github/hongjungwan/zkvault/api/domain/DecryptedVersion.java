package io.github.hongjungwan.zkvault.api.domain;

/**
 * 복호화된 히스토리 항목. 복호화 실패 시 plaintext는 null이고 failure에 원인 기록.
 */
public record DecryptedVersion(SecretVersion version, String plaintext, RuntimeException failure) {

    public static DecryptedVersion decrypted(SecretVersion version, String plaintext) {
        return new DecryptedVersion(version, plaintext, null);
    }

    public static DecryptedVersion failed(SecretVersion version, RuntimeException failure) {
        return new DecryptedVersion(version, null, failure);
    }

    public boolean isDecrypted() {
        return failure == null;
    }

    @Override
    public String toString() {
        return "DecryptedVersion{version=" + version.getVersion() + ", decrypted=" + isDecrypted() + "}";
    }
}
