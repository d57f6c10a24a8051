package io.github.hongjungwan.zkvault.api.exception;

/**
 * AEAD 인증 실패. 잘못된 비밀번호/토큰이거나 암호문이 손상·변조된 경우.
 */
public class DecryptionFailedException extends VaultException {

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, ErrorCode.DECRYPTION_FAILED, cause);
    }
}
