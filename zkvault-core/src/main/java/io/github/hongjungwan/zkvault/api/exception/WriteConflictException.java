package io.github.hongjungwan.zkvault.api.exception;

/**
 * 동시 쓰기로 인해 compare-and-set 재시도가 모두 실패한 경우.
 */
public class WriteConflictException extends VaultException {

    public WriteConflictException(String message) {
        super(message, ErrorCode.WRITE_CONFLICT);
    }

    public WriteConflictException(String message, Throwable cause) {
        super(message, ErrorCode.WRITE_CONFLICT, cause);
    }
}
