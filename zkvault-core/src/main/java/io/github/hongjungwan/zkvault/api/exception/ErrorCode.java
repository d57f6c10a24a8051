package io.github.hongjungwan.zkvault.api.exception;

/**
 * 볼트 오류 코드. 호출자가 "데이터 없음"과 "잘못된 자격 증명"을 구분할 수 있도록 세분화.
 */
public enum ErrorCode {
    /** 필수 연결 설정 누락 */
    MISSING_CONFIG,
    /** 설정 값 오류 */
    INVALID_CONFIG,
    /** 토큰 맵에 없는 publicId */
    INVALID_TOKEN_ID,
    PROJECT_NOT_FOUND,
    PROJECT_EXISTS,
    SECRET_NOT_FOUND,
    /** 인증 실패 (잘못된 키, 변조, 손상) */
    DECRYPTION_FAILED,
    ENCRYPTION_FAILED,
    /** 와이어 포맷 오류 (자격 증명 문제 아님) */
    INVALID_FORMAT,
    /** 동시 쓰기 충돌 재시도 소진 */
    WRITE_CONFLICT,
    /** 백엔드 저장소 오류 */
    STORE_ERROR
}
