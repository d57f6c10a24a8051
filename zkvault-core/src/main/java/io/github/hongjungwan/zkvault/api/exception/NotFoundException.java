package io.github.hongjungwan.zkvault.api.exception;

/**
 * 프로젝트, 환경, 시크릿 키 또는 버전이 존재하지 않음.
 */
public class NotFoundException extends VaultException {

    public NotFoundException(String message, ErrorCode code) {
        super(message, code);
    }

    public static NotFoundException project(String project) {
        return new NotFoundException(
                "Project \"" + project + "\" not found. The project may not be registered correctly.",
                ErrorCode.PROJECT_NOT_FOUND);
    }

    public static NotFoundException secret(String environment, String key) {
        return new NotFoundException(
                "No secret named \"" + key + "\" found in " + environment + ".",
                ErrorCode.SECRET_NOT_FOUND);
    }

    public static NotFoundException version(String key, int version) {
        return new NotFoundException(
                "Version " + version + " not found for key \"" + key + "\".",
                ErrorCode.SECRET_NOT_FOUND);
    }
}
