package io.github.hongjungwan.zkvault.api.exception;

public class ProjectAlreadyExistsException extends VaultException {

    public ProjectAlreadyExistsException(String project) {
        super("Project \"" + project + "\" is already registered.", ErrorCode.PROJECT_EXISTS);
    }
}
