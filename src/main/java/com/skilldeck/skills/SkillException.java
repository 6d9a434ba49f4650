package com.skilldeck.skills;

public class SkillException extends RuntimeException {

    public enum ErrorKind {
        NOT_FOUND,
        VALIDATION_FAILED,
        ALREADY_EXISTS,
        UNCONFIGURED,
        STORAGE_FAILURE
    }

    private final ErrorKind kind;

    public SkillException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SkillException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
