package com.roadassist.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for every domain rule violation.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.MECHANIC_NOT_AVAILABLE);
 *   throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION, "COMPLETED -> IN_PROGRESS");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }
}
