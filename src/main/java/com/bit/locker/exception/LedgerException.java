package com.bit.locker.exception;

/**
 * 账本操作失败：整个操作被拒绝，不留下任何状态变更
 */
public class LedgerException extends RuntimeException {

    private final ErrorType errorType;

    public LedgerException(ErrorType errorType) {
        super(errorType.getDesc());
        this.errorType = errorType;
    }

    public LedgerException(ErrorType errorType, String detail) {
        super(errorType.getDesc() + ": " + detail);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
