package com.bit.deposit.error;

/**
 * 批量存款统一异常：所有校验失败在修改任何状态之前抛出
 */
public class DepositException extends RuntimeException {

    private final ErrorType errorType;

    public DepositException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public DepositException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static DepositException unauthorized(String message) {
        return new DepositException(ErrorType.UNAUTHORIZED, message);
    }

    public static DepositException invalidState(String message) {
        return new DepositException(ErrorType.INVALID_STATE, message);
    }

    public static DepositException indexOutOfRange(String message) {
        return new DepositException(ErrorType.INDEX_OUT_OF_RANGE, message);
    }

    public static DepositException invalidArgument(String message) {
        return new DepositException(ErrorType.INVALID_ARGUMENT, message);
    }
}
