package com.bit.deposit.acceptor;

/**
 * 存款接收方拒绝一次提交（格式错误或状态冲突）
 */
public class DepositRejectedException extends RuntimeException {

    public DepositRejectedException(String message) {
        super(message);
    }

    public DepositRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
