package com.bit.deposit.api;

import com.bit.deposit.error.DepositException;
import com.bit.deposit.error.ErrorType;
import com.bit.deposit.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 异常统一转为 Result，调用方按 code 区分错误类型
 */
@Slf4j
@RestControllerAdvice
public class DepositExceptionHandler {

    @ExceptionHandler(DepositException.class)
    public Result<Void> handleDeposit(DepositException e) {
        return Result.error(e.getErrorType().getCode(), e.getMessage());
    }

    // 缺少调用者身份视为无权限
    @ExceptionHandler(MissingRequestHeaderException.class)
    public Result<Void> handleMissingHeader(MissingRequestHeaderException e) {
        return Result.error(ErrorType.UNAUTHORIZED.getCode(), "缺少请求头: " + e.getHeaderName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Void> handleUnreadable(HttpMessageNotReadableException e) {
        return Result.error(ErrorType.INVALID_ARGUMENT.getCode(), "请求体格式错误");
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOther(Exception e) {
        log.error("接口处理异常", e);
        return Result.error(e.getMessage());
    }
}
