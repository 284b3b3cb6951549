package com.bit.deposit.error;

public enum ErrorType {
    UNAUTHORIZED(510, "无权限（非所有者或未列入白名单）"),
    INVALID_STATE(520, "状态非法（暂停/恢复误用或已暂停）"),
    INDEX_OUT_OF_RANGE(530, "索引越界"),
    INVALID_ARGUMENT(540, "参数非法（长度不一致/数量越界/金额不匹配/字节长度错误）"),
    DEPOSIT_REJECTED(550, "存款接收方拒绝");

    private final int code;
    private final String desc;

    ErrorType(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
