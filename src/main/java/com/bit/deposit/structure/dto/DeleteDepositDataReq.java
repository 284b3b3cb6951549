package com.bit.deposit.structure.dto;

import lombok.Data;

@Data
public class DeleteDepositDataReq {
    private String beneficiary;
    private Integer count;//删除最后count条，deleteAll时忽略
}
