package com.bit.deposit.structure.dto;

import lombok.Data;

@Data
public class ReceiveReq {
    private String value;//转入金额 wei，十进制字符串
}
