package com.bit.deposit.structure.dto;

import lombok.Data;

@Data
public class EditDepositDataReq {
    private String beneficiary;
    private String pubkey;
    private String withdrawalCredential;
    private String signature;
    private String depositDataRoot;
    private Integer index;
}
