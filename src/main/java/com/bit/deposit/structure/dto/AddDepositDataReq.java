package com.bit.deposit.structure.dto;

import lombok.Data;

import java.util.List;

@Data
public class AddDepositDataReq {
    private String beneficiary;
    private List<String> pubkeys;
    private List<String> withdrawalCredentials;
    private List<String> signatures;
    private List<String> depositDataRoots;
}
