package com.bit.deposit.structure.dto;

import lombok.Data;

@Data
public class TransferOwnershipReq {
    private String newOwner;
}
