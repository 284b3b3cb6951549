package com.bit.deposit.structure.dto;

import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import com.bit.deposit.util.ByteUtils;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 受益人队列的四个并行序列，字节字段为0x十六进制
 */
@Data
public class StakerDataDTO {
    private String beneficiary;
    private int count;
    private List<String> pubkeys;
    private List<String> withdrawalCredentials;
    private List<String> signatures;
    private List<String> depositDataRoots;

    public static StakerDataDTO from(BeneficiaryQueue queue) {
        StakerDataDTO dto = new StakerDataDTO();
        dto.setBeneficiary(queue.getBeneficiary().toHex());
        dto.setCount(queue.size());
        dto.setPubkeys(toHex(queue.getPubkeys()));
        dto.setWithdrawalCredentials(toHex(queue.getWithdrawalCredentials()));
        dto.setSignatures(toHex(queue.getSignatures()));
        dto.setDepositDataRoots(toHex(queue.getDepositDataRoots()));
        return dto;
    }

    private static List<String> toHex(List<byte[]> values) {
        return values.stream().map(ByteUtils::toPrefixedHex).collect(Collectors.toList());
    }
}
