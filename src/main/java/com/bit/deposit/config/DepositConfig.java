package com.bit.deposit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "deposit")
public class DepositConfig {
    private String owner;//初始所有者地址
    private String acceptorAddress = "0x00000000219ab540356cBB839Cbe05303d7705Fa";//存款合约地址
    private boolean strictAddValidation = false;//添加时是否校验字节长度
    private double receiveQps = 100;//触发接口限流阈值
}
