package com.bit.deposit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.deposit")
public class BatchDepositApplication {
    public static void main(String[] args) {
        SpringApplication.run(BatchDepositApplication.class, args);
        log.info("批量存款服务已启动");
    }
    //金额单位统一为wei
    //地址与字节字段统一0x十六进制
}
