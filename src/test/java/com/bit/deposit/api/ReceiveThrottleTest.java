package com.bit.deposit.api;

import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.bit.deposit.acceptor.DepositAcceptor;
import com.bit.deposit.common.Address;
import com.bit.deposit.editor.BatchEditor;
import com.bit.deposit.sentinel.SentinelConfig;
import com.bit.deposit.structure.deposit.DepositRecord;
import com.bit.deposit.structure.dto.ReceiveReq;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Collections;
import java.util.List;

import static com.bit.deposit.DepositFixtures.*;
import static com.bit.deposit.api.DepositApi.CALLER_HEADER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 存款触发接口限流：QPS 为 1 时，同一秒内的后续请求返回 429 且不做任何处理
 */
@SpringBootTest(properties = "deposit.receive-qps=1")
@AutoConfigureMockMvc
public class ReceiveThrottleTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private BatchEditor batchEditor;

    @Autowired
    private DepositAcceptor depositAcceptor;

    @Autowired
    private SentinelConfig sentinelConfig;

    @BeforeEach
    void loadRule() {
        // 规则是进程级的，其他测试上下文可能已覆盖
        sentinelConfig.loadFlowRules();
    }

    @AfterEach
    void clearRule() {
        FlowRuleManager.loadRules(Collections.emptyList());
    }

    @Test
    void throttledReceiveIsRejectedWith429AndDoesNothing() throws Exception {
        Address beneficiary = address(0x61);
        List<DepositRecord> records = records(1);
        batchEditor.addDepositData(OWNER, beneficiary,
                column(records, DepositRecord::getPubkey),
                column(records, DepositRecord::getWithdrawalCredentials),
                column(records, DepositRecord::getSignature),
                column(records, DepositRecord::getDepositDataRoot));
        long depositCount = depositAcceptor.getDepositCount();

        // 先用掉本秒的配额（非白名单，本身不会触发存款）
        receive(address(0x62), 1);

        for (int i = 0; i < 4; i++) {
            receive(beneficiary, 1)
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.code").value(429));
        }

        assertEquals(1, batchEditor.getStakerData(beneficiary).size());
        assertEquals(depositCount, depositAcceptor.getDepositCount());
    }

    private ResultActions receive(Address caller, int count) throws Exception {
        ReceiveReq req = new ReceiveReq();
        req.setValue(collateral(count).toString());
        return mockMvc.perform(post("/deposit/receive")
                        .header(CALLER_HEADER, caller.toHex())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk());
    }
}
