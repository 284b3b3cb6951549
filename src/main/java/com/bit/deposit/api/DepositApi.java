package com.bit.deposit.api;

import com.alibaba.csp.sentinel.annotation.SentinelResource;
import com.alibaba.csp.sentinel.slots.block.BlockException;
import com.bit.deposit.common.Address;
import com.bit.deposit.editor.BatchEditor;
import com.bit.deposit.event.DepositEventLog;
import com.bit.deposit.event.DepositSignal;
import com.bit.deposit.result.Result;
import com.bit.deposit.sentinel.SentinelConfig;
import com.bit.deposit.structure.deposit.DepositReceipt;
import com.bit.deposit.structure.dto.AddDepositDataReq;
import com.bit.deposit.structure.dto.DeleteDepositDataReq;
import com.bit.deposit.structure.dto.EditDepositDataReq;
import com.bit.deposit.structure.dto.ReceiveReq;
import com.bit.deposit.structure.dto.StakerDataDTO;
import com.bit.deposit.trigger.DepositTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.bit.deposit.api.RequestParser.*;

@Slf4j
@RestController
@RequestMapping("/deposit")
public class DepositApi {

    public static final String CALLER_HEADER = "X-Caller";

    @Autowired
    private BatchEditor batchEditor;

    @Autowired
    private DepositTrigger depositTrigger;

    @Autowired
    private DepositEventLog depositEventLog;

    // 为受益人添加一批存款数据（仅所有者）
    @PostMapping("/add")
    public Result<Integer> addDepositData(@RequestHeader(CALLER_HEADER) String caller,
                                          @RequestBody AddDepositDataReq req) {
        int size = batchEditor.addDepositData(
                address("caller", caller),
                address("beneficiary", req.getBeneficiary()),
                bytesList("pubkeys", req.getPubkeys()),
                bytesList("withdrawalCredentials", req.getWithdrawalCredentials()),
                bytesList("signatures", req.getSignatures()),
                bytesList("depositDataRoots", req.getDepositDataRoots()));
        return Result.OK(size);
    }

    // 编辑指定位置的存款数据（仅所有者）
    @PostMapping("/edit")
    public Result<Void> editDepositData(@RequestHeader(CALLER_HEADER) String caller,
                                        @RequestBody EditDepositDataReq req) {
        batchEditor.editDepositData(
                address("caller", caller),
                address("beneficiary", req.getBeneficiary()),
                bytes("pubkey", req.getPubkey()),
                bytes("withdrawalCredential", req.getWithdrawalCredential()),
                bytes("signature", req.getSignature()),
                bytes("depositDataRoot", req.getDepositDataRoot()),
                integer("index", req.getIndex()));
        return Result.OK();
    }

    // 删除最后n条（仅所有者）
    @PostMapping("/deleteLast")
    public Result<Integer> deleteLastNDepositEntries(@RequestHeader(CALLER_HEADER) String caller,
                                                     @RequestBody DeleteDepositDataReq req) {
        int remaining = batchEditor.deleteLastNDepositEntries(
                address("caller", caller),
                address("beneficiary", req.getBeneficiary()),
                integer("count", req.getCount()));
        return Result.OK(remaining);
    }

    // 清空（仅所有者）
    @PostMapping("/deleteAll")
    public Result<Integer> deleteAllEntries(@RequestHeader(CALLER_HEADER) String caller,
                                            @RequestBody DeleteDepositDataReq req) {
        int previous = batchEditor.deleteAllEntries(
                address("caller", caller),
                address("beneficiary", req.getBeneficiary()));
        return Result.OK(previous);
    }

    // 查询受益人队列
    @GetMapping("/stakerData")
    public Result<StakerDataDTO> getStakerData(@RequestParam String beneficiary) {
        return Result.OK(StakerDataDTO.from(batchEditor.getStakerData(address("beneficiary", beneficiary))));
    }

    // 受益人转入金额，触发队列中的全部存款
    @PostMapping("/receive")
    @SentinelResource(value = SentinelConfig.RECEIVE_RESOURCE, blockHandler = "receiveBlockHandler")
    public Result<DepositReceipt> receive(@RequestHeader(CALLER_HEADER) String caller,
                                          @RequestBody ReceiveReq req) {
        Address sender = address("caller", caller);
        return Result.OK(depositTrigger.receive(sender, wei(req.getValue())));
    }

    // 限流时的降级方法，不做任何处理
    public Result<DepositReceipt> receiveBlockHandler(String caller, ReceiveReq req, BlockException e) {
        log.warn("存款触发被限流 | 转入方: {}", caller);
        return Result.error(Result.SC_TOO_MANY_REQUESTS_429, "系统繁忙，请稍后重试");
    }

    // 最近的信号
    @GetMapping("/events")
    public Result<List<DepositSignal>> events(@RequestParam(defaultValue = "50") int limit) {
        return Result.OK(depositEventLog.recent(limit));
    }
}
