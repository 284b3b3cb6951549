package com.bit.deposit.api;

import com.bit.deposit.gate.AccessGate;
import com.bit.deposit.result.Result;
import com.bit.deposit.structure.dto.GateStatusDTO;
import com.bit.deposit.structure.dto.TransferOwnershipReq;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import static com.bit.deposit.api.DepositApi.CALLER_HEADER;
import static com.bit.deposit.api.RequestParser.address;

@RestController
@RequestMapping("/admin")
public class AdminApi {

    @Autowired
    private AccessGate accessGate;

    @PostMapping("/pause")
    public Result<GateStatusDTO> pause(@RequestHeader(CALLER_HEADER) String caller) {
        accessGate.pause(address("caller", caller));
        return Result.OK(status());
    }

    @PostMapping("/unpause")
    public Result<GateStatusDTO> unpause(@RequestHeader(CALLER_HEADER) String caller) {
        accessGate.unpause(address("caller", caller));
        return Result.OK(status());
    }

    @PostMapping("/transferOwnership")
    public Result<GateStatusDTO> transferOwnership(@RequestHeader(CALLER_HEADER) String caller,
                                                   @RequestBody TransferOwnershipReq req) {
        accessGate.transferOwnership(address("caller", caller), address("newOwner", req.getNewOwner()));
        return Result.OK(status());
    }

    @GetMapping("/owner")
    public Result<GateStatusDTO> owner() {
        return Result.OK(status());
    }

    private GateStatusDTO status() {
        return new GateStatusDTO(accessGate.owner().toHex(), accessGate.isPaused());
    }
}
