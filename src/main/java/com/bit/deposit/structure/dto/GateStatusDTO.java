package com.bit.deposit.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GateStatusDTO {
    private String owner;
    private boolean paused;
}
