package com.bit.deposit.event;

import lombok.Getter;

/**
 * 对外观察者可见的信号基类，通过 Spring 事件发布
 */
@Getter
public abstract class DepositSignal {

    private final SignalType type;
    private final long timestamp = System.currentTimeMillis();

    protected DepositSignal(SignalType type) {
        this.type = type;
    }
}
