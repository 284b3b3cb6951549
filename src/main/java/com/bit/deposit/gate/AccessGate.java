package com.bit.deposit.gate;

import com.bit.deposit.aop.annotation.Caller;
import com.bit.deposit.aop.annotation.OwnerOnly;
import com.bit.deposit.common.Address;
import com.bit.deposit.config.DepositConfig;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.event.OwnershipTransferredEvent;
import com.bit.deposit.event.PausedEvent;
import com.bit.deposit.event.UnpausedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 全局状态：所有者 + 暂停开关
 * 所有受保护操作在同一把公平锁内串行执行
 */
@Slf4j
@Component
public class AccessGate {

    private final ReentrantLock executionLock = new ReentrantLock(true);
    private final ApplicationEventPublisher publisher;

    private volatile Address owner;
    private volatile boolean paused;

    @Autowired
    public AccessGate(DepositConfig config, ApplicationEventPublisher publisher) {
        this(Address.fromHex(config.getOwner()), publisher);
    }

    public AccessGate(Address owner, ApplicationEventPublisher publisher) {
        if (owner == null || owner.isZero()) {
            throw new IllegalArgumentException("所有者地址不能为空");
        }
        this.owner = owner;
        this.publisher = publisher;
        log.info("访问控制初始化完成，所有者: {}", owner);
    }

    public ReentrantLock getExecutionLock() {
        return executionLock;
    }

    public Address owner() {
        return owner;
    }

    public boolean isPaused() {
        return paused;
    }

    public void requireOwner(Address caller) {
        if (caller == null || !caller.equals(owner)) {
            throw DepositException.unauthorized("调用者不是所有者: " + caller);
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw DepositException.invalidState("已暂停");
        }
    }

    @OwnerOnly
    public void pause(@Caller Address caller) {
        if (paused) {
            throw DepositException.invalidState("已暂停");
        }
        paused = true;
        log.info("存款触发已暂停，操作者: {}", caller);
        publisher.publishEvent(new PausedEvent(caller));
    }

    @OwnerOnly
    public void unpause(@Caller Address caller) {
        if (!paused) {
            throw DepositException.invalidState("未暂停");
        }
        paused = false;
        log.info("存款触发已恢复，操作者: {}", caller);
        publisher.publishEvent(new UnpausedEvent(caller));
    }

    @OwnerOnly
    public void transferOwnership(@Caller Address caller, Address newOwner) {
        if (newOwner == null || newOwner.isZero()) {
            throw DepositException.invalidArgument("新所有者不能为零地址");
        }
        Address previous = owner;
        owner = newOwner;
        log.info("所有权转移: {} -> {}", previous, newOwner);
        publisher.publishEvent(new OwnershipTransferredEvent(previous, newOwner));
    }
}
