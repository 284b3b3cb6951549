package com.bit.deposit.event;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 信号记录：打印日志并保留最近的信号供查询
 */
@Slf4j
@Component
public class DepositEventLog {

    public static final int MAX_EVENTS = 10_000;

    private long sequence;

    /**
     * 按到达顺序保存，满了从最旧的一端淘汰
     */
    private final EvictingQueue<DepositSignal> recentSignals = EvictingQueue.create(MAX_EVENTS);

    @EventListener
    public synchronized void onSignal(DepositSignal signal) {
        long seq = ++sequence;
        recentSignals.add(signal);
        log.info("信号#{} {}", seq, signal);
    }

    /**
     * 最近的信号，新的在前
     */
    public synchronized List<DepositSignal> recent(int limit) {
        if (limit <= 0) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(recentSignals).reverse().subList(0, Math.min(limit, recentSignals.size()));
    }
}
