package com.bit.deposit.event;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bit.deposit.DepositFixtures.ALICE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DepositEventLogTest {

    @Test
    void keepsExactlyTheNewestSignals() {
        DepositEventLog eventLog = new DepositEventLog();
        int published = DepositEventLog.MAX_EVENTS + 2_500;
        for (int i = 0; i < published; i++) {
            eventLog.onSignal(new DepositedEvent(ALICE, i));
        }

        List<DepositSignal> all = eventLog.recent(Integer.MAX_VALUE);
        assertEquals(DepositEventLog.MAX_EVENTS, all.size());
        for (int i = 0; i < all.size(); i++) {
            assertEquals(published - 1 - i, ((DepositedEvent) all.get(i)).getCount());
        }

        List<DepositSignal> newest = eventLog.recent(200);
        assertEquals(200, newest.size());
        assertEquals(published - 1, ((DepositedEvent) newest.get(0)).getCount());
        assertEquals(published - 200, ((DepositedEvent) newest.get(199)).getCount());
    }

    @Test
    void limitBelowOneIsEmpty() {
        DepositEventLog eventLog = new DepositEventLog();
        eventLog.onSignal(new DepositedEvent(ALICE, 1));
        assertTrue(eventLog.recent(0).isEmpty());
        assertTrue(eventLog.recent(-3).isEmpty());
        assertEquals(1, eventLog.recent(50).size());
    }
}
