package com.bit.deposit.store;

import com.bit.deposit.error.DepositException;
import com.bit.deposit.error.ErrorType;
import com.bit.deposit.store.memory.MemoryRecordStore;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bit.deposit.DepositFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class MemoryRecordStoreTest {

    private MemoryRecordStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryRecordStore();
    }

    @Test
    void absentBeneficiaryReadsAsEmptyQueue() {
        BeneficiaryQueue queue = store.get(ALICE);
        assertTrue(queue.isEmpty());
        assertEquals(ALICE, queue.getBeneficiary());
        assertEquals(0, store.size(ALICE));
        assertEquals(0, queue.getPubkeys().size());
    }

    @Test
    void appendKeepsInsertionOrderAndParallelColumns() {
        store.append(ALICE, record(1));
        store.appendAll(ALICE, records(3));

        BeneficiaryQueue queue = store.get(ALICE);
        assertEquals(4, queue.size());
        assertEquals(record(1), queue.get(0));
        assertEquals(record(0), queue.get(1));
        assertEquals(record(2), queue.get(3));
        assertEquals(4, queue.getWithdrawalCredentials().size());
        assertEquals(4, queue.getSignatures().size());
        assertEquals(4, queue.getDepositDataRoots().size());
    }

    @Test
    void queuesAreIsolatedPerBeneficiary() {
        store.appendAll(ALICE, records(2));
        store.append(BOB, record(9));
        assertEquals(2, store.size(ALICE));
        assertEquals(1, store.size(BOB));
        assertEquals(record(9), store.get(BOB).get(0));
    }

    @Test
    void readViewIsASnapshot() {
        store.appendAll(ALICE, records(2));
        BeneficiaryQueue before = store.get(ALICE);
        store.append(ALICE, record(5));
        assertEquals(2, before.size());
        assertEquals(3, store.size(ALICE));
    }

    @Test
    void setAtReplacesOnlyTargetedRecord() {
        store.appendAll(ALICE, records(3));
        store.setAt(ALICE, 1, record(42));
        BeneficiaryQueue queue = store.get(ALICE);
        assertEquals(record(0), queue.get(0));
        assertEquals(record(42), queue.get(1));
        assertEquals(record(2), queue.get(2));
    }

    @Test
    void setAtOutOfRangeFails() {
        store.appendAll(ALICE, records(2));
        DepositException e = assertThrows(DepositException.class, () -> store.setAt(ALICE, 2, record(7)));
        assertEquals(ErrorType.INDEX_OUT_OF_RANGE, e.getErrorType());
        assertThrows(DepositException.class, () -> store.setAt(BOB, 0, record(7)));
        assertEquals(record(1), store.get(ALICE).get(1));
    }

    @Test
    void popLastNRemovesMostRecent() {
        store.appendAll(ALICE, records(5));
        store.popLastN(ALICE, 2);
        BeneficiaryQueue queue = store.get(ALICE);
        assertEquals(3, queue.size());
        assertEquals(record(2), queue.get(2));

        store.popLastN(ALICE, 3);
        assertTrue(store.get(ALICE).isEmpty());
    }

    @Test
    void popLastNBeyondLengthFailsAndKeepsQueue() {
        store.appendAll(ALICE, records(2));
        DepositException e = assertThrows(DepositException.class, () -> store.popLastN(ALICE, 3));
        assertEquals(ErrorType.INDEX_OUT_OF_RANGE, e.getErrorType());
        assertEquals(2, store.size(ALICE));
    }

    @Test
    void clearReturnsPreviousCount() {
        store.appendAll(ALICE, records(4));
        assertEquals(4, store.clear(ALICE));
        assertEquals(0, store.clear(ALICE));
        assertTrue(store.get(ALICE).isEmpty());
    }
}
