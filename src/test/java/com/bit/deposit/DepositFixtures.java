package com.bit.deposit;

import com.bit.deposit.acceptor.DepositAcceptor;
import com.bit.deposit.acceptor.memory.MemoryDepositContract;
import com.bit.deposit.aop.AccessGateAspect;
import com.bit.deposit.common.Address;
import com.bit.deposit.config.DepositConfig;
import com.bit.deposit.config.DepositConstants;
import com.bit.deposit.editor.BatchEditor;
import com.bit.deposit.editor.impl.BatchEditorImpl;
import com.bit.deposit.gate.AccessGate;
import com.bit.deposit.store.memory.MemoryRecordStore;
import com.bit.deposit.structure.deposit.DepositRecord;
import com.bit.deposit.trigger.DepositTrigger;
import com.bit.deposit.trigger.impl.DepositTriggerImpl;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 测试公共数据：地址、合法存款记录、带访问控制切面的组件组装
 */
public final class DepositFixtures {

    public static final Address OWNER = address(0x11);
    public static final Address ALICE = address(0xA1);
    public static final Address BOB = address(0xB2);
    public static final Address CAROL = address(0xC3);
    public static final Address ACCEPTOR_ADDRESS = address(0xDE);

    // 32 ETH 对应的 gwei
    public static final long COLLATERAL_GWEI = DepositConstants.COLLATERAL.divide(DepositConstants.GWEI).longValueExact();

    private DepositFixtures() {
    }

    public static Address address(int fill) {
        byte[] bytes = new byte[Address.LENGTH];
        Arrays.fill(bytes, (byte) fill);
        return Address.fromBytes(bytes);
    }

    public static BigInteger collateral(int count) {
        return DepositConstants.COLLATERAL.multiply(BigInteger.valueOf(count));
    }

    /**
     * 按种子生成字段，存款数据根按 32 ETH 计算，可被内存存款合约接受
     */
    public static DepositRecord record(int seed) {
        byte[] pubkey = filled(DepositConstants.PUBKEY_LENGTH, seed);
        byte[] credentials = filled(DepositConstants.CREDENTIALS_LENGTH, seed + 1);
        byte[] signature = filled(DepositConstants.SIGNATURE_LENGTH, seed + 2);
        byte[] root = MemoryDepositContract.computeDepositDataRoot(pubkey, credentials, signature, COLLATERAL_GWEI);
        return new DepositRecord(pubkey, credentials, signature, root);
    }

    public static List<DepositRecord> records(int count) {
        List<DepositRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(record(i));
        }
        return records;
    }

    public static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    public static List<byte[]> column(List<DepositRecord> records, Function<DepositRecord, byte[]> getter) {
        return records.stream().map(getter).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    public static <T> T guarded(T target, AccessGateAspect aspect) {
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.addAspect(aspect);
        return (T) factory.getProxy();
    }

    public static Harness harness() {
        return harness(new DepositConfig(), null);
    }

    /**
     * @param acceptor 为 null 时使用内存存款合约
     */
    public static Harness harness(DepositConfig config, DepositAcceptor acceptor) {
        return new Harness(config, acceptor);
    }

    public static class Harness {
        public final List<Object> events = new ArrayList<>();
        public final MemoryRecordStore store = new MemoryRecordStore();
        public final DepositAcceptor acceptor;
        public final AccessGate gate;
        public final BatchEditor editor;
        public final DepositTrigger trigger;

        private Harness(DepositConfig config, DepositAcceptor acceptor) {
            this.acceptor = acceptor != null ? acceptor : new MemoryDepositContract(ACCEPTOR_ADDRESS);
            AccessGate rawGate = new AccessGate(OWNER, events::add);
            AccessGateAspect aspect = new AccessGateAspect(rawGate);
            this.gate = guarded(rawGate, aspect);
            this.editor = guarded(new BatchEditorImpl(store, events::add, config), aspect);
            this.trigger = guarded(new DepositTriggerImpl(store, this.acceptor, events::add), aspect);
        }

        public int add(Address beneficiary, List<DepositRecord> records) {
            return editor.addDepositData(OWNER, beneficiary,
                    column(records, DepositRecord::getPubkey),
                    column(records, DepositRecord::getWithdrawalCredentials),
                    column(records, DepositRecord::getSignature),
                    column(records, DepositRecord::getDepositDataRoot));
        }

        @SuppressWarnings("unchecked")
        public <E> List<E> eventsOf(Class<E> type) {
            return events.stream().filter(type::isInstance).map(e -> (E) e).collect(Collectors.toList());
        }
    }
}
