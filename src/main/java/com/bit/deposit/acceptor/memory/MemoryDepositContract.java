package com.bit.deposit.acceptor.memory;

import com.bit.deposit.acceptor.DepositAcceptor;
import com.bit.deposit.acceptor.DepositRejectedException;
import com.bit.deposit.common.Address;
import com.bit.deposit.common.DepositDataRoot;
import com.bit.deposit.config.DepositConfig;
import com.bit.deposit.config.DepositConstants;
import com.bit.deposit.structure.deposit.DepositRecord;
import com.bit.deposit.util.ByteUtils;
import com.bit.deposit.util.Sha;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 内存版信标链存款合约：校验字段长度与金额，重建存款数据根并比对，计数已接收的存款
 */
@Slf4j
@Component
public class MemoryDepositContract implements DepositAcceptor {

    // 最大存款数 2^32 - 1（深度32的默克尔树）
    public static final long MAX_DEPOSIT_COUNT = (1L << 32) - 1;

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Address address;
    private final List<AcceptedDeposit> accepted = new ArrayList<>();
    // 进行中的帧，null 表示帧外
    private List<AcceptedDeposit> frame;

    @Autowired
    public MemoryDepositContract(DepositConfig config) {
        this(Address.fromHex(config.getAcceptorAddress()));
    }

    public MemoryDepositContract(Address address) {
        this.address = address;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public synchronized void beginFrame() {
        if (frame != null) {
            throw new IllegalStateException("已有未结束的帧");
        }
        frame = new ArrayList<>();
    }

    @Override
    public synchronized void submit(DepositRecord record, BigInteger amount) {
        byte[] pubkey = record.getPubkey();
        byte[] withdrawalCredentials = record.getWithdrawalCredentials();
        byte[] signature = record.getSignature();
        byte[] depositDataRoot = record.getDepositDataRoot();

        if (pubkey.length != DepositConstants.PUBKEY_LENGTH) {
            throw new DepositRejectedException("invalid node public key length");
        }
        if (withdrawalCredentials.length != DepositConstants.CREDENTIALS_LENGTH) {
            throw new DepositRejectedException("invalid withdrawal_credentials length");
        }
        if (signature.length != DepositConstants.SIGNATURE_LENGTH) {
            throw new DepositRejectedException("invalid signature length");
        }
        if (depositDataRoot.length != DepositDataRoot.HASH_LENGTH) {
            throw new DepositRejectedException("invalid deposit_data_root length");
        }
        if (amount == null || amount.compareTo(DepositConstants.ETHER) < 0) {
            throw new DepositRejectedException("deposit value too low");
        }
        if (amount.mod(DepositConstants.GWEI).signum() != 0) {
            throw new DepositRejectedException("deposit value not multiple of gwei");
        }
        BigInteger gwei = amount.divide(DepositConstants.GWEI);
        if (gwei.compareTo(MAX_UINT64) > 0) {
            throw new DepositRejectedException("deposit value too high");
        }
        long amountGwei = gwei.longValue();

        DepositDataRoot supplied = DepositDataRoot.fromBytes(depositDataRoot);
        DepositDataRoot reconstructed = DepositDataRoot.fromBytes(
                computeDepositDataRoot(pubkey, withdrawalCredentials, signature, amountGwei));
        if (!reconstructed.equals(supplied)) {
            throw new DepositRejectedException("reconstructed DepositData does not match supplied deposit_data_root");
        }

        long index = accepted.size() + (frame == null ? 0 : frame.size());
        if (index >= MAX_DEPOSIT_COUNT) {
            throw new DepositRejectedException("merkle tree full");
        }
        AcceptedDeposit deposit = new AcceptedDeposit(index, ByteUtils.toPrefixedHex(pubkey),
                ByteUtils.toPrefixedHex(withdrawalCredentials), amountGwei, supplied.toHex());
        if (frame != null) {
            frame.add(deposit);
        } else {
            accepted.add(deposit);
        }
        log.debug("存款已接收 {}", deposit);
    }

    @Override
    public synchronized void commitFrame() {
        if (frame == null) {
            throw new IllegalStateException("没有进行中的帧");
        }
        accepted.addAll(frame);
        frame = null;
    }

    @Override
    public synchronized void revertFrame() {
        if (frame != null && !frame.isEmpty()) {
            log.info("回滚帧内{}笔存款", frame.size());
        }
        frame = null;
    }

    @Override
    public synchronized long getDepositCount() {
        return accepted.size();
    }

    public synchronized List<AcceptedDeposit> getAcceptedDeposits() {
        return ImmutableList.copyOf(accepted);
    }

    /**
     * 按SSZ规则重建 DepositData 的哈希树根
     * @param amountGwei 金额（gwei），小端 uint64 编码
     */
    public static byte[] computeDepositDataRoot(byte[] pubkey, byte[] withdrawalCredentials, byte[] signature, long amountGwei) {
        byte[] pubkeyRoot = Sha.applySHA256(ByteUtils.concat(pubkey, new byte[16]));
        byte[] signatureRoot = Sha.hashPair(
                Sha.applySHA256(Arrays.copyOfRange(signature, 0, 64)),
                Sha.applySHA256(ByteUtils.concat(Arrays.copyOfRange(signature, 64, 96), new byte[32])));
        return Sha.hashPair(
                Sha.hashPair(pubkeyRoot, withdrawalCredentials),
                Sha.applySHA256(ByteUtils.concat(ByteUtils.longToLittleEndian(amountGwei), new byte[24], signatureRoot)));
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class AcceptedDeposit {
        private final long index;
        private final String pubkey;
        private final String withdrawalCredentials;
        private final long amountGwei;
        private final String depositDataRoot;
    }
}
