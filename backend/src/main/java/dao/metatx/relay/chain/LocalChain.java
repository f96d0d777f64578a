package dao.metatx.relay.chain;

import dao.metatx.relay.event.EventLog;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.ValueAccountingException;
import dao.metatx.relay.util.Addresses;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process sequential ledger the gateway and the vault run on.
 * <p>
 * Every state-changing operation goes through {@link #transact}: operations are applied one at a
 * time under a single re-entrant lock, and any exception or error escaping an operation rolls
 * back every journaled write it made. {@link #call} is the isolated external call: failures are
 * rolled back and reported, never propagated.
 */
@Slf4j
public class LocalChain {

    @Getter
    private final long chainId;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    @Getter
    private final StateJournal journal = new StateJournal();
    @Getter
    private final EventLog events = new EventLog(journal);
    private final JournaledMap<String, BigInteger> nativeBalances = new JournaledMap<>(journal);

    // deployments are setup-time facts, not journaled state
    private final Map<String, Object> code = new ConcurrentHashMap<>();

    public LocalChain(long chainId, Clock clock) {
        this.chainId = chainId;
        this.clock = clock;
    }

    /** Current block time in unix seconds. */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public <T> JournaledMap<String, T> newMap() {
        return new JournaledMap<>(journal);
    }

    public <T> JournaledCell<T> newCell(T initial) {
        return new JournaledCell<>(journal, initial);
    }

    public <T> T transact(Supplier<T> operation) {
        lock.lock();
        int checkpoint = journal.begin();
        try {
            T result = operation.get();
            journal.release();
            return result;
        } catch (RuntimeException | Error e) {
            journal.rollback(checkpoint);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public void transact(Runnable operation) {
        transact(() -> {
            operation.run();
            return null;
        });
    }

    public void deploy(String address, Object contract) {
        String addr = Addresses.normalize(address);
        if (Addresses.isZero(addr)) {
            throw new IllegalArgumentException("Cannot deploy at the zero address");
        }
        Object previous = code.putIfAbsent(addr, contract);
        if (previous != null) {
            throw new IllegalStateException("Address already has code: " + addr);
        }
        log.info("Deployed {} at {}", contract.getClass().getSimpleName(), addr);
    }

    public boolean hasCode(String address) {
        return code.containsKey(Addresses.normalize(address));
    }

    public <T> Optional<T> codeAt(String address, Class<T> type) {
        Object c = code.get(Addresses.normalize(address));
        return type.isInstance(c) ? Optional.of(type.cast(c)) : Optional.empty();
    }

    public BigInteger balanceOf(String address) {
        return nativeBalances.getOrDefault(Addresses.normalize(address), BigInteger.ZERO);
    }

    /**
     * Credit native value out of thin air (genesis allocations, faucets).
     */
    public void fund(String address, BigInteger amount) {
        transact(() -> {
            String addr = Addresses.normalize(address);
            nativeBalances.put(addr, balanceOf(addr).add(amount));
        });
    }

    public void transferNative(String from, String to, BigInteger amount) {
        if (amount.signum() == 0) return;
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative native transfer");
        }
        transact(() -> {
            String src = Addresses.normalize(from);
            String dst = Addresses.normalize(to);
            BigInteger fromBal = balanceOf(src);
            if (fromBal.compareTo(amount) < 0) {
                throw new ValueAccountingException(ErrorCode.INSUFFICIENT_NATIVE_BALANCE,
                        src + " holds " + fromBal + ", needs " + amount);
            }
            nativeBalances.put(src, fromBal.subtract(amount));
            nativeBalances.put(dst, balanceOf(dst).add(amount));
        });
    }

    /**
     * Isolated external call: moves {@code value} to {@code to} and runs its code, if any. Anything
     * the call did is rolled back when it fails. Addresses without code accept every call; code that
     * is not a {@link CallTarget} has no receive or fallback and reverts.
     */
    public CallOutcome call(String from, String to, BigInteger value, byte[] payload, String onBehalfOf) {
        lock.lock();
        int checkpoint = journal.begin();
        try {
            transferNative(from, to, value);
            Optional<CallTarget> target = codeAt(to, CallTarget.class);
            if (target.isPresent()) {
                target.get().onCall(new CallContext(
                        Addresses.normalize(from),
                        Addresses.normalize(to),
                        value,
                        payload == null ? new byte[0] : payload,
                        onBehalfOf));
            } else if (hasCode(to)) {
                throw new CallRevertedException("no receive or fallback at " + Addresses.normalize(to));
            }
            journal.release();
            return CallOutcome.succeeded();
        } catch (RuntimeException e) {
            journal.rollback(checkpoint);
            log.debug("Call {} -> {} reverted: {}", from, to, e.getMessage());
            return CallOutcome.failed(e.getMessage());
        } catch (Error e) {
            journal.rollback(checkpoint);
            throw e;
        } finally {
            lock.unlock();
        }
    }
}
