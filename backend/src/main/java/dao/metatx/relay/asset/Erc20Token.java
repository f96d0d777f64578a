package dao.metatx.relay.asset;

import dao.metatx.relay.chain.CallContext;
import dao.metatx.relay.chain.CallRevertedException;
import dao.metatx.relay.chain.CallTarget;
import dao.metatx.relay.chain.JournaledMap;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.event.Approval;
import dao.metatx.relay.event.Transfer;
import dao.metatx.relay.util.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * ERC-20 asset living on the local chain. It is both a {@link FungibleAsset} for the vault and a
 * {@link CallTarget} for batch items, decoding {@code transfer}, {@code approve} and
 * {@code transferFrom} call data.
 * <p>
 * Calls arriving from the trusted forwarder act for {@link CallContext#onBehalfOf()} (ERC-2771).
 */
@Slf4j
public class Erc20Token implements FungibleAsset, CallTarget {

    public static final String TRANSFER_SELECTOR = selector("transfer(address,uint256)");
    public static final String APPROVE_SELECTOR = selector("approve(address,uint256)");
    public static final String TRANSFER_FROM_SELECTOR =
            selector("transferFrom(address,address,uint256)");

    private final LocalChain chain;
    private final String address;
    private final String symbol;
    private final int decimals;
    private final String trustedForwarder;
    private final JournaledMap<String, BigInteger> balances;
    private final JournaledMap<String, BigInteger> allowances;

    public Erc20Token(LocalChain chain, String address, String symbol, int decimals, String trustedForwarder) {
        this.chain = chain;
        this.address = Addresses.normalize(address);
        this.symbol = symbol;
        this.decimals = decimals;
        this.trustedForwarder = trustedForwarder == null ? null : Addresses.normalize(trustedForwarder);
        this.balances = chain.newMap();
        this.allowances = chain.newMap();
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(Addresses.normalize(account), BigInteger.ZERO);
    }

    @Override
    public BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(allowanceKey(owner, spender), BigInteger.ZERO);
    }

    public void mint(String to, BigInteger amount) {
        chain.transact(() -> {
            String dst = Addresses.normalize(to);
            balances.put(dst, balanceOf(dst).add(amount));
            chain.getEvents().emit(new Transfer(address, Addresses.ZERO, dst, amount));
        });
    }

    @Override
    public boolean approve(String caller, String spender, BigInteger amount) {
        chain.transact(() -> {
            allowances.put(allowanceKey(caller, spender), amount);
            chain.getEvents().emit(new Approval(address, Addresses.normalize(caller), Addresses.normalize(spender), amount));
        });
        return true;
    }

    @Override
    public boolean transfer(String caller, String to, BigInteger amount) {
        chain.transact(() -> move(caller, to, amount));
        return true;
    }

    @Override
    public boolean transferFrom(String caller, String from, String to, BigInteger amount) {
        chain.transact(() -> {
            String key = allowanceKey(from, caller);
            BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
            if (allowed.compareTo(amount) < 0) {
                throw new CallRevertedException("ERC20: insufficient allowance");
            }
            allowances.put(key, allowed.subtract(amount));
            move(from, to, amount);
        });
        return true;
    }

    @Override
    public void onCall(CallContext context) {
        if (context.value().signum() != 0) {
            throw new CallRevertedException("ERC20: does not accept native value");
        }
        if (!context.hasPayload() || context.payload().length < 4) {
            throw new CallRevertedException("ERC20: no fallback");
        }
        String sender = msgSender(context);
        String hex = Numeric.toHexString(context.payload());
        String selector = hex.substring(0, 10);
        String args = "0x" + hex.substring(10);

        if (selector.equals(TRANSFER_SELECTOR)) {
            List<Type> decoded = decode(args, "transfer",
                    Arrays.asList(new TypeReference<Address>() {}, new TypeReference<Uint256>() {}));
            transfer(sender, addressArg(decoded.get(0)), uintArg(decoded.get(1)));
        } else if (selector.equals(APPROVE_SELECTOR)) {
            List<Type> decoded = decode(args, "approve",
                    Arrays.asList(new TypeReference<Address>() {}, new TypeReference<Uint256>() {}));
            approve(sender, addressArg(decoded.get(0)), uintArg(decoded.get(1)));
        } else if (selector.equals(TRANSFER_FROM_SELECTOR)) {
            List<Type> decoded = decode(args, "transferFrom",
                    Arrays.asList(new TypeReference<Address>() {}, new TypeReference<Address>() {},
                            new TypeReference<Uint256>() {}));
            transferFrom(sender, addressArg(decoded.get(0)), addressArg(decoded.get(1)), uintArg(decoded.get(2)));
        } else {
            throw new CallRevertedException("ERC20: unknown selector " + selector);
        }
    }

    public static byte[] encodeTransfer(String to, BigInteger amount) {
        Function fn = new Function("transfer", Arrays.asList(new Address(to), new Uint256(amount)), List.of());
        return Numeric.hexStringToByteArray(FunctionEncoder.encode(fn));
    }

    public static byte[] encodeApprove(String spender, BigInteger amount) {
        Function fn = new Function("approve", Arrays.asList(new Address(spender), new Uint256(amount)), List.of());
        return Numeric.hexStringToByteArray(FunctionEncoder.encode(fn));
    }

    public static byte[] encodeTransferFrom(String from, String to, BigInteger amount) {
        Function fn = new Function("transferFrom",
                Arrays.asList(new Address(from), new Address(to), new Uint256(amount)), List.of());
        return Numeric.hexStringToByteArray(FunctionEncoder.encode(fn));
    }

    private String msgSender(CallContext context) {
        if (trustedForwarder != null
                && trustedForwarder.equals(context.caller())
                && context.onBehalfOf() != null) {
            return Addresses.normalize(context.onBehalfOf());
        }
        return context.caller();
    }

    private void move(String from, String to, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new CallRevertedException("ERC20: negative amount");
        }
        String src = Addresses.normalize(from);
        String dst = Addresses.normalize(to);
        if (Addresses.isZero(dst)) {
            throw new CallRevertedException("ERC20: transfer to the zero address");
        }
        BigInteger fromBal = balanceOf(src);
        if (fromBal.compareTo(amount) < 0) {
            throw new CallRevertedException("ERC20: transfer amount exceeds balance");
        }
        balances.put(src, fromBal.subtract(amount));
        balances.put(dst, balanceOf(dst).add(amount));
        chain.getEvents().emit(new Transfer(address, src, dst, amount));
        log.debug("{} transfer {} -> {}: {}", symbol, src, dst, amount);
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> decode(String argsHex, String name, List<TypeReference<?>> types) {
        Function fn = new Function(name, List.of(), types);
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(argsHex, fn.getOutputParameters());
        } catch (RuntimeException e) {
            throw new CallRevertedException("ERC20: malformed " + name + " arguments");
        }
        if (decoded.size() != types.size()) {
            throw new CallRevertedException("ERC20: malformed " + name + " arguments");
        }
        return decoded;
    }

    @SuppressWarnings("rawtypes")
    private static String addressArg(Type value) {
        return Addresses.normalize(((Address) value).getValue());
    }

    @SuppressWarnings("rawtypes")
    private static BigInteger uintArg(Type value) {
        return ((Uint256) value).getValue();
    }

    private static String selector(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }

    private static String allowanceKey(String owner, String spender) {
        return Addresses.normalize(owner) + ":" + Addresses.normalize(spender);
    }
}
