package dao.metatx.relay.asset;

import java.math.BigInteger;

/**
 * Token-style asset the vault holds. Each method takes the immediate caller explicitly.
 * A {@code false} return and a thrown exception both mean the transfer did not happen.
 */
public interface FungibleAsset {

    String address();

    String symbol();

    int decimals();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    boolean approve(String caller, String spender, BigInteger amount);

    boolean transfer(String caller, String to, BigInteger amount);

    boolean transferFrom(String caller, String from, String to, BigInteger amount);
}
