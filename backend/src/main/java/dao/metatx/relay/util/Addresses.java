package dao.metatx.relay.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte account addresses, carried as lower-case 0x-prefixed hex strings.
 */
public final class Addresses {
    private Addresses() {}

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0[xX][0-9a-fA-F]{40}$");

    public static String normalize(String address) {
        if (address == null || !ADDRESS.matcher(address.trim()).matches()) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address.trim()).matches();
    }

    public static boolean isZero(String address) {
        return ZERO.equals(normalize(address));
    }

    public static boolean same(String a, String b) {
        if (a == null || b == null) return false;
        return normalize(a).equals(normalize(b));
    }
}
