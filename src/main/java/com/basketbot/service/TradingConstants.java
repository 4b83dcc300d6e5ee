package com.basketbot.service;

/**
 * Kite Connect literals shared by the broker gateway and the strategy.
 */
public final class TradingConstants {

    // Exchanges
    public static final String EXCHANGE_NFO = "NFO";

    // Order Varieties
    public static final String VARIETY_REGULAR = "regular";

    // Order Validity
    public static final String VALIDITY_DAY = "DAY";

    // Position Types
    public static final String POSITION_NET = "net";

    // Margin segments
    public static final String SEGMENT_EQUITY = "equity";

    // Order tags
    public static final String TAG_ENTRY_PREFIX = "ENTRY_";
    public static final String TAG_EXIT_PREFIX = "EXIT_";
    /** Kite rejects tags longer than 20 characters */
    public static final int MAX_TAG_LENGTH = 20;

    // Messages
    public static final String ERR_ORDER_PLACEMENT_FAILED_NO_ID = "Order placement failed - no order ID returned";
    public static final String ERR_NOT_SENT_RATE_LIMITED = "Not sent - rate limit permit unavailable";
    public static final String ERR_NETWORK = "Network error: ";
    public static final String MSG_VERIFY_MANUALLY = "order state unknown at broker, verify manually before acting";

    private TradingConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
