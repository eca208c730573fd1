package com.sandkev.cryptex.exchange;

import com.sandkev.cryptex.domain.Market;

/** Bidirectional mapping between a market and the exchange's own identifier for it. */
public interface MarketIdMapper {

    String toNative(Market market);

    Market toMarket(String nativeId);
}
