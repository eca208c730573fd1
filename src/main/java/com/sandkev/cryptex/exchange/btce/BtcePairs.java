package com.sandkev.cryptex.exchange.btce;

import com.sandkev.cryptex.domain.Market;
import com.sandkev.cryptex.exception.MarketNotFoundException;
import com.sandkev.cryptex.exchange.MarketIdMapper;

import java.util.Locale;

/** BTC-e names markets "btc_usd": lower-case base and counter joined by an underscore. */
public class BtcePairs implements MarketIdMapper {

    @Override
    public String toNative(Market market) {
        return market.base().toLowerCase(Locale.ROOT) + "_" + market.counter().toLowerCase(Locale.ROOT);
    }

    @Override
    public Market toMarket(String pair) {
        if (pair == null) throw new MarketNotFoundException("null");
        String[] parts = pair.trim().split("_");
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new MarketNotFoundException(pair);
        }
        return new Market(parts[0], parts[1]);
    }
}
