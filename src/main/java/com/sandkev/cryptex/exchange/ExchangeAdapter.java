package com.sandkev.cryptex.exchange;

import com.sandkev.cryptex.domain.Market;
import com.sandkev.cryptex.domain.Order;
import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Capabilities every exchange offers. Implementations translate markets to the
 * exchange's native ids and back, convert timestamps to UTC and read every
 * monetary field as an exact decimal.
 */
public interface ExchangeAdapter {

    String name();

    List<Market> getMarkets();

    /** Currently unfilled orders. */
    List<Order> getMyOpenOrders();

    /** @param limit maximum number of trades to ask for, or null for the exchange default */
    List<Trade> getMyTrades(@Nullable Integer limit);

    void cancelOrder(String orderId);

    /** @return id of the created order */
    String buy(Market market, BigDecimal quantity, BigDecimal price);

    /** @return id of the created order */
    String sell(Market market, BigDecimal quantity, BigDecimal price);

    List<Transaction> getMyTransactions(@Nullable Integer limit);

    /** Available (not on order) balance per upper-case currency code. */
    Map<String, BigDecimal> getMyFunds();
}
