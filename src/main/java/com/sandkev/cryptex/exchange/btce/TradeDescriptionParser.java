package com.sandkev.cryptex.exchange.btce;

import com.sandkev.cryptex.domain.Side;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads trades out of BTC-e history descriptions such as
 * <pre>
 *   Buy 0.5 BTC (-0.2%) from your order :order:123: by price 100 USD total 50 USD
 *   Sell 0.5 BTC from your order :order:123: by price 100 USD total 50 USD (-0.2%)
 * </pre>
 * The fee percentage follows the base amount on buys and the counter total on sells.
 * A leading "Buy" or "Sell" restricts the text to that side's layout.
 */
public final class TradeDescriptionParser {

    private static final String NUM = "\\d+(?:\\.\\d+)?";
    private static final String CUR = "[A-Za-z]+";

    static final Pattern BUY = Pattern.compile(
            "(?<amount>" + NUM + ")\\s+(?<base>" + CUR + ")\\s+\\(-(?<fee>" + NUM + ")%\\)"
                    + ".*?:order:(?<order>\\d+):"
                    + ".*?(?<price>" + NUM + ")\\s+(?<counter>" + CUR + ")");

    static final Pattern SELL = Pattern.compile(
            "(?<amount>" + NUM + ")\\s+(?<base>" + CUR + ")\\b"
                    + ".*?:order:(?<order>\\d+):"
                    + ".*?(?<price>" + NUM + ")\\s+(?<counter>" + CUR + ")"
                    + ".*?(?<total>" + NUM + ")\\s+" + CUR + "\\s+\\(-(?<fee>" + NUM + ")%\\)");

    private TradeDescriptionParser() {}

    /** Empty when the text describes no trade. */
    public static Optional<ParsedTradeDescription> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        String verb = text.stripLeading().toLowerCase(Locale.ROOT);
        Matcher buy = BUY.matcher(text);
        if (!verb.startsWith("sell") && buy.find()) {
            return Optional.of(toParsed(Side.BUY, buy, null));
        }
        Matcher sell = SELL.matcher(text);
        if (!verb.startsWith("buy") && sell.find()) {
            return Optional.of(toParsed(Side.SELL, sell, new BigDecimal(sell.group("total"))));
        }
        return Optional.empty();
    }

    private static ParsedTradeDescription toParsed(Side side, Matcher m, BigDecimal total) {
        String amountText = m.group("amount");
        return new ParsedTradeDescription(
                side,
                amountText,
                new BigDecimal(amountText),
                m.group("base").toUpperCase(Locale.ROOT),
                new BigDecimal(m.group("fee")),
                m.group("order"),
                new BigDecimal(m.group("price")),
                m.group("counter").toUpperCase(Locale.ROOT),
                total);
    }
}
