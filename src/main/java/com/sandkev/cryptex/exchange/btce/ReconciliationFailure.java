package com.sandkev.cryptex.exchange.btce;

/** A history record that described a trade whose id could not be recovered. */
public record ReconciliationFailure(String recordId, String reason) {}
