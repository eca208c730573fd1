package com.sandkev.cryptex.domain;

public enum Side { BUY, SELL }
