package com.sandkev.cryptex.exchange;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** The configured exchanges, looked up by {@link ExchangeAdapter#name()}. */
@Service
public class ExchangeRegistry {

    private final Map<String, ExchangeAdapter> adapters;

    public ExchangeRegistry(List<ExchangeAdapter> adapters) {
        this.adapters = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(a -> a.name().toLowerCase(Locale.ROOT), Function.identity()));
    }

    public Optional<ExchangeAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name.toLowerCase(Locale.ROOT)));
    }

    public ExchangeAdapter get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown exchange: " + name));
    }

    public List<String> names() {
        return adapters.keySet().stream().sorted().toList();
    }
}
