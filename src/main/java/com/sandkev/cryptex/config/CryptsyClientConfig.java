package com.sandkev.cryptex.config;

import com.sandkev.cryptex.exchange.cryptsy.CryptsyAdapter;
import com.sandkev.cryptex.exchange.cryptsy.CryptsyMarketRegistry;
import com.sandkev.cryptex.exchange.cryptsy.CryptsyQuirks;
import com.sandkev.cryptex.shared.http.ExchangeCredentials;
import com.sandkev.cryptex.shared.http.NonceCounter;
import com.sandkev.cryptex.shared.http.SignedClient;
import com.sandkev.cryptex.shared.http.SignedClientImpl;
import com.sandkev.cryptex.shared.time.ExchangeTimestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(CryptsyClientConfig.CryptsyClientProperties.class)
@RequiredArgsConstructor
public class CryptsyClientConfig {

    private final CryptsyClientProperties props;

    @Bean
    @Qualifier("cryptsySignedClient")
    public SignedClient cryptsySignedClient() {
        return new SignedClientImpl(
                CryptsyAdapter.NAME,
                WebClients.create(props.baseUrl(), props.timeoutMs()),
                props.privatePath(),
                WebClients.create(props.publicBaseUrl(), props.timeoutMs()),
                new ExchangeCredentials(props.apiKey(), props.secretKey()),
                new NonceCounter(props.initialNonce()),
                new CryptsyQuirks());
    }

    @Bean
    public CryptsyMarketRegistry cryptsyMarketRegistry(@Qualifier("cryptsySignedClient") SignedClient cryptsySignedClient) {
        return new CryptsyMarketRegistry(cryptsySignedClient);
    }

    @Bean
    public CryptsyAdapter cryptsyAdapter(@Qualifier("cryptsySignedClient") SignedClient cryptsySignedClient,
                                         CryptsyMarketRegistry cryptsyMarketRegistry) {
        ZoneId zone = props.timezone() == null || props.timezone().isBlank() ? null : ExchangeTimestamps.zone(props.timezone());
        return new CryptsyAdapter(cryptsySignedClient, cryptsyMarketRegistry, zone);
    }

    @ConfigurationProperties("cryptex.cryptsy")
    public record CryptsyClientProperties(
            String baseUrl,        // e.g. https://api.cryptsy.com
            String privatePath,    // e.g. /api
            String publicBaseUrl,  // e.g. http://pubapi.cryptsy.com
            String apiKey,
            String secretKey,
            int    timeoutMs,
            long   initialNonce,
            String timezone        // server timezone; blank = ask getinfo
    ) {}
}
