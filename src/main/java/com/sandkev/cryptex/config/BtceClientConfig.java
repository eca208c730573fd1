package com.sandkev.cryptex.config;

import com.sandkev.cryptex.exchange.btce.BtceAdapter;
import com.sandkev.cryptex.exchange.btce.BtceQuirks;
import com.sandkev.cryptex.shared.http.ExchangeCredentials;
import com.sandkev.cryptex.shared.http.NonceCounter;
import com.sandkev.cryptex.shared.http.SignedClient;
import com.sandkev.cryptex.shared.http.SignedClientImpl;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BtceClientConfig.BtceClientProperties.class)
@RequiredArgsConstructor
public class BtceClientConfig {

    private final BtceClientProperties props;

    @Bean
    @Qualifier("btceSignedClient")
    public SignedClient btceSignedClient() {
        return new SignedClientImpl(
                BtceAdapter.NAME,
                WebClients.create(props.baseUrl(), props.timeoutMs()),
                props.privatePath(),
                WebClients.create(props.publicBaseUrl(), props.timeoutMs()),
                new ExchangeCredentials(props.apiKey(), props.secretKey()),
                new NonceCounter(props.initialNonce()),
                new BtceQuirks());
    }

    @Bean
    public BtceAdapter btceAdapter(@Qualifier("btceSignedClient") SignedClient btceSignedClient) {
        return new BtceAdapter(btceSignedClient);
    }

    @ConfigurationProperties("cryptex.btce")
    public record BtceClientProperties(
            String baseUrl,        // e.g. https://btc-e.com
            String privatePath,    // e.g. /tapi
            String publicBaseUrl,  // e.g. https://btc-e.com/api/3
            String apiKey,
            String secretKey,
            int    timeoutMs,
            long   initialNonce    // first unused nonce when resuming a key
    ) {}
}
