package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import com.sandkev.cryptex.exception.ApiException;
import com.sandkev.cryptex.exception.NonceLimitReachedException;
import com.sandkev.cryptex.exchange.btce.BtceQuirks;
import com.sandkev.cryptex.exchange.cryptsy.CryptsyQuirks;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the wire format of signed requests:
 * - form urlencoded body starting with method and nonce
 * - Key and Sign headers
 * - envelope interpretation and per-exchange quirks
 */
class SignedClientImplTest {

    private static final String API_KEY = "test-key-123";
    private static final String SECRET = "super-secret";

    private WireMockServer wm;
    private NonceCounter nonces;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();
        nonces = new NonceCounter(5);
    }

    @AfterEach
    void tearDown() {
        wm.stop();
    }

    private SignedClientImpl client(EndpointQuirks quirks) {
        WebClient webClient = WebClient.builder().baseUrl("http://localhost:" + wm.port()).build();
        WebClient publicClient = WebClient.builder().baseUrl("http://localhost:" + wm.port() + "/api/3").build();
        return new SignedClientImpl("test", webClient, "/tapi", publicClient,
                new ExchangeCredentials(API_KEY, SECRET), nonces, quirks);
    }

    private void stubTapi(String body) {
        wm.stubFor(post(urlEqualTo("/tapi"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Test
    void post_signsTheExactBodyAndSendsKey() throws Exception {
        stubTapi("{\"success\":1,\"return\":{\"funds\":{\"usd\":12.5}}}");

        var params = new LinkedHashMap<String, Object>();
        params.put("pair", "btc_usd");
        params.put("amount", new BigDecimal("0.10000000"));
        JsonNode payload = client(EndpointQuirks.NONE).post("getInfo", params);

        assertThat(payload.path("funds").path("usd").decimalValue()).isEqualByComparingTo("12.5");

        LoggedRequest req = wm.findAll(postRequestedFor(urlEqualTo("/tapi"))).get(0);
        assertThat(req.getHeader("Content-Type")).contains(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        assertThat(req.getHeader("Key")).isEqualTo(API_KEY);

        String body = req.getBodyAsString();
        assertThat(body).isEqualTo("method=getInfo&nonce=5&pair=btc_usd&amount=0.10000000");
        assertThat(req.getHeader("Sign")).isEqualTo(expectedSign(body));
    }

    @Test
    void post_consumesOneNoncePerCallEvenOnFailure() {
        stubTapi("{\"success\":0,\"error\":\"bad request\"}");
        SignedClientImpl client = client(EndpointQuirks.NONE);

        assertThatThrownBy(() -> client.post("CancelOrder", Map.of("order_id", 1)))
                .isInstanceOf(ApiException.class)
                .hasMessage("bad request");
        assertThatThrownBy(() -> client.post("CancelOrder", Map.of("order_id", 1)))
                .isInstanceOf(ApiException.class);

        List<String> sentNonces = wm.findAll(postRequestedFor(urlEqualTo("/tapi"))).stream()
                .map(r -> parseForm(r.getBodyAsString()).get("nonce"))
                .toList();
        assertThat(sentNonces).containsExactlyInAnyOrder("5", "6");
        assertThat(nonces.peek()).isEqualTo(7);
    }

    @Test
    void post_noOrdersBecomesEmptyResultWithBtceQuirks() {
        stubTapi("{\"success\":0,\"error\":\"no orders\"}");

        JsonNode payload = client(new BtceQuirks()).post("ActiveOrders", Map.of());

        assertThat(payload.isObject()).isTrue();
        assertThat(payload.size()).isZero();
    }

    @Test
    void post_otherErrorsStillRaiseWithBtceQuirks() {
        stubTapi("{\"success\":0,\"error\":\"bad request\"}");

        assertThatThrownBy(() -> client(new BtceQuirks()).post("Trade", Map.of()))
                .isExactlyInstanceOf(ApiException.class)
                .hasMessage("bad request");
    }

    @Test
    void post_noOrdersIsAnErrorWithoutQuirks() {
        stubTapi("{\"success\":0,\"error\":\"no orders\"}");

        assertThatThrownBy(() -> client(EndpointQuirks.NONE).post("ActiveOrders", Map.of()))
                .isInstanceOf(ApiException.class)
                .hasMessage("no orders");
    }

    @Test
    void post_cryptsyCreateOrderIsReshaped() {
        stubTapi("{\"success\":\"1\",\"orderid\":\"42\",\"moreinfo\":\"Your Buy order has been placed.\"}");

        JsonNode payload = client(new CryptsyQuirks()).post("createorder", Map.of("marketid", 3));

        assertThat(payload.path("orderid").asText()).isEqualTo("42");
        assertThat(payload.path("moreinfo").asText()).isEqualTo("Your Buy order has been placed.");
    }

    @Test
    void post_staleNonceIsSurfaced() {
        stubTapi("{\"success\":0,\"error\":\"invalid nonce parameter; on key:99, you sent:'5', you should send:100\"}");

        assertThatThrownBy(() -> client(new BtceQuirks()).post("getInfo", Map.of()))
                .isInstanceOfSatisfying(NonceLimitReachedException.class,
                        e -> assertThat(e.getExpectedNonce()).isEqualTo(100));
        // the local counter is not moved to what the exchange asked for
        assertThat(nonces.peek()).isEqualTo(6);
    }

    @Test
    void post_httpErrorStatusRaises() {
        wm.stubFor(post(urlEqualTo("/tapi")).willReturn(aResponse().withStatus(503).withBody("maintenance")));

        assertThatThrownBy(() -> client(EndpointQuirks.NONE).post("getInfo", Map.of()))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("503")
                .hasMessageContaining("maintenance");
    }

    @Test
    void post_emptyBodyRaises() {
        stubTapi("");

        assertThatThrownBy(() -> client(EndpointQuirks.NONE).post("getInfo", Map.of()))
                .isInstanceOf(ApiException.class)
                .hasMessage("Empty response");
    }

    @Test
    void post_malformedBodyRaisesEmptyResponse() {
        stubTapi("<html>Bad gateway</html>");

        assertThatThrownBy(() -> client(EndpointQuirks.NONE).post("getInfo", Map.of()))
                .isInstanceOf(ApiException.class)
                .hasMessage("Empty response")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void getPublic_isUnsignedAndUnwrapped() {
        wm.stubFor(get(urlPathEqualTo("/api/3/info"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"server_time\":1388534400,\"pairs\":{\"btc_usd\":{\"fee\":0.2}}}")));

        JsonNode payload = client(EndpointQuirks.NONE).getPublic("info", Map.of("ignore_invalid", 1));

        assertThat(payload.path("pairs").has("btc_usd")).isTrue();
        LoggedRequest req = wm.findAll(getRequestedFor(urlPathEqualTo("/api/3/info"))).get(0);
        assertThat(req.queryParameter("ignore_invalid").firstValue()).isEqualTo("1");
        assertThat(req.containsHeader("Sign")).isFalse();
        assertThat(nonces.peek()).isEqualTo(5);
    }

    // --- helpers ---

    private static Map<String, String> parseForm(String body) {
        if (body == null || body.isBlank()) return Collections.emptyMap();
        return Arrays.stream(body.split("&"))
                .map(kv -> kv.split("=", 2))
                .collect(Collectors.toMap(
                        p -> URLDecoder.decode(p[0], StandardCharsets.UTF_8),
                        p -> p.length > 1 ? URLDecoder.decode(p[1], StandardCharsets.UTF_8) : ""));
    }

    private static String expectedSign(String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA512");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
        return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }
}
