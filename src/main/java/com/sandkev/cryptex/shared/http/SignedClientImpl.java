package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.cryptex.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Private endpoints are POST with a form urlencoded body:
 *   method=...&nonce=...&field=...
 * Headers: Key (API key), Sign = hex( HMAC-SHA512( secret, body ) )
 *
 * No retries here: transport failures propagate to the caller.
 */
@Slf4j
public class SignedClientImpl implements SignedClient {

    private final String exchange;
    private final WebClient privateWebClient;
    private final String privatePath;
    private final WebClient publicWebClient;
    private final ExchangeCredentials credentials;
    private final NonceCounter nonces;
    private final EndpointQuirks quirks;
    private final ObjectMapper mapper = ExchangeJson.newMapper();

    public SignedClientImpl(String exchange,
                            WebClient privateWebClient,
                            String privatePath,
                            WebClient publicWebClient,
                            ExchangeCredentials credentials,
                            NonceCounter nonces,
                            EndpointQuirks quirks) {
        this.exchange = exchange;
        this.privateWebClient = privateWebClient;
        this.privatePath = canonical(privatePath);
        this.publicWebClient = publicWebClient;
        this.credentials = credentials;
        this.nonces = nonces;
        this.quirks = quirks;
    }

    // ---------- SignedClient API ----------

    @Override
    public JsonNode post(String method, Map<String, Object> params) {
        // consumed up front: a failed call still burns its nonce
        long nonce = nonces.next();

        var form = new LinkedHashMap<String, String>();
        form.put("method", method);
        form.put("nonce", String.valueOf(nonce));
        if (params != null) {
            params.forEach((k, v) -> { if (v != null) form.put(k, formValue(v)); });
        }

        String postData = urlEncodeForm(form);
        String sign = HmacSigner.sign(credentials.secretKey(), postData);

        log.debug("{} signed POST method={} nonce={} fields={}", exchange, method, nonce, form.keySet());

        String body = privateWebClient.post()
                .uri(privatePath)
                .header("Key", credentials.apiKey())
                .header("Sign", sign)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .bodyValue(postData)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class).defaultIfEmpty("")
                        .map(err -> new ApiException(exchange + " " + method + " error " + r.statusCode().value() + ": " + err)))
                .bodyToMono(String.class)
                .block();

        return interpret(method, parse(body));
    }

    @Override
    public JsonNode getPublic(String path, Map<String, Object> params) {
        var qpm = toQueryParams(params);
        String canonicalPath = canonical(path);
        log.debug("{} public GET: {} {}", exchange, canonicalPath, qpm);

        String body = publicWebClient.get()
                .uri(u -> u.path(canonicalPath).queryParams(qpm).build())
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class).defaultIfEmpty("")
                        .map(err -> new ApiException(exchange + " " + canonicalPath + " error " + r.statusCode().value() + ": " + err)))
                .bodyToMono(String.class)
                .block();

        return ResponseEnvelope.unwrap(parse(body));
    }

    // ---------- Impl details ----------

    JsonNode interpret(String method, JsonNode content) {
        ResponseEnvelope.requireContent(content);
        if (!ResponseEnvelope.isSuccess(content)) {
            String error = ResponseEnvelope.errorMessage(content);
            Optional<JsonNode> translated = quirks.translateError(method, error);
            if (translated.isPresent()) {
                log.debug("{} {} returned '{}', treated as empty result", exchange, method, error);
                return translated.get();
            }
            throw ResponseEnvelope.failure(error);
        }
        return ResponseEnvelope.payload(quirks.normalizeResponse(method, content));
    }

    private JsonNode parse(@Nullable String body) {
        if (body == null || body.isBlank()) {
            throw new ApiException(ResponseEnvelope.EMPTY_RESPONSE);
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiException(ResponseEnvelope.EMPTY_RESPONSE, e);
        }
    }

    private static String formValue(Object v) {
        return v instanceof BigDecimal d ? d.toPlainString() : String.valueOf(v);
    }

    private static String canonical(String path) {
        if (path == null || path.isEmpty()) return "/";
        return path.startsWith("/") ? path : ("/" + path);
    }

    private static MultiValueMap<String, String> toQueryParams(@Nullable Map<String, Object> params) {
        var qpm = new LinkedMultiValueMap<String, String>();
        if (params != null) {
            params.forEach((k, v) -> { if (v != null) qpm.add(k, formValue(v)); });
        }
        return qpm;
    }

    static String urlEncodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
