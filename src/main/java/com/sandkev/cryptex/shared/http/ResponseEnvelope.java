package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.cryptex.exception.ApiException;
import com.sandkev.cryptex.exception.InvalidNonceException;
import com.sandkev.cryptex.exception.NonceLimitReachedException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code {"success": 1, "return": ...}} / {@code {"success": 0, "error": "..."}}
 * wrapper both exchanges put around their responses. {@code success} arrives as
 * an int on BTC-e and as a numeric string on Cryptsy.
 */
public final class ResponseEnvelope {

    static final String EMPTY_RESPONSE = "Empty response";

    private static final Pattern EXPECTED_NONCE = Pattern.compile("you should send:\\s*'?(\\d+)");

    private ResponseEnvelope() {}

    public static void requireContent(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()
                || (content.isContainerNode() && content.isEmpty())) {
            throw new ApiException(EMPTY_RESPONSE);
        }
    }

    /** Bodies without a {@code success} flag are treated as successful. */
    public static boolean isSuccess(JsonNode content) {
        JsonNode flag = content.get("success");
        if (flag == null || flag.isNull()) return true;
        if (flag.isBoolean()) return flag.booleanValue();
        if (flag.isNumber()) return flag.intValue() != 0;
        String text = flag.asText().trim();
        if ("true".equalsIgnoreCase(text)) return true;
        if ("false".equalsIgnoreCase(text)) return false;
        try {
            return Integer.parseInt(text) != 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static String errorMessage(JsonNode content) {
        JsonNode error = content.get("error");
        return error == null || error.isNull() ? "Unknown error" : error.asText();
    }

    /** Payload under {@code return}, or the whole body when there is none. */
    public static JsonNode payload(JsonNode content) {
        JsonNode ret = content.get("return");
        return ret != null ? ret : content;
    }

    /** Exception for an error message, recognising nonce rejections. */
    public static ApiException failure(String message) {
        if (message.toLowerCase(Locale.ROOT).contains("invalid nonce")) {
            Matcher m = EXPECTED_NONCE.matcher(message);
            if (m.find()) {
                return new NonceLimitReachedException(message, Long.parseLong(m.group(1)));
            }
            return new InvalidNonceException(message);
        }
        return new ApiException(message);
    }

    /** Envelope rules without any exchange quirks; used for unsigned requests. */
    public static JsonNode unwrap(JsonNode content) {
        requireContent(content);
        if (!isSuccess(content)) {
            throw failure(errorMessage(content));
        }
        return payload(content);
    }
}
