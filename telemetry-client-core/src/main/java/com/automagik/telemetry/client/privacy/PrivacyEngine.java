package com.automagik.telemetry.client.privacy;

import com.automagik.telemetry.model.AttributeValue;
import com.automagik.telemetry.model.Attributes;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Strips PII from attribute maps before they are queued.
 *
 * <ul>
 *   <li>Keys naming a secret or free text (password, token, secret, api_key, message, content) are dropped.
 *   <li>Keys naming an email or phone are replaced by {@code <key>_hash} holding the first 16 hex chars of
 *       the value's SHA-256. So are string values containing an email, phone number, API key or bearer
 *       token, card number, IPv4 address or user home path.
 * </ul>
 *
 * Key names are compared on their word tokens, split on {@code . _ -} and camelCase, so {@code accessToken}
 * and {@code x-api-key} are caught while {@code tokens_used} is not. Values are matched and hashed whole,
 * then long strings are cut to {@link Attributes#MAX_STRING_LENGTH}. Never throws; a field that fails to
 * process is dropped. Running it twice gives the same result as running it once.
 *
 * <p>All value patterns have bounded repetition, so matching is linear in the input length. Callers run
 * this on their own thread.
 */
@Slf4j
public final class PrivacyEngine {
    public static final String HASH_SUFFIX = "_hash";
    static final int HASH_HEX_LENGTH = 16;
    /** Free text longer than this is cut by {@link #scrubText}. */
    public static final int MAX_TEXT_LENGTH = 4096;
    // covers the longest match that can straddle the cut
    private static final int SCAN_MARGIN = 512;

    private static final Set<String> DROP_TERMS = Set.of("password", "token", "secret", "apikey", "message", "content");
    private static final Set<String> HASH_TERMS = Set.of("email", "phone");

    private static final Pattern EMAIL =
            Pattern.compile("[A-Za-z0-9._%+-]{1,64}@[A-Za-z0-9.-]{1,253}\\.[A-Za-z]{2,63}");
    private static final Pattern API_KEY = Pattern.compile(
            "\\b(?:sk_live_|sk_test_|pk_live_|pk_test_|bearer\\s{1,8}|api[_-]?key[_-]?)[a-z0-9_-]{20,512}\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern USER_PATH =
            Pattern.compile("/(?:home|Users)/[A-Za-z0-9_-]{1,64}|[A-Za-z]:\\\\Users\\\\[A-Za-z0-9_-]{1,64}");
    private static final Pattern CREDIT_CARD = Pattern.compile("\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b");
    private static final Pattern PHONE = Pattern.compile(
            "\\+\\d(?:[\\s.-]?\\d){6,13}(?!\\d)|(?<!\\d)\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}(?!\\d)");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");
    // email first so its digits are gone before the numeric patterns run
    private static final List<Pattern> VALUE_PATTERNS = List.of(EMAIL, API_KEY, USER_PATH, CREDIT_CARD, PHONE, IPV4);
    private static final Pattern DIGEST = Pattern.compile("[0-9a-f]{" + HASH_HEX_LENGTH + "}");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[._\\-\\s]+");

    public Attributes sanitize(Attributes attributes) {
        if (attributes == null || attributes.isEmpty()) return Attributes.empty();
        Attributes.Builder out = Attributes.builder();
        attributes.forEach((key, value) -> {
            try {
                apply(key, value, out);
            } catch (RuntimeException e) {
                log.debug("Dropping attribute {} after sanitization error: {}", key, e.toString());
            }
        });
        return out.build().truncated();
    }

    /** Converts and sanitizes untyped input; values with no scalar form are dropped. */
    public Attributes sanitize(Map<String, ?> raw) {
        return sanitize(Attributes.fromRaw(
                raw, (key, e) -> log.debug("Dropping attribute {}: {}", key, e.getMessage())));
    }

    /**
     * Replaces every PII match inside free text with its hash, then cuts the result to
     * {@link #MAX_TEXT_LENGTH}. Only the head of an oversized text is scanned.
     */
    public String scrubText(String text) {
        if (text == null || text.isEmpty()) return text;
        try {
            String out = head(text, MAX_TEXT_LENGTH);
            for (Pattern p : VALUE_PATTERNS) {
                if (p == EMAIL && out.indexOf('@') < 0) continue;
                out = replaceAll(p, out);
            }
            return out.length() > MAX_TEXT_LENGTH ? out.substring(0, MAX_TEXT_LENGTH) : out;
        } catch (RuntimeException e) {
            log.debug("Redacting text after sanitization error: {}", e.toString());
            return "";
        }
    }

    private static String replaceAll(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return text;
        StringBuilder sb = new StringBuilder(text.length());
        do {
            m.appendReplacement(sb, hash(m.group()));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }

    private void apply(String key, AttributeValue value, Attributes.Builder out) {
        List<String> tokens = tokens(key);
        if (isDenied(tokens)) return;
        if (isDigest(key, value)) {
            out.put(key, value);
            return;
        }
        if (tokens.stream().anyMatch(HASH_TERMS::contains) || containsPii(value)) {
            out.put(key + HASH_SUFFIX, hash(value.asString()));
            return;
        }
        out.put(key, value);
    }

    static List<String> tokens(String key) {
        List<String> out = new ArrayList<>();
        for (String part : SEPARATORS.split(key)) {
            for (String word : CAMEL_BOUNDARY.split(part)) {
                if (!word.isEmpty()) out.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static boolean isDenied(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (DROP_TERMS.contains(t)) return true;
            // api_key, api-key, apiKey all split into two tokens
            if ("api".equals(t) && i + 1 < tokens.size() && "key".equals(tokens.get(i + 1))) return true;
        }
        return false;
    }

    private static boolean isDigest(String key, AttributeValue value) {
        return key.endsWith(HASH_SUFFIX)
                && value instanceof AttributeValue.StringValue s
                && DIGEST.matcher(s.value()).matches();
    }

    private static boolean containsPii(AttributeValue value) {
        if (!(value instanceof AttributeValue.StringValue s)) return false;
        // anything past the head is cut before sending
        String text = head(s.value(), Attributes.MAX_STRING_LENGTH);
        for (Pattern p : VALUE_PATTERNS) {
            if (p == EMAIL && text.indexOf('@') < 0) continue;
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static String head(String text, int limit) {
        return text.length() > limit + SCAN_MARGIN ? text.substring(0, limit + SCAN_MARGIN) : text;
    }

    /** First 16 lowercase hex chars of SHA-256. */
    public static String hash(String raw) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
