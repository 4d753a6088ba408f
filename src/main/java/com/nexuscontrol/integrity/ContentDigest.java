package com.nexuscontrol.integrity;

import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.EventType;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 hex digests over canonical JSON.
 */
public final class ContentDigest {

    private ContentDigest() {
    }

    public static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    public static String of(Object value) {
        return sha256(CanonicalJson.writeBytes(value));
    }

    public static boolean verify(Object value, String expectedDigest) {
        return of(value).equals(expectedDigest);
    }

    /** Digest stamped on every stored event: covers type and payload only. */
    public static String ofEvent(EventType eventType, EventPayload payload) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("event_type", eventType.name());
        content.put("payload", payload);
        return of(content);
    }
}
