package com.dcruver.flowscript.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Content-addressed identifiers for IR entities.
 *
 * <p>Ids are the SHA-256 of a canonical JSON object (sorted keys, no whitespace)
 * holding only identity fields. Timestamps and line numbers never take part,
 * so parsing the same text twice yields the same ids.
 *
 * <p>Content is normalized before hashing and storing: Unicode NFC, trimmed,
 * internal whitespace runs collapsed to one space. Case is preserved.
 */
public final class ContentHasher {

    private static final String HASH_ALGORITHM = "SHA-256";
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ContentHasher() {
    }

    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        String nfc = Normalizer.normalize(content, Normalizer.Form.NFC);
        return WHITESPACE_RUN.matcher(nfc.trim()).replaceAll(" ");
    }

    public static String nodeId(NodeType type, String content) {
        Map<String, Object> identity = new TreeMap<>();
        identity.put("type", type.wireName());
        identity.put("content", normalize(content));
        return hash(identity);
    }

    public static String relationshipId(RelationType type, String source, String target, String axisLabel) {
        Map<String, Object> identity = new TreeMap<>();
        identity.put("type", type.wireName());
        identity.put("source", source);
        identity.put("target", target);
        identity.put("axis_label", axisLabel);
        return hash(identity);
    }

    public static String stateId(StateType type, String nodeId, Map<String, String> fields) {
        Map<String, Object> identity = new TreeMap<>();
        identity.put("type", type.wireName());
        identity.put("node_id", nodeId);
        identity.put("fields", new TreeMap<>(fields));
        return hash(identity);
    }

    /**
     * Hash of the canonical JSON form of {@code identity}
     */
    static String hash(Map<String, Object> identity) {
        try {
            String canonical = CANONICAL.writeValueAsString(identity);
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            return bytesToHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Identity fields are not serializable: " + identity, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(2 * bytes.length);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
