package org.prefixwatch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public final class ContentHashes {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private ContentHashes() {
    }

    public static String snapshotHash(Collection<String> ipv4Prefixes, Collection<String> ipv6Prefixes) {
        final var content = new TreeMap<String, Object>();
        content.put("v4", sorted(ipv4Prefixes));
        content.put("v6", sorted(ipv6Prefixes));
        return sha256(canonicalJson(content));
    }

    public static String diffHash(String target, Collection<String> addedV4, Collection<String> removedV4,
                                  Collection<String> addedV6, Collection<String> removedV6) {
        final var content = new TreeMap<String, Object>();
        content.put("target", target);
        content.put("added_v4", sorted(addedV4));
        content.put("removed_v4", sorted(removedV4));
        content.put("added_v6", sorted(addedV6));
        content.put("removed_v6", sorted(removedV6));
        return sha256(canonicalJson(content));
    }

    public static List<String> sorted(Collection<String> values) {
        if (values == null || values.isEmpty()) return List.of();
        return List.copyOf(new TreeSet<>(values));
    }

    private static String canonicalJson(Map<String, Object> content) {
        try {
            return CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize hash input", ex);
        }
    }

    private static String sha256(String content) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
