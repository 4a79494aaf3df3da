package io.zendesk.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.zendesk.sdk.ZendeskException;
import io.zendesk.sdk.pagination.CursorPage;
import io.zendesk.sdk.pagination.CursorPaginationMeta;
import io.zendesk.sdk.pagination.OffsetPage;
import io.zendesk.sdk.pagination.Page;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Wraps request payloads in, and unwraps response payloads from, the single-key JSON objects the API uses:
 * {@code {"group": {...}}} for one entity and {@code {"groups": [...]}} for listings.
 */
public final class Envelope {

    private Envelope() {
    }

    public static Map<String, Object> wrap(String key, Object value) {
        return Collections.singletonMap(key, value);
    }

    /**
     * Decodes the entity stored under {@code key}.
     *
     * @throws ZendeskException when the body is not a JSON object or the key is missing
     */
    public static <T> T unwrap(byte[] body, String key, Class<T> type) throws ZendeskException {
        JsonNode node = parse(body, key).get(key);
        if (node == null || node.isNull()) {
            throw new ZendeskException("decode " + key + " response: missing \"" + key + "\"");
        }
        return convert(node, key, type);
    }

    /**
     * Decodes an offset-paginated listing; an absent list key yields an empty page.
     */
    public static <T> OffsetPage<T> offsetPage(byte[] body, String key, Class<T> type) throws ZendeskException {
        JsonNode root = parse(body, key);
        return new OffsetPage<>(readList(root, key, type), convert(root, key, Page.class));
    }

    public static <T> CursorPage<T> cursorPage(byte[] body, String key, Class<T> type) throws ZendeskException {
        JsonNode root = parse(body, key);
        JsonNode meta = root.get("meta");
        CursorPaginationMeta decoded = meta == null || meta.isNull()
            ? CursorPaginationMeta.EMPTY
            : convert(meta, key, CursorPaginationMeta.class);
        return new CursorPage<>(readList(root, key, type), decoded);
    }

    private static JsonNode parse(byte[] body, String key) throws ZendeskException {
        JsonNode root;
        try {
            root = Json.mapper().readTree(body == null ? new byte[0] : body);
        } catch (IOException ex) {
            throw new ZendeskException("decode " + key + " response: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ZendeskException("decode " + key + " response: expected a JSON object");
        }
        return root;
    }

    private static <T> List<T> readList(JsonNode root, String key, Class<T> type) throws ZendeskException {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ZendeskException("decode " + key + " response: \"" + key + "\" is not an array");
        }
        try {
            return Json.mapper().readerForListOf(type).readValue(node);
        } catch (IOException ex) {
            throw new ZendeskException("decode " + key + " response: " + ex.getMessage(), ex);
        }
    }

    private static <T> T convert(JsonNode node, String key, Class<T> type) throws ZendeskException {
        try {
            return Json.mapper().treeToValue(node, type);
        } catch (JsonProcessingException ex) {
            throw new ZendeskException("decode " + key + " response: " + ex.getMessage(), ex);
        }
    }
}
