package org.pushrelay.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsing JSON request bodies.
 */
public class HttpRequestUtil {

    private static final ObjectMapper mapper = JsonUtil.mapper();

    private HttpRequestUtil() {}

    /**
     * Reads a JSON object, or an array of objects, from a blocking exchange.
     * On malformed input a 400 is sent and {@code null} returned.
     */
    public static List<Map<String, Object>> parseJsonObjects(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            JsonNode node = mapper.readTree(is);
            List<Map<String, Object>> objects = new ArrayList<>();

            if (node != null && node.isObject()) {
                objects.add(toMap(node));
            } else if (node != null && node.isArray()) {
                for (JsonNode item : node) {
                    if (!item.isObject()) {
                        ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Every event must be a JSON object");
                        return null;
                    }
                    objects.add(toMap(item));
                }
            } else {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Expected a JSON object or array");
                return null;
            }
            return objects;
        } catch (Exception e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
            return null;
        }
    }

    private static Map<String, Object> toMap(JsonNode node) {
        return mapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }
}
