package com.ivamare.eventsourcing.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * An event whose payload is kept as a JSON tree.
 *
 * <p>Delivered to wildcard handlers, and to shape handlers whose target type cannot be
 * instantiated.
 */
public class DynamicEvent extends Event {

    private final String type;
    private final JsonNode body;

    public DynamicEvent(String type, JsonNode body) {
        this.type = type;
        this.body = body != null ? body : JsonNodeFactory.instance.objectNode();
    }

    @Override
    public String eventName() {
        return type;
    }

    public JsonNode getBody() {
        return body;
    }

    /**
     * Read a top-level property of the payload.
     *
     * @param property property name
     * @return the value, or a missing node
     */
    public JsonNode get(String property) {
        return body.path(property);
    }

    /**
     * Read a top-level text property of the payload.
     *
     * @param property property name
     * @return the text, or null when absent
     */
    public String text(String property) {
        JsonNode node = body.get(property);
        return node == null || node.isNull() ? null : node.asText();
    }
}
