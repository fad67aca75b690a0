package com.phillippitts.videoconverter.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Push notification emitted by the status store on every observable change.
 *
 * @param type kind of change
 * @param conversionId affected conversion
 * @param status projection of the new state; null for removals
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreEvent(Type type, String conversionId, ConversionStatusView status) {

    public enum Type {
        STATUS("status"),
        REMOVED("removed");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public StoreEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(conversionId, "conversionId");
    }

    public static StoreEvent status(String conversionId, ConversionStatus status) {
        return new StoreEvent(Type.STATUS, conversionId, ConversionStatusView.of(conversionId, status));
    }

    public static StoreEvent removed(String conversionId) {
        return new StoreEvent(Type.REMOVED, conversionId, null);
    }
}
