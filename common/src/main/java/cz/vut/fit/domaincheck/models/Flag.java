package cz.vut.fit.domaincheck.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A tri-state value of a derived field: known to be true, known to be false, or unknown.
 * Serialized as a JSON boolean, or as the string {@value #NO_DATA_TEXT} for unknown values.
 */
public enum Flag {
    TRUE,
    FALSE,
    NO_DATA;

    public static final String NO_DATA_TEXT = "no-data";

    public static Flag of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @JsonValue
    public Object jsonValue() {
        return switch (this) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case NO_DATA -> NO_DATA_TEXT;
        };
    }
}
