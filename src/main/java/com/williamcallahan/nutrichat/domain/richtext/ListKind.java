package com.williamcallahan.nutrichat.domain.richtext;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Marker family of a list block. A change of kind always starts a new list.
 */
public enum ListKind {
    BULLET,
    ORDERED;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
