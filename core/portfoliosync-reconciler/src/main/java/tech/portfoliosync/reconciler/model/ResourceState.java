package tech.portfoliosync.reconciler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Target state of the resources named in a desired-state document.
 */
public enum ResourceState {
    /** Create what is missing and converge mappings, permissions and ACLs */
    PRESENT,

    /** Delete the named groups, teams and projects */
    ABSENT;

    @JsonCreator
    public static ResourceState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PRESENT;
        }
        return ResourceState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
