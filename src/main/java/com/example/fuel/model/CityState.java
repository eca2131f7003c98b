package com.example.fuel.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * A normalized city/state pair: city lowercase-trimmed, state uppercase-trimmed.
 * {@link #UNRESOLVED} stands for a coordinate that could not be geocoded.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CityState {

    public static final CityState UNRESOLVED = new CityState(null, null);

    String city;
    String state;

    public static CityState of(String city, String state) {
        if (city == null || state == null || city.isBlank() || state.isBlank()) {
            return UNRESOLVED;
        }
        return new CityState(normalizeCity(city), normalizeState(state));
    }

    /**
     * Parses {@code "City, ST"}. Returns {@link #UNRESOLVED} when the text does not have that shape.
     */
    public static CityState parse(String text) {
        if (text == null) {
            return UNRESOLVED;
        }
        int comma = text.lastIndexOf(',');
        if (comma <= 0 || comma == text.length() - 1) {
            return UNRESOLVED;
        }
        return of(text.substring(0, comma), text.substring(comma + 1));
    }

    public static String normalizeCity(String city) {
        return city.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeState(String state) {
        return state.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isResolved() {
        return city != null && state != null;
    }

    /** City in title case for display, e.g. "oklahoma city" becomes "Oklahoma City". */
    public String displayCity() {
        return titleCase(city);
    }

    public static String titleCase(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return isResolved() ? displayCity() + ", " + state : "<unresolved>";
    }
}
