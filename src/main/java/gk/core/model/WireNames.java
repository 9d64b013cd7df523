package gk.core.model;

import java.util.Locale;
import java.util.function.Function;

/**
 * Lookup of enum constants by their lowercase wire name, also accepting the Java constant name.
 */
final class WireNames {

    private WireNames() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, E[] values, Function<E, String> wireName, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type.getSimpleName() + " must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (E candidate : values) {
            if (wireName.apply(candidate).equals(normalized)
                || candidate.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value);
    }
}
