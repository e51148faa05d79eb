package com.symdiff.derivative;

/**
 * Selects how the differentiation engine treats differences and quotients.
 *
 * <ul>
 *   <li>{@code STANDARD} (default): {@code (a - b)' = a' - b'} and the
 *       quotient rule {@code (u / v)' = (u'v - uv') / v^2}</li>
 *   <li>{@code LEGACY}: reproduces the historical output, where
 *       {@code (a - b)'} is built as {@code a' + b'} and the quotient
 *       numerator as {@code uv' - v'u}</li>
 * </ul>
 *
 * <p>The mode is held by each {@link Differentiator}; there is no global
 * switch. {@link #fromSystemProperty()} reads the default from
 * {@value #SYSTEM_PROPERTY}.
 */
public enum DifferentiationMode {
    STANDARD,
    LEGACY;

    /** System property consulted by {@link #fromSystemProperty()}. */
    public static final String SYSTEM_PROPERTY = "symdiff.differentiation.mode";

    /**
     * Parse a mode string (case-insensitive).
     *
     * @param value "standard" or "legacy"; null selects STANDARD
     * @return the parsed mode
     * @throws IllegalArgumentException if value is not recognized
     */
    public static DifferentiationMode parse(String value) {
        if (value == null) {
            return STANDARD;
        }
        return switch (value.trim().toLowerCase()) {
            case "standard" -> STANDARD;
            case "legacy"   -> LEGACY;
            default -> throw new IllegalArgumentException(
                "Unknown differentiation mode: '%s'. Valid values: standard, legacy".formatted(value));
        };
    }

    /**
     * Reads the mode from the {@value #SYSTEM_PROPERTY} system property.
     *
     * @return the configured mode, STANDARD when the property is unset
     * @throws IllegalArgumentException if the property holds an unknown value
     */
    public static DifferentiationMode fromSystemProperty() {
        return parse(System.getProperty(SYSTEM_PROPERTY));
    }
}
