package org.orchestration.migrator.odx.models;

import java.util.Locale;

public enum MessageDirection {
    NONE,
    IN,
    OUT,
    IN_OUT;

    /**
     * Maps the designer's ParamDirection value (In, Out, InOut / Ref) to a direction.
     *
     * @param raw the property value, may be empty
     * @return the matching direction, NONE when unknown
     */
    public static MessageDirection fromDesignerValue(String raw) {
        if (raw == null) {
            return NONE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "in" -> IN;
            case "out" -> OUT;
            case "inout", "in_out", "ref" -> IN_OUT;
            default -> NONE;
        };
    }
}
