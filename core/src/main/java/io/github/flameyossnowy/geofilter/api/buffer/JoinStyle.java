package io.github.flameyossnowy.geofilter.api.buffer;

import java.util.Locale;

public enum JoinStyle {
    ROUND,
    MITRE,
    BEVEL;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
