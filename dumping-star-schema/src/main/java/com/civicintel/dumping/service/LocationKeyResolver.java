package com.civicintel.dumping.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives one stable key per physical location.
 *
 * Preference order:
 *  1. rounded coordinates, "lat,lon" at 4 decimals (~10 m), so repeated
 *     reports at the same site collapse onto one key despite GPS jitter
 *  2. the address, upper-cased with punctuation stripped and spaces collapsed
 *  3. null, which the integrity check reports as a missing join key
 *
 * (0, 0) is the "no GPS fix" placeholder and is treated as no coordinates at
 * all, otherwise every such report would pile up on one fake hotspot.
 */
@Component
public class LocationKeyResolver {

    static final int COORDINATE_SCALE = 4;

    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^A-Z0-9 ]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param address   free-text address, any type, may be null
     * @param latitude  number or numeric text, may be null or malformed
     * @param longitude number or numeric text, may be null or malformed
     */
    public String resolve(Object address, Object latitude, Object longitude) {
        Double lat = parseCoordinate(latitude);
        Double lon = parseCoordinate(longitude);

        if (isNullIsland(lat, lon)) {
            lat = null;
            lon = null;
        }

        if (lat != null && lon != null) {
            return formatCoordinate(lat) + "," + formatCoordinate(lon);
        }
        return normalizeAddress(address);
    }

    /** Upper-case, keep only [A-Z0-9 ], collapse whitespace. Null when nothing is left. */
    public static String normalizeAddress(Object address) {
        String text = FieldNormalizer.normalizeText(address);
        if (text == null) return null;

        String key = text.toUpperCase(Locale.ROOT);
        key = NON_KEY_CHARS.matcher(key).replaceAll("");
        key = WHITESPACE.matcher(key).replaceAll(" ").strip();
        return key.isEmpty() ? null : key;
    }

    /** Number or numeric text to a finite double; anything else is null. */
    public static Double parseCoordinate(Object value) {
        if (value == null) return null;

        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else {
            String text = FieldNormalizer.normalizeText(value);
            if (text == null) return null;
            try {
                d = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(d) ? d : null;
    }

    public static boolean isNullIsland(Double lat, Double lon) {
        return lat != null && lon != null && lat == 0.0 && lon == 0.0;
    }

    /**
     * Rounds half-even to 4 places and renders the shortest plain decimal
     * with at least one fractional digit: 47.6062, 47.0, -122.3321.
     */
    static String formatCoordinate(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value)
                .setScale(COORDINATE_SCALE, RoundingMode.HALF_EVEN)
                .stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0.0";
        }
        if (rounded.scale() < 1) {
            rounded = rounded.setScale(1);
        }
        return rounded.toPlainString();
    }
}
