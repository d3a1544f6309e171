package com.ttennebkram.schematic.netlist;

import com.ttennebkram.schematic.model.ComponentValue;
import com.ttennebkram.schematic.model.ValueKind;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes OCR value strings ("10kΩ", "100μF", "4k7") into SPICE value text.
 *
 * Anything that does not reduce to a number with an optional SI prefix falls
 * back to the per-kind default and is marked as defaulted.
 */
public final class ValueParser {

    // 4k7, 2R2, 3u3: the prefix letter stands in for the decimal point
    private static final Pattern RKM = Pattern.compile("^([+-]?\\d+)([a-zA-Z])(\\d+)$");
    private static final Pattern NUMBER_WITH_PREFIX = Pattern.compile("^([+-]?(?:\\d+(?:\\.\\d+)?|\\.\\d+))([a-zA-Z]*)$");
    private static final Pattern OHMS = Pattern.compile("(?i)ohms?");

    private ValueParser() {
    }

    public static ComponentValue parse(ValueKind kind, String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return ComponentValue.defaultFor(kind, raw);
        }

        String text = stripUnit(kind, normalizeMicro(raw.replaceAll("\\s+", "")));
        if (text.isEmpty()) {
            return ComponentValue.defaultFor(kind, raw);
        }

        Matcher rkm = RKM.matcher(text);
        if (rkm.matches()) {
            String letter = rkm.group(2);
            String prefix = kind == ValueKind.RESISTANCE && letter.equalsIgnoreCase("r") ? "" : letter;
            text = rkm.group(1) + "." + rkm.group(3) + prefix;
        }

        Matcher m = NUMBER_WITH_PREFIX.matcher(text);
        if (!m.matches()) {
            return ComponentValue.defaultFor(kind, raw);
        }

        // A leading minus is kept so source polarity survives; a plus is dropped
        String number = m.group(1).startsWith("+") ? m.group(1).substring(1) : m.group(1);
        String prefix = normalizePrefix(kind, m.group(2));
        if (prefix == null) {
            return ComponentValue.defaultFor(kind, raw);
        }

        double magnitude = Double.parseDouble(number) * multiplier(prefix);
        return new ComponentValue(kind, magnitude, raw, number + prefix, false);
    }

    public static ComponentValue parseResistance(String raw) {
        return parse(ValueKind.RESISTANCE, raw);
    }

    public static ComponentValue parseCapacitance(String raw) {
        return parse(ValueKind.CAPACITANCE, raw);
    }

    public static ComponentValue parseInductance(String raw) {
        return parse(ValueKind.INDUCTANCE, raw);
    }

    public static ComponentValue parseVoltage(String raw) {
        return parse(ValueKind.VOLTAGE, raw);
    }

    public static ComponentValue parseCurrent(String raw) {
        return parse(ValueKind.CURRENT, raw);
    }

    static String normalizeMicro(String text) {
        return text.replace('\u00B5', 'u').replace('\u03BC', 'u');
    }

    static String stripUnit(ValueKind kind, String text) {
        switch (kind) {
            case RESISTANCE:
                return OHMS.matcher(text.replace("\u03A9", "").replace("\u2126", "")).replaceAll("");
            case CAPACITANCE:
                // "100nf" and "100nF" both mean nanofarads; a bare "1f" is femto
                if (text.endsWith("F")) return text.substring(0, text.length() - 1);
                if (text.length() > 2 && text.endsWith("f") && Character.isLetter(text.charAt(text.length() - 2))) {
                    return text.substring(0, text.length() - 1);
                }
                return text;
            case INDUCTANCE:
                return stripSuffixIgnoreCase(text, "h");
            case VOLTAGE:
                return stripSuffixIgnoreCase(text, "v");
            case CURRENT:
                return stripSuffixIgnoreCase(text, "a");
            default:
                return text;
        }
    }

    private static String stripSuffixIgnoreCase(String text, String suffix) {
        if (text.toLowerCase(Locale.ROOT).endsWith(suffix)) {
            return text.substring(0, text.length() - suffix.length());
        }
        return text;
    }

    /**
     * SPICE prefix for the OCR prefix text, or null when it is not one.
     * Uppercase M on a resistance is mega; everywhere else M reads as milli,
     * matching how SPICE itself ignores case.
     */
    static String normalizePrefix(ValueKind kind, String prefix) {
        if (prefix.isEmpty()) return "";
        if (prefix.equalsIgnoreCase("meg")) return "meg";
        if (kind == ValueKind.RESISTANCE && prefix.equals("M")) return "meg";
        if (kind == ValueKind.RESISTANCE && prefix.equalsIgnoreCase("r")) return "";
        if (prefix.length() != 1) return null;

        String lower = prefix.toLowerCase(Locale.ROOT);
        return "fpnumkgt".contains(lower) ? lower : null;
    }

    static double multiplier(String prefix) {
        switch (prefix) {
            case "f": return 1e-15;
            case "p": return 1e-12;
            case "n": return 1e-9;
            case "u": return 1e-6;
            case "m": return 1e-3;
            case "k": return 1e3;
            case "meg": return 1e6;
            case "g": return 1e9;
            case "t": return 1e12;
            default: return 1.0;
        }
    }
}
