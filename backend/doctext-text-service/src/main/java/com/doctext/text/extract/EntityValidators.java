package com.doctext.text.extract;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Format and check-digit validation for single values, typically applied by
 * callers to the candidates returned by {@link EntityExtractors}.
 */
public final class EntityValidators {

    public static final String DEFAULT_DATE_PATTERN = "dd/MM/uuuu";

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final int[] CNPJ_WEIGHTS_FIRST = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CNPJ_WEIGHTS_SECOND = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CPF_WEIGHTS_FIRST = {10, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CPF_WEIGHTS_SECOND = {11, 10, 9, 8, 7, 6, 5, 4, 3, 2};

    private EntityValidators() {
    }

    public static boolean isValidEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /** Accepts punctuated or bare CNPJ; check digits must match. */
    public static boolean isValidCnpj(String value) {
        int[] digits = digitValues(value);
        if (digits.length != 14 || allSame(digits)) return false;
        return checkDigit(digits, CNPJ_WEIGHTS_FIRST) == digits[12]
            && checkDigit(digits, CNPJ_WEIGHTS_SECOND) == digits[13];
    }

    public static boolean isValidCpf(String value) {
        int[] digits = digitValues(value);
        if (digits.length != 11 || allSame(digits)) return false;
        return checkDigit(digits, CPF_WEIGHTS_FIRST) == digits[9]
            && checkDigit(digits, CPF_WEIGHTS_SECOND) == digits[10];
    }

    public static boolean isValidCep(String value) {
        return digitValues(value).length == 8;
    }

    public static boolean isValidPhone(String value) {
        int length = digitValues(value).length;
        return length == 10 || length == 11;
    }

    public static boolean isValidDate(String value) {
        return isValidDate(value, DEFAULT_DATE_PATTERN);
    }

    /**
     * Strict calendar check. {@code pattern} is a {@link DateTimeFormatter}
     * pattern and must use {@code uuuu} for the year.
     */
    public static boolean isValidDate(String value, String pattern) {
        if (value == null || value.isEmpty()) return false;
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
        try {
            LocalDate.parse(value, formatter);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /** Whole value must be one of the monetary shapes {@link EntityExtractors} scans for. */
    public static boolean isValidMonetaryValue(String value) {
        if (value == null || value.isEmpty()) return false;
        return EntityExtractors.MONETARY_VALUES.matchesWhole(value);
    }

    // mod-11 over the first weights.length digits
    private static int checkDigit(int[] digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += digits[i] * weights[i];
        }
        int rest = sum % 11;
        return rest < 2 ? 0 : 11 - rest;
    }

    // numeric value of every decimal digit, any script
    private static int[] digitValues(String value) {
        return EntityExtractors.digitsOnly(value).codePoints()
            .map(cp -> Character.digit(cp, 10))
            .toArray();
    }

    private static boolean allSame(int[] digits) {
        for (int d : digits) {
            if (d != digits[0]) return false;
        }
        return true;
    }
}
