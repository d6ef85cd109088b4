package com.doctext.text.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-level extraction of structured values from OCR text. Values are
 * returned as matched, never parsed or checked; see {@link EntityValidators}.
 *
 * <p>Tax ids, phone numbers and postal codes are read from the text with every
 * non-digit removed, so digits of neighbouring fields can run together. Each
 * fixed length is reported at every offset of a longer run, and one run may be
 * reported under several lengths.
 *
 * <p>Digits are any Unicode decimal digit, so fullwidth or Arabic-Indic digits
 * are matched and returned as written.
 */
public final class EntityExtractors {

    private static final int MONEY_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?", Pattern.UNICODE_CHARACTER_CLASS);

    private static final PatternScan DATES = PatternScan.of(
        Pattern.compile("\\d{2}/\\d{2}/\\d{4}", Pattern.UNICODE_CHARACTER_CLASS),   // DD/MM/YYYY
        Pattern.compile("\\d{2}-\\d{2}-\\d{4}", Pattern.UNICODE_CHARACTER_CLASS),   // DD-MM-YYYY
        Pattern.compile("\\d{4}-\\d{2}-\\d{2}", Pattern.UNICODE_CHARACTER_CLASS),   // YYYY-MM-DD
        Pattern.compile("\\d{2}/\\d{2}/\\d{2}", Pattern.UNICODE_CHARACTER_CLASS)    // DD/MM/YY
    );

    static final PatternScan MONETARY_VALUES = PatternScan.of(
        Pattern.compile("R\\$\\s*\\d+(?:[.,]\\d{3})*(?:[.,]\\d{2})?", MONEY_FLAGS),
        Pattern.compile("R\\$\\s*\\d+(?:[.,]\\d{2})?", MONEY_FLAGS),
        Pattern.compile("\\d+(?:[.,]\\d{3})*(?:[.,]\\d{2})?\\s*rea(?:is|l)", MONEY_FLAGS),
        Pattern.compile("\\d+(?:[.,]\\d{2})?\\s*rea(?:is|l)", MONEY_FLAGS)
    );

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern NON_DIGIT = Pattern.compile("\\P{Nd}+");
    private static final Pattern CNPJ_RUN = digitWindow(14);
    private static final Pattern CPF_RUN = digitWindow(11);
    private static final Pattern LANDLINE_RUN = digitWindow(10);
    private static final Pattern MOBILE_RUN = digitWindow(11);
    private static final Pattern CEP_RUN = digitWindow(8);

    private EntityExtractors() {
    }

    public static List<String> numbers(String text) {
        if (isEmpty(text)) return List.of();
        return findAll(NUMBER, text);
    }

    public static List<String> dates(String text) {
        if (isEmpty(text)) return List.of();
        return DATES.findAll(text);
    }

    public static List<String> monetaryValues(String text) {
        if (isEmpty(text)) return List.of();
        return MONETARY_VALUES.findAll(text);
    }

    /** CNPJ candidates (14 digits) first, then CPF candidates (11 digits). */
    public static List<String> taxIds(String text) {
        return digitRuns(text, CNPJ_RUN, CPF_RUN);
    }

    /** 10-digit runs first, then 11-digit runs. */
    public static List<String> phoneNumbers(String text) {
        return digitRuns(text, LANDLINE_RUN, MOBILE_RUN);
    }

    public static List<String> postalCodes(String text) {
        return digitRuns(text, CEP_RUN);
    }

    public static List<String> emails(String text) {
        if (isEmpty(text)) return List.of();
        return findAll(EMAIL, text);
    }

    public static ExtractedEntities extractAll(String text) {
        return new ExtractedEntities(
            numbers(text),
            dates(text),
            monetaryValues(text),
            taxIds(text),
            phoneNumbers(text),
            postalCodes(text),
            emails(text)
        );
    }

    static String digitsOnly(String text) {
        if (isEmpty(text)) return "";
        return NON_DIGIT.matcher(text).replaceAll("");
    }

    private static List<String> digitRuns(String text, Pattern... runs) {
        String digits = digitsOnly(text);
        if (digits.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (Pattern run : runs) {
            Matcher m = run.matcher(digits);
            while (m.find()) {
                out.add(m.group(1));
            }
        }
        return out;
    }

    // zero-width lookahead, so the scan moves one digit at a time and windows overlap
    private static Pattern digitWindow(int length) {
        return Pattern.compile("(?=(\\p{Nd}{" + length + "}))");
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> out = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    private static boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }
}
