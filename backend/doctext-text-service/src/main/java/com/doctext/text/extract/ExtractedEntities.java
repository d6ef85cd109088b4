package com.doctext.text.extract;

import java.util.List;

/**
 * Every entity kind found in one text, each list in extraction order.
 */
public record ExtractedEntities(
    List<String> numbers,
    List<String> dates,
    List<String> monetaryValues,
    List<String> taxIds,
    List<String> phoneNumbers,
    List<String> postalCodes,
    List<String> emails
) {
    public boolean isEmpty() {
        return numbers.isEmpty() && dates.isEmpty() && monetaryValues.isEmpty() && taxIds.isEmpty()
            && phoneNumbers.isEmpty() && postalCodes.isEmpty() && emails.isEmpty();
    }
}
