package com.codeheadsystems.onepass.model.entry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a scanned pass presented at an event entrance.
 * <p>
 * Used by: {@code POST /entry/validate}
 *
 * @param qrText  the raw text decoded from the holder's QR code
 * @param eventId the event the scanner is admitting people to
 */
public record ValidateEntryRequest(
    @JsonProperty("qrText") String qrText,
    @JsonProperty("eventId") String eventId) {
}
