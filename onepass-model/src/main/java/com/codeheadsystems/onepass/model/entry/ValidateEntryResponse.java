package com.codeheadsystems.onepass.model.entry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the outcome of an entry validation.
 * <p>
 * Accepted scans carry the redeemed ticket, the scan time and the remaining capacity.
 * Rejected scans carry a {@link RejectReason}; when the ticket had already been redeemed the
 * original redemption time and scanner are included so staff can resolve the dispute.
 * <p>
 * Used by: {@code POST /entry/validate} response
 *
 * @param status          accepted or rejected
 * @param reason          why entry was denied, null when accepted
 * @param ticketId        the redeemed ticket, null when rejected
 * @param scannedAt       epoch seconds of this redemption, or of the earlier one for
 *                        {@link RejectReason#ALREADY_SCANNED}
 * @param remaining       tickets still available for the event after this redemption
 * @param previousScanner uid of the scanner who redeemed the ticket first, if known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateEntryResponse(
    @JsonProperty("status") EntryStatus status,
    @JsonProperty("reason") RejectReason reason,
    @JsonProperty("ticketId") String ticketId,
    @JsonProperty("scannedAt") Long scannedAt,
    @JsonProperty("remaining") Long remaining,
    @JsonProperty("previousScanner") String previousScanner) {

  public static ValidateEntryResponse accepted(String ticketId, long scannedAt, long remaining) {
    return new ValidateEntryResponse(EntryStatus.ACCEPTED, null, ticketId, scannedAt, remaining, null);
  }

  public static ValidateEntryResponse rejected(RejectReason reason) {
    return new ValidateEntryResponse(EntryStatus.REJECTED, reason, null, null, null, null);
  }

  public static ValidateEntryResponse alreadyScanned(Long redeemedAt, String previousScanner) {
    return new ValidateEntryResponse(EntryStatus.REJECTED, RejectReason.ALREADY_SCANNED, null,
        redeemedAt, null, previousScanner);
  }

  @JsonIgnore
  public boolean isAccepted() {
    return status == EntryStatus.ACCEPTED;
  }
}
