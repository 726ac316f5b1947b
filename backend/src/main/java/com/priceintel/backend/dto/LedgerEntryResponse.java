package com.priceintel.backend.dto;

import com.priceintel.backend.model.CreditLedgerEntry;
import com.priceintel.backend.model.LedgerReason;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One credit ledger entry")
public class LedgerEntryResponse {

    @Schema(description = "Entry ID")
    private String id;

    @Schema(description = "Signed change to the balance")
    private int amountDelta;

    @Schema(description = "Why the balance changed")
    private LedgerReason reason;

    @Schema(description = "Job debited, for analysis debits")
    private String relatedJobId;

    @Schema(description = "Balance after this entry")
    private int balanceAfter;

    @Schema(description = "When the entry was written")
    private Instant timestamp;

    public static LedgerEntryResponse from(CreditLedgerEntry entry) {
        return LedgerEntryResponse.builder()
                .id(entry.getId())
                .amountDelta(entry.getAmountDelta())
                .reason(entry.getReason())
                .relatedJobId(entry.getRelatedJobId())
                .balanceAfter(entry.getBalanceAfter())
                .timestamp(entry.getTimestamp())
                .build();
    }
}
