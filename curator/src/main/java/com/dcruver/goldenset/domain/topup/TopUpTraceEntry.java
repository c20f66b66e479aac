package com.dcruver.goldenset.domain.topup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One decision of the top-up loop: a candidate considered for a stratum, or a stratum-level event.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopUpTraceEntry {
    String stratum;
    String candidateId;
    Double maxJaccard;
    Boolean selected;
    Reason reason;
    Integer attempt;
    String message;

    public enum Reason {
        TOP_UP("top_up"),
        NOT_NEEDED("not_needed"),
        POOL_EMPTY("pool_empty"),
        REGENERATED("regenerated"),
        OVER_QUOTA("over_quota");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }
}
