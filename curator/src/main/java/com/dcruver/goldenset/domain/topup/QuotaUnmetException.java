package com.dcruver.goldenset.domain.topup;

import com.dcruver.goldenset.domain.CurationException;
import com.dcruver.goldenset.domain.StratumKey;

import java.util.List;

/**
 * A stratum is still below quota after every regeneration attempt.
 * Carries the trace accumulated so far so it can be written before the run aborts.
 */
public class QuotaUnmetException extends CurationException {

    private final StratumKey stratum;
    private final int actual;
    private final int required;
    private final List<TopUpTraceEntry> partialTrace;

    public QuotaUnmetException(StratumKey stratum, int actual, int required, List<TopUpTraceEntry> partialTrace) {
        super(String.format("Failed to top up stratum %s to %d items (have %d)", stratum, required, actual));
        this.stratum = stratum;
        this.actual = actual;
        this.required = required;
        this.partialTrace = List.copyOf(partialTrace);
    }

    public StratumKey getStratum() {
        return stratum;
    }

    public int getActual() {
        return actual;
    }

    public int getRequired() {
        return required;
    }

    public List<TopUpTraceEntry> getPartialTrace() {
        return partialTrace;
    }
}
