package com.dcruver.goldenset.domain.bands;

import com.dcruver.goldenset.domain.LengthBand;
import lombok.Value;

/**
 * Outcome of comparing an item's declared band with the band of its token count.
 * {@code actual} is null when the count falls in no band.
 */
@Value
public class BandCheck {
    boolean valid;
    int tokenCount;
    LengthBand declared;
    LengthBand actual;
    String message;
}
