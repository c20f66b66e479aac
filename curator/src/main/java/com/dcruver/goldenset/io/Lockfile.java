package com.dcruver.goldenset.io;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * SHA-256 digests of every released file, keyed by file name.
 */
@Value
@Builder
@Jacksonized
public class Lockfile {
    Map<String, String> reports;
    Map<String, String> splits;
    Map<String, String> artifacts;
}
