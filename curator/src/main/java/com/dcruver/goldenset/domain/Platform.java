package com.dcruver.goldenset.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Hosting platform block carried by every item.
 * A server-backed spec binds to the wildcard address, a static one binds nowhere.
 */
@Data
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Platform {
    public static final String WILDCARD_BIND = "0.0.0.0";

    private final String name;
    private final boolean server;
    private final String bind;

    public static Platform of(String name, boolean server) {
        return Platform.builder()
            .name(name)
            .server(server)
            .bind(server ? WILDCARD_BIND : null)
            .build();
    }
}
