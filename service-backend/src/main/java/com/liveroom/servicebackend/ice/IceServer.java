package com.liveroom.servicebackend.ice;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One STUN or TURN entry as handed to clients: {@code {urls, username?, credential?}}.
 * {@code urls} may arrive as a single string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IceServer(
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> urls,
        String username,
        String credential) {

    public IceServer {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }

    @JsonIgnore
    public boolean isRelay() {
        return urls.stream().anyMatch(u -> u.startsWith("turn:") || u.startsWith("turns:"));
    }
}
