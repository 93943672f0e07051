package com.liveroom.servicebackend.web.dto;

import com.liveroom.servicebackend.ice.IceServer;

import java.util.List;

/**
 * What a browser client needs to build its peer connection.
 */
public record IceConfigResponse(List<IceServer> iceServers, String signalingPath) {
}
