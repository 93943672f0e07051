package com.liveroom.servicebackend.media;

import com.liveroom.servicebackend.ice.IceServer;

import java.util.List;

@FunctionalInterface
public interface MediaTransportFactory {

    MediaTransport create(String participantId, List<IceServer> iceServers);
}
