package com.liveroom.servicebackend.signaling;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.call.CallException;

public class ChannelClosedException extends CallException {

    public ChannelClosedException(String message) {
        super(CallError.CHANNEL_CLOSED, message);
    }
}
