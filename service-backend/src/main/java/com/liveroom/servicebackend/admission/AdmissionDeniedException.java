package com.liveroom.servicebackend.admission;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.call.CallException;

public class AdmissionDeniedException extends CallException {

    public AdmissionDeniedException(String message) {
        super(CallError.ADMISSION_DENIED, message);
    }

    public AdmissionDeniedException(String message, Throwable cause) {
        super(CallError.ADMISSION_DENIED, message, cause);
    }
}
