package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.consultation.Consultation;
import lombok.Value;

@Value
public class ClosedCall {
    Consultation consultation;
    /** Absent when the call was started without provisioning a room. */
    VideoSession session;
}
