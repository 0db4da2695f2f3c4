package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.identity.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Ends a call: completes the consultation, then deletes the provider room so
 * every participant is ejected. Room deletion is best effort; the room expires
 * on its own otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallTerminationService {

    private final VideoSessionWriter videoSessionWriter;
    private final VideoProvider videoProvider;

    public Consultation close(Caller caller, UUID consultationId) {
        ClosedCall closed = videoSessionWriter.commitClose(caller, consultationId);

        VideoSession session = closed.getSession();
        if (session != null) {
            try {
                videoProvider.deleteRoom(session.getRoomName());
            } catch (RuntimeException e) {
                log.warn("Failed to delete room after closing call: consultationId={}, roomName={}, error={}",
                    consultationId, session.getRoomName(), e.getMessage());
            }
        }

        log.info("Call closed: consultationId={}, closedBy={}", consultationId, caller.getRole());
        return closed.getConsultation();
    }
}
