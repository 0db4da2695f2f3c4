package com.flagship.telehealth_booking.audit;

import com.flagship.telehealth_booking.audit.dto.AuditPageResponse;
import com.flagship.telehealth_booking.identity.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditQueryService auditQueryService;

    @GetMapping
    public ResponseEntity<AuditPageResponse> listAuditEvents(
            Caller caller,
            @RequestParam(name = "eventType", required = false) String eventType,
            @RequestParam(name = "actorUserId", required = false) UUID actorUserId,
            @RequestParam(name = "consultationId", required = false) UUID consultationId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit) {

        AuditPageResponse response = auditQueryService.list(caller, eventType, actorUserId, consultationId, page, limit);
        log.debug("Audit listing returned {} of {} events", response.getData().size(), response.getMeta().getTotal());
        return ResponseEntity.ok(response);
    }
}
