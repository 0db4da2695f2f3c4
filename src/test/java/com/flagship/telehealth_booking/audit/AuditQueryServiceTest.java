package com.flagship.telehealth_booking.audit;

import com.flagship.telehealth_booking.audit.dto.AuditPageResponse;
import com.flagship.telehealth_booking.common.exception.ForbiddenException;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuditQueryServiceTest {

    @Mock
    private AuditEventRepository repository;

    @InjectMocks
    private AuditQueryService service;

    private final Caller admin = new Caller(UUID.randomUUID(), Role.ADMIN);

    @Test
    @DisplayName("Admins page through events with 1-based meta")
    void pagesEvents() {
        UUID consultationId = UUID.randomUUID();
        AuditEventEntity event = AuditEventEntity.fromDomain(AuditEvent.create(
                admin.getUserId(), consultationId, AuditEventType.CONSULT_CREATED,
                Map.of("specialty", "GENERAL"), Instant.parse("2026-03-01T09:00:00Z")));
        when(repository.findByFilter(eq(AuditEventType.CONSULT_CREATED), isNull(), eq(consultationId), any()))
                .thenReturn(new PageImpl<>(List.of(event), PageRequest.of(1, 10), 11));

        AuditPageResponse page = service.list(admin, "consult_created", null, consultationId, 2, 10);

        assertEquals(1, page.getData().size());
        assertEquals("CONSULT_CREATED", page.getData().get(0).getEventType());
        assertEquals(2, page.getMeta().getPage());
        assertEquals(10, page.getMeta().getLimit());
        assertEquals(11, page.getMeta().getTotal());
        assertEquals(2, page.getMeta().getTotalPages());
    }

    @Test
    @DisplayName("Out-of-range page and limit are clamped")
    void clampsPaging() {
        when(repository.findByFilter(any(), any(), any(), any())).thenReturn(new PageImpl<>(List.of()));

        AuditPageResponse page = service.list(admin, null, null, null, 0, 1000);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findByFilter(isNull(), isNull(), isNull(), pageable.capture());
        assertEquals(0, pageable.getValue().getPageNumber());
        assertEquals(AuditQueryService.MAX_LIMIT, pageable.getValue().getPageSize());
        assertEquals(1, page.getMeta().getPage());
    }

    @Test
    @DisplayName("Unknown event type is a validation error listing the allowed values")
    void unknownEventType() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.list(admin, "NOT_A_TYPE", null, null, null, null));

        assertTrue(((List<?>) e.getDetails().get("allowed")).contains("PAYMENT_CONFIRMED"));
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("Patients and doctors cannot read the audit trail")
    void adminOnly() {
        assertThrows(ForbiddenException.class,
                () -> service.list(new Caller(UUID.randomUUID(), Role.PATIENT), null, null, null, null, null));
        assertThrows(ForbiddenException.class,
                () -> service.list(new Caller(UUID.randomUUID(), Role.DOCTOR), null, null, null, null, null));
        verifyNoInteractions(repository);
    }
}
