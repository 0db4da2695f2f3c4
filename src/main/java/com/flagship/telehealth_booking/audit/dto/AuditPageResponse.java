package com.flagship.telehealth_booking.audit.dto;

import lombok.Value;

import java.util.List;

/**
 * {@code {data: [...], meta: {page, limit, total, totalPages}}}; page is 1-based.
 */
@Value
public class AuditPageResponse {
    List<AuditEventResponse> data;
    Meta meta;

    @Value
    public static class Meta {
        int page;
        int limit;
        long total;
        int totalPages;
    }
}
