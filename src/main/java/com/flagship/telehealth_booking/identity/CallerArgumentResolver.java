package com.flagship.telehealth_booking.identity;

import com.flagship.telehealth_booking.common.exception.UnauthorizedException;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

/**
 * Resolves {@link Caller} controller arguments.
 *
 * Session issuance lives in the authentication gateway in front of this service;
 * it forwards the authenticated user id in {@code X-User-Id}. The role is always
 * read from the user directory, never trusted from the request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallerArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final UserDirectory userDirectory;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Caller.class.equals(parameter.getParameterType());
    }

    @Override
    public Caller resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(USER_ID_HEADER);
        if (header == null || header.isBlank()) {
            throw new UnauthorizedException("Authentication required");
        }

        UUID userId;
        try {
            userId = UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Authentication required");
        }

        Caller caller = userDirectory.resolve(userId)
                .orElseThrow(() -> new UnauthorizedException("Unknown user"));

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, caller.getUserId().toString());
        log.debug("Resolved caller: role={}", caller.getRole());
        return caller;
    }
}
