package com.processflow.api.web;

import com.processflow.core.model.Actor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the caller from the {@code X-User-Id} and {@code X-Tenant-Id} headers.
 * Authentication happens upstream; the headers are trusted as given.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_HEADER = "X-User-Id";
    public static final String TENANT_HEADER = "X-Tenant-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(RequestActor.class)
            && Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Actor resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                 NativeWebRequest webRequest, WebDataBinderFactory binderFactory)
            throws MissingRequestHeaderException {
        String userId = webRequest.getHeader(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new MissingRequestHeaderException(USER_HEADER, parameter);
        }
        String tenantId = webRequest.getHeader(TENANT_HEADER);
        return new Actor(userId, tenantId == null || tenantId.isBlank() ? null : tenantId);
    }
}
