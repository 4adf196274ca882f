package io.github.crudgraph.web;

import io.github.crudgraph.core.context.AuthContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Reads the auth metadata stored under {@link AuthContext#REQUEST_ATTRIBUTE}, either as an
 * {@link AuthContext} or as a plain map. Requests without it are anonymous.
 */
@Slf4j
public class RequestAttributeAuthContextResolver implements AuthContextResolver {

    @Override
    @SuppressWarnings("unchecked")
    public AuthContext resolve(HttpServletRequest request) {
        Object attribute = request.getAttribute(AuthContext.REQUEST_ATTRIBUTE);
        if (attribute instanceof AuthContext) {
            return (AuthContext) attribute;
        }
        if (attribute instanceof Map) {
            return AuthContext.of((Map<String, ?>) attribute);
        }
        if (attribute != null) {
            log.warn("⚠️  Ignoring auth attribute of unexpected type {}", attribute.getClass().getName());
        }
        return AuthContext.anonymous();
    }
}
