package io.github.crudgraph.web;

import io.github.crudgraph.core.context.AuthContext;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Extracts the caller's auth metadata from an incoming request. Token decoding happens upstream;
 * applications replace the default bean to read it from wherever their security layer puts it.
 */
@FunctionalInterface
public interface AuthContextResolver {

    AuthContext resolve(HttpServletRequest request);
}
