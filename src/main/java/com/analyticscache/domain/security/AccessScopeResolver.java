package com.analyticscache.domain.security;

/**
 * Turns a user context into the scope the RBAC filter enforces.
 */
public interface AccessScopeResolver {

    AccessScope resolve(UserContext userContext);
}
