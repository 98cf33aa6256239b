package com.devgate.security.context;

import com.devgate.security.AuthenticatedPrincipal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The authenticated caller and their raw access token, as seen by code executing on their
 * behalf.
 * <p>
 * {@link #toString()} never prints the token.
 *
 * @param principal   validated caller
 * @param accessToken the bearer token that produced {@code principal}, for on-behalf-of calls
 */
public record ExecutionContext(AuthenticatedPrincipal principal, String accessToken) {

    public static final String USER_CONTEXT_ARGUMENT = "user_context";
    public static final String ACCESS_TOKEN_ARGUMENT = "user_access_token";

    public ExecutionContext {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
    }

    /**
     * Best human-recognizable identifier: the username if the token carried one, else the object id.
     */
    public String userIdentifier() {
        return principal.username().orElse(principal.objectId());
    }

    /**
     * Flat attributes suitable for attaching to a run or trace. Optional values are omitted
     * when absent.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("user_object_id", principal.objectId());
        metadata.put("user_tenant_id", principal.tenantId());
        metadata.put("user_roles", new ArrayList<>(principal.roles()));
        metadata.put("user_scopes", new ArrayList<>(principal.scopes()));
        principal.displayName().ifPresent(name -> metadata.put("user_name", name));
        principal.username().ifPresent(upn -> metadata.put("user_principal_name", upn));
        return metadata;
    }

    /**
     * The caller's identity as a plain map, shaped for tool arguments.
     */
    public Map<String, Object> userContext() {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("object_id", principal.objectId());
        user.put("tenant_id", principal.tenantId());
        user.put("name", principal.name());
        user.put("preferred_username", principal.preferredUsername());
        user.put("roles", new ArrayList<>(principal.roles()));
        user.put("scopes", new ArrayList<>(principal.scopes()));
        user.put("claims", principal.claims());
        return user;
    }

    /**
     * Arguments handed to a tool invocation so it can act on behalf of the caller.
     */
    public Map<String, Object> toToolArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(USER_CONTEXT_ARGUMENT, userContext());
        arguments.put(ACCESS_TOKEN_ARGUMENT, accessToken);
        return arguments;
    }

    @Override
    public String toString() {
        return "ExecutionContext[user=" + userIdentifier()
                + ", tenant=" + principal.tenantId()
                + ", accessToken=[REDACTED]]";
    }
}
