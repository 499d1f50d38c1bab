package com.procflow.backend.global.web;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.servlet.http.HttpServletRequest;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds a {@link RequestContext} from the caller headers set by the upstream gateway.
 * Internal metadata such as the approval bypass flag can never be supplied this way.
 */
@Component
public class RequestContextResolver {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String REALM_HEADER = "X-Realm-Id";
    public static final String ROLES_HEADER = "X-Roles";

    private static final String INVALID_CODE = "REQUEST_CONTEXT_INVALID";

    public RequestContext resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_HEADER);
        if (!StringUtils.hasText(userId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CODE, USER_HEADER + " header is required");
        }
        UUID tenantId = parseTenant(request.getHeader(TENANT_HEADER));
        String realm = request.getHeader(REALM_HEADER);
        List<String> roles = parseRoles(request.getHeader(ROLES_HEADER));
        if (roles.stream().anyMatch(RequestContext.SYSTEM_ROLE::equalsIgnoreCase)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CODE,
                    "Role '" + RequestContext.SYSTEM_ROLE + "' is reserved");
        }
        return new RequestContext(
                userId.trim(),
                tenantId,
                StringUtils.hasText(realm) ? realm.trim() : RequestContext.DEFAULT_REALM,
                roles,
                Map.of()
        );
    }

    private UUID parseTenant(String raw) {
        if (!StringUtils.hasText(raw)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CODE, TENANT_HEADER + " header is required");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_CODE, TENANT_HEADER + " must be a UUID");
        }
    }

    private List<String> parseRoles(String raw) {
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
    }
}
