package com.procflow.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class RequestContextResolverTest {

    private final RequestContextResolver resolver = new RequestContextResolver();

    @Test
    @DisplayName("headers become a request context without internal metadata")
    void resolvesHeaders() {
        UUID tenantId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequestContextResolver.TENANT_HEADER, tenantId.toString());
        request.addHeader(RequestContextResolver.USER_HEADER, " alice ");
        request.addHeader(RequestContextResolver.ROLES_HEADER, "MANAGER, ,FINANCE");

        RequestContext ctx = resolver.resolve(request);

        assertThat(ctx.userId()).isEqualTo("alice");
        assertThat(ctx.tenantId()).isEqualTo(tenantId);
        assertThat(ctx.realmId()).isEqualTo(RequestContext.DEFAULT_REALM);
        assertThat(ctx.roles()).containsExactly("MANAGER", "FINANCE");
        assertThat(ctx.metadata()).isEmpty();
        assertThat(ctx.approvalBypass()).isFalse();
    }

    @Test
    @DisplayName("missing user, bad tenant and the reserved system role are refused")
    void refusesInvalidHeaders() {
        MockHttpServletRequest noUser = new MockHttpServletRequest();
        noUser.addHeader(RequestContextResolver.TENANT_HEADER, UUID.randomUUID().toString());
        assertThat(detailOf(noUser)).isEqualTo("X-User-Id header is required");

        MockHttpServletRequest badTenant = new MockHttpServletRequest();
        badTenant.addHeader(RequestContextResolver.USER_HEADER, "alice");
        badTenant.addHeader(RequestContextResolver.TENANT_HEADER, "tenant-1");
        assertThat(detailOf(badTenant)).isEqualTo("X-Tenant-Id must be a UUID");

        MockHttpServletRequest system = new MockHttpServletRequest();
        system.addHeader(RequestContextResolver.USER_HEADER, "mallory");
        system.addHeader(RequestContextResolver.TENANT_HEADER, UUID.randomUUID().toString());
        system.addHeader(RequestContextResolver.ROLES_HEADER, "SYSTEM");
        assertThat(detailOf(system)).isEqualTo("Role 'system' is reserved");
    }

    private String detailOf(MockHttpServletRequest request) {
        ProblemException ex = catchThrowableOfType(() -> resolver.resolve(request), ProblemException.class);
        assertThat(ex).isNotNull();
        assertThat(ex.getCode()).isEqualTo("REQUEST_CONTEXT_INVALID");
        return ex.getDetailMessage();
    }
}
