package org.apiwatch.rest.auth;

import io.undertow.util.AttachmentKey;

/**
 * Tenant key of the current request. Keys are issued elsewhere; only ownership is checked here.
 */
public class TenantContext {

    public static final AttachmentKey<TenantContext> ATTACHMENT_KEY = AttachmentKey.create(TenantContext.class);

    private final String apiKey;

    public TenantContext(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKey() { return apiKey; }
}
