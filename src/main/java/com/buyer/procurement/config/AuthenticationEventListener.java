package com.buyer.procurement.config;

import com.buyer.procurement.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.stereotype.Component;

@Component
public class AuthenticationEventListener {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationEventListener.class);

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    // HTTP Basic authenticates every request, so successes only go to the debug log
    @EventListener
    public void onSuccess(AuthenticationSuccessEvent event) {
        logger.debug("API request authenticated as {}", event.getAuthentication().getName());
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String error = event.getException().getMessage();
        auditService.log("API_AUTH_FAILURE", "Failed authentication for: " + username + " - " + error);
    }
}
