package com.buyer.procurement.service;

import com.buyer.procurement.model.AuditLog;
import com.buyer.procurement.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(String action, String details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAction(action);
            entry.setDetails(details);

            var auth = SecurityContextHolder.getContext().getAuthentication();
            entry.setUsername(auth != null ? auth.getName() : "SYSTEM");

            auditLogRepository.save(entry);
        } catch (Exception e) {
            // A failed audit write must not roll back the change it describes
            logger.warn("Failed to write audit log for {}: {}", action, e.getMessage());
        }
    }
}
