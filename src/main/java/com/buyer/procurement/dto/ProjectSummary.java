package com.buyer.procurement.dto;

import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProjectSummary(
        Long id,
        String name,
        BigDecimal budget,
        LocalDate deadline,
        ProjectStatus status) {

    public static ProjectSummary of(Project project) {
        return new ProjectSummary(project.getId(), project.getName(), project.getBudget(),
                project.getDeadline(), project.getStatus());
    }
}
