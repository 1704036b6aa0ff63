package com.tracura.plm.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Budget bucket within a phase.
 */
public record Department(
    Optional<String> id,
    String projectId,
    String phaseId,
    String name,
    ContractorMode contractorMode,
    List<DepartmentLineItem> lineItems
) {
    public Department {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (phaseId == null || phaseId.isBlank()) {
            throw new IllegalArgumentException("phaseId is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        id = id != null ? id : Optional.empty();
        contractorMode = Objects.requireNonNullElse(contractorMode, ContractorMode.LABOUR_ONLY);
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }

    public static Department of(
        String projectId, String phaseId, String name, ContractorMode mode, List<DepartmentLineItem> lineItems
    ) {
        return new Department(Optional.empty(), projectId, phaseId, name, mode, lineItems);
    }

    public Department withId(String newId) {
        return new Department(Optional.ofNullable(newId), projectId, phaseId, name, contractorMode, lineItems);
    }

    /**
     * Sum of quantity x unit price over all line items.
     */
    public BigDecimal allocatedBudget() {
        return lineItems.stream()
            .map(DepartmentLineItem::total)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public String key() {
        return DepartmentKey.of(phaseId, name);
    }

    public boolean hasSameName(String otherName) {
        return otherName != null && name.trim().equalsIgnoreCase(otherName.trim());
    }
}
