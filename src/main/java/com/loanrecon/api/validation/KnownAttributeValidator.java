package com.loanrecon.api.validation;

import com.loanrecon.reconciliation.config.ReconciliationProperties;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Blank values pass here; {@code @NotBlank} reports them.
 */
@Component
public class KnownAttributeValidator implements ConstraintValidator<KnownAttribute, String> {

    private final ReconciliationProperties reconciliationProperties;

    public KnownAttributeValidator(ReconciliationProperties reconciliationProperties) {
        this.reconciliationProperties = reconciliationProperties;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return reconciliationProperties.getAttributes().stream()
                .anyMatch(def -> value.trim().equals(def.getName()));
    }
}
