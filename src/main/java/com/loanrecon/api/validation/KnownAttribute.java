package com.loanrecon.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Name of an attribute configured under loanrecon.reconciliation.attributes.
 * Error code for API: INVALID_ATTRIBUTE.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = KnownAttributeValidator.class)
public @interface KnownAttribute {

    String message() default "INVALID_ATTRIBUTE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
