package com.riskradar.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Bean Validation adapter for {@link EvmAddress}; format rules live in AddressValidator.
 */
@Component
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private final AddressValidator addressValidator;

    public EvmAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || addressValidator.isValidAddress(value);
    }
}
