package com.pulsetx.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Jakarta Bean Validation adapter over AddressValidator. Blank values are left to @NotBlank.
 */
@Component
public class WalletAddressValidator implements ConstraintValidator<WalletAddress, String> {

    private final AddressValidator addressValidator;

    public WalletAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return addressValidator.isValidAddress(value);
    }
}
