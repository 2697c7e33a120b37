package com.neuroshield.api.validation;

import com.neuroshield.common.Addresses;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Bean Validation adapter over {@link Addresses#isWellFormed(String)}.
 */
public class WalletAddressValidator implements ConstraintValidator<WalletAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return Addresses.isWellFormed(value);
    }
}
