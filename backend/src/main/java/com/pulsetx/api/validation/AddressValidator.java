package com.pulsetx.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates Solana account addresses for the pipeline API.
 */
@Component
public class AddressValidator {

    /** Solana Base58: 32-44 chars. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return SOLANA_ADDRESS.matcher(address.trim()).matches();
    }
}
