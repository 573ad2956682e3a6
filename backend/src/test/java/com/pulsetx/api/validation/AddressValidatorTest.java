package com.pulsetx.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    @DisplayName("Valid Solana address accepted")
    void validSolanaAddress() {
        assertThat(validator.isValidAddress("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM")).isTrue();
        assertThat(validator.isValidAddress("11111111111111111111111111111111")).isTrue();
        assertThat(validator.isValidAddress("  7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU ")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(validator.isValidAddress("0OIl0OIl0OIl0OIl0OIl0OIl0OIl0OIl")).isFalse();
        assertThat(validator.isValidAddress("short")).isFalse();
    }
}
