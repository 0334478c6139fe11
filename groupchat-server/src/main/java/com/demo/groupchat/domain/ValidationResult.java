package com.demo.groupchat.domain;

import com.demo.groupchat.exception.ChatServiceException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private boolean valid;
    private String errorMessage;
    private List<String> errors;

    public static ValidationResult success() {
        return ValidationResult.builder()
            .valid(true)
            .errors(new ArrayList<>())
            .build();
    }

    public static ValidationResult failure(List<String> errors) {
        return ValidationResult.builder()
            .valid(false)
            .errorMessage(String.join("; ", errors))
            .errors(errors)
            .build();
    }

    /**
     * Collect every failed check into one result.
     */
    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? success() : failure(errors);
    }

    /**
     * Raise {@code INVALID_ARGUMENT} with all collected errors when invalid.
     */
    public void orThrow() {
        if (!valid) {
            throw ChatServiceException.invalidArgument(errorMessage);
        }
    }
}
