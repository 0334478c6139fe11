package com.demo.groupchat.service;

import com.demo.groupchat.domain.ValidationResult;
import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registration input checks.
 *
 * Handles:
 * - required userId / displayName / identity field
 * - email format
 * - phone parsing and E.164 normalization
 */
@Component
@Slf4j
public class UserValidator {

    private static final Pattern EMAIL = Pattern.compile(
            "^(([^<>()\\[\\]\\\\.,;:\\s@\"]+(\\.[^<>()\\[\\]\\\\.,;:\\s@\"]+)*)|(\".+\"))"
                    + "@((\\[[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}\\])|(([a-zA-Z\\-0-9]+\\.)+[a-zA-Z]{2,}))$");

    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();
    private final String defaultRegion;

    public UserValidator(@Value("${chat.phone.default-region:US}") String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    public ValidationResult validateEmailRegistration(String userId, String email, String displayName) {
        List<String> errors = requiredFields(userId, displayName);
        if (!StringUtils.hasText(email)) {
            errors.add("email is required");
        } else if (!isValidEmail(email)) {
            errors.add("Invalid email " + email);
        }
        return ValidationResult.of(errors);
    }

    public ValidationResult validatePhoneRegistration(String userId, String phoneNumber, String displayName) {
        List<String> errors = requiredFields(userId, displayName);
        if (!StringUtils.hasText(phoneNumber)) {
            errors.add("phoneNumber is required");
        } else if (normalizePhoneNumber(phoneNumber).isEmpty()) {
            errors.add("Invalid phone number " + phoneNumber);
        }
        return ValidationResult.of(errors);
    }

    public boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email.toLowerCase(Locale.ROOT)).matches();
    }

    /** Lower-cased, trimmed email used as the stored and indexed value. */
    public String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * E.164 form of a phone number, or empty when it does not parse to a valid number.
     * Numbers without a country code are read in the default region.
     */
    public Optional<String> normalizePhoneNumber(String phoneNumber) {
        if (!StringUtils.hasText(phoneNumber)) {
            return Optional.empty();
        }
        try {
            Phonenumber.PhoneNumber parsed = phoneNumberUtil.parse(phoneNumber, defaultRegion);
            if (!phoneNumberUtil.isValidNumber(parsed)) {
                return Optional.empty();
            }
            return Optional.of(phoneNumberUtil.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164));
        } catch (NumberParseException e) {
            log.debug("Unparseable phone number: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> requiredFields(String userId, String displayName) {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(userId)) {
            errors.add("userId is required");
        }
        if (!StringUtils.hasText(displayName)) {
            errors.add("displayName is required");
        }
        return errors;
    }
}
