package com.taskhub.api.domain.validation;

import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-keyed validation messages, in the order the rules were evaluated.
 */
public final class FieldErrors {

    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    public static FieldErrors of(String field, String message) {
        return new FieldErrors().add(field, message);
    }

    public static FieldErrors from(BindingResult bindingResult) {
        FieldErrors fieldErrors = new FieldErrors();
        for (FieldError error : bindingResult.getFieldErrors()) {
            fieldErrors.add(error.getField(), error.getDefaultMessage());
        }
        bindingResult.getGlobalErrors()
                .forEach(error -> fieldErrors.add(error.getObjectName(), error.getDefaultMessage()));
        return fieldErrors;
    }

    public FieldErrors add(String field, String message) {
        List<String> messages = errors.computeIfAbsent(field, key -> new ArrayList<>());
        if (!messages.contains(message)) {
            messages.add(message);
        }
        return this;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public boolean hasField(String field) {
        return errors.containsKey(field);
    }

    public String firstMessage() {
        return errors.values().stream()
                .flatMap(List::stream)
                .findFirst()
                .orElse("The given data was invalid.");
    }

    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return errors.toString();
    }
}
