package com.taskhub.api.domain.model;

import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.exception.RequestValidationException;
import com.taskhub.api.domain.validation.FieldErrors;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Validated 1-based page coordinates taken from the query string.
 */
public record PageRequestParams(int page, int pageSize) {

    public static PageRequestParams of(String rawPage, String rawPageSize, TaskHubProperties.Pagination settings) {
        FieldErrors errors = new FieldErrors();

        int page = parse("page", rawPage, 1, errors);
        if (!errors.hasField("page") && page < 1) {
            errors.add("page", "The page field must be at least 1.");
        }

        int pageSize = parse("page_size", rawPageSize, settings.getDefaultPageSize(), errors);
        if (!errors.hasField("page_size") && (pageSize < 1 || pageSize > settings.getMaxPageSize())) {
            errors.add("page_size", "The page_size field must be between 1 and " + settings.getMaxPageSize() + ".");
        }

        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
        return new PageRequestParams(page, pageSize);
    }

    /**
     * Insertion order: ascending id.
     */
    public Pageable toPageable() {
        return PageRequest.of(page - 1, pageSize, Sort.by(Sort.Direction.ASC, "id"));
    }

    private static int parse(String field, String raw, int defaultValue, FieldErrors errors) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            errors.add(field, "The " + field + " field must be an integer.");
            return defaultValue;
        }
    }
}
