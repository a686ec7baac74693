package com.taskhub.api.domain.model;

import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.exception.RequestValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PageRequestParams")
class PageRequestParamsTest {

    private final TaskHubProperties.Pagination settings = new TaskHubProperties.Pagination();

    @Test
    @DisplayName("defaults to the first page of ten")
    void defaults() {
        PageRequestParams params = PageRequestParams.of(null, "", settings);

        assertThat(params).isEqualTo(new PageRequestParams(1, 10));
    }

    @Test
    @DisplayName("maps a 1-based page to a 0-based pageable sorted by id")
    void toPageable() {
        Pageable pageable = PageRequestParams.of("3", "25", settings).toPageable();

        assertThat(pageable.getPageNumber()).isEqualTo(2);
        assertThat(pageable.getPageSize()).isEqualTo(25);
        assertThat(pageable.getSort()).isEqualTo(Sort.by(Sort.Direction.ASC, "id"));
    }

    @ParameterizedTest(name = "page={0}, page_size={1} -> error on {2}")
    @CsvSource({
            "0,   10,  page",
            "-1,  10,  page",
            "abc, 10,  page",
            "1,   0,   page_size",
            "1,   101, page_size",
            "1,   x,   page_size"
    })
    @DisplayName("rejects out-of-range and non-numeric values")
    void rejectsInvalid(String page, String pageSize, String field) {
        assertThatThrownBy(() -> PageRequestParams.of(page, pageSize, settings))
                .isInstanceOfSatisfying(RequestValidationException.class, e ->
                        assertThat(e.getErrors().hasField(field)).isTrue());
    }

    @Test
    @DisplayName("reports both fields when both are invalid")
    void reportsBoth() {
        assertThatThrownBy(() -> PageRequestParams.of("0", "1000", settings))
                .isInstanceOfSatisfying(RequestValidationException.class, e ->
                        assertThat(e.getErrors().asMap()).containsOnlyKeys("page", "page_size"));
    }
}
