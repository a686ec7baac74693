package com.taskhub.api.api.dto;

import com.taskhub.api.domain.model.PageRequestParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.SliceImpl;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PagedResponseDto")
class PagedResponseDtoTest {

    private static String url(int page) {
        return "http://localhost/tasks?page=" + page;
    }

    @Test
    @DisplayName("a middle page links to first, previous and next")
    void middlePage() {
        PageRequestParams params = new PageRequestParams(2, 3);
        PagedResponseDto<String> dto = PagedResponseDto.from(
                new SliceImpl<>(List.of("d", "e", "f"), params.toPageable(), true), params, PagedResponseDtoTest::url);

        assertThat(dto.getData()).containsExactly("d", "e", "f");
        assertThat(dto.getMeta().getCurrentPage()).isEqualTo(2);
        assertThat(dto.getMeta().getPerPage()).isEqualTo(3);
        assertThat(dto.getMeta().getFrom()).isEqualTo(4);
        assertThat(dto.getMeta().getTo()).isEqualTo(6);
        assertThat(dto.getMeta().isHasMore()).isTrue();
        assertThat(dto.getLinks().getFirst()).isEqualTo(url(1));
        assertThat(dto.getLinks().getPrev()).isEqualTo(url(1));
        assertThat(dto.getLinks().getNext()).isEqualTo(url(3));
    }

    @Test
    @DisplayName("the last page has no next link")
    void lastPage() {
        PageRequestParams params = new PageRequestParams(1, 10);
        PagedResponseDto<String> dto = PagedResponseDto.from(
                new SliceImpl<>(List.of("a"), params.toPageable(), false), params, PagedResponseDtoTest::url);

        assertThat(dto.getLinks().getPrev()).isNull();
        assertThat(dto.getLinks().getNext()).isNull();
        assertThat(dto.getMeta().isHasMore()).isFalse();
    }

    @Test
    @DisplayName("a page past the end is empty, without from/to")
    void emptyPage() {
        PageRequestParams params = new PageRequestParams(5, 10);
        PagedResponseDto<String> dto = PagedResponseDto.from(
                new SliceImpl<>(List.of(), params.toPageable(), false), params, PagedResponseDtoTest::url);

        assertThat(dto.getData()).isEmpty();
        assertThat(dto.getMeta().getFrom()).isNull();
        assertThat(dto.getMeta().getTo()).isNull();
        assertThat(dto.getLinks().getPrev()).isEqualTo(url(4));
    }
}
