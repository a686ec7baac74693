package com.taskhub.api.api.dto;

import com.taskhub.api.domain.model.PageRequestParams;
import org.springframework.data.domain.Slice;

import java.util.List;
import java.util.function.IntFunction;

/**
 * Simple-pagination envelope: items, position metadata and navigation links, without a total count.
 *
 * Example:
 * {
 *   "data": [...],
 *   "meta": {"current_page": 2, "per_page": 10, "from": 11, "to": 20, "has_more": true},
 *   "links": {"first": ".../tasks?page=1", "prev": ".../tasks?page=1", "next": ".../tasks?page=3"}
 * }
 */
public class PagedResponseDto<T> {

    private final List<T> data;
    private final Meta meta;
    private final Links links;

    public PagedResponseDto(List<T> data, Meta meta, Links links) {
        this.data = data;
        this.meta = meta;
        this.links = links;
    }

    /**
     * @param pageUrl builds the absolute URL of a given 1-based page number
     */
    public static <T> PagedResponseDto<T> from(Slice<T> slice,
                                               PageRequestParams params,
                                               IntFunction<String> pageUrl) {
        List<T> items = slice.getContent();
        int page = params.page();
        Integer from = items.isEmpty() ? null : (page - 1) * params.pageSize() + 1;
        Integer to = items.isEmpty() ? null : from + items.size() - 1;

        Meta meta = new Meta(page, params.pageSize(), from, to, slice.hasNext());
        Links links = new Links(
                pageUrl.apply(1),
                page > 1 ? pageUrl.apply(page - 1) : null,
                slice.hasNext() ? pageUrl.apply(page + 1) : null
        );
        return new PagedResponseDto<>(items, meta, links);
    }

    public List<T> getData() {
        return data;
    }

    public Meta getMeta() {
        return meta;
    }

    public Links getLinks() {
        return links;
    }

    public static class Meta {
        private final int currentPage;
        private final int perPage;
        private final Integer from;
        private final Integer to;
        private final boolean hasMore;

        public Meta(int currentPage, int perPage, Integer from, Integer to, boolean hasMore) {
            this.currentPage = currentPage;
            this.perPage = perPage;
            this.from = from;
            this.to = to;
            this.hasMore = hasMore;
        }

        public int getCurrentPage() {
            return currentPage;
        }

        public int getPerPage() {
            return perPage;
        }

        public Integer getFrom() {
            return from;
        }

        public Integer getTo() {
            return to;
        }

        public boolean isHasMore() {
            return hasMore;
        }
    }

    public static class Links {
        private final String first;
        private final String prev;
        private final String next;

        public Links(String first, String prev, String next) {
            this.first = first;
            this.prev = prev;
            this.next = next;
        }

        public String getFirst() {
            return first;
        }

        public String getPrev() {
            return prev;
        }

        public String getNext() {
            return next;
        }
    }
}
