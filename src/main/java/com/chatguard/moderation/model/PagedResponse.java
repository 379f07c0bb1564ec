package com.chatguard.moderation.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * One page of results, newest first, with a timestamp cursor for the next page.
 */
public record PagedResponse<T>(List<T> data, boolean hasMore, String nextCursor) {

    /**
     * Cut a list already sorted newest first down to {@code limit} entries.
     */
    public static <T> PagedResponse<T> of(List<T> sorted, int limit, ToLongFunction<T> timestamp) {
        boolean hasMore = sorted.size() > limit;
        List<T> page = hasMore ? new ArrayList<>(sorted.subList(0, limit)) : sorted;
        String nextCursor = hasMore ? String.valueOf(timestamp.applyAsLong(page.get(page.size() - 1))) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }
}
