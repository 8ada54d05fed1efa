package chronokms.adapter.in.dto;

import java.util.List;
import java.util.function.Function;

import chronokms.core.model.access.Page;

/**
 * One page of results with pagination info.
 */
public record PageDto<T>(List<T> items, long total, int limit, int offset, boolean hasMore) {

    public static <M, T> PageDto<T> fromModel(Page<M> page, Function<M, T> mapper) {
        List<T> items = page.items().stream().map(mapper).toList();
        return new PageDto<>(
                items, page.total(), page.limit(), page.offset(), page.offset() + items.size() < page.total());
    }
}
