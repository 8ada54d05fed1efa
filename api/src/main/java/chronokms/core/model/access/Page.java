package chronokms.core.model.access;

import java.util.List;

/**
 * One page of a larger result.
 *
 * @param items  the items on this page
 * @param total  number of matching items before pagination
 * @param limit  requested page size
 * @param offset requested offset
 */
public record Page<T>(List<T> items, long total, int limit, int offset) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static <T> Page<T> of(List<T> all, int limit, int offset) {
        int from = Math.min(Math.max(offset, 0), all.size());
        int to = (int) Math.min((long) from + Math.max(limit, 0), all.size());
        return new Page<>(all.subList(from, to), all.size(), limit, offset);
    }
}
