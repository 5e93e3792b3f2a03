package tech.portfoliosync.sdk.dto;

import java.util.List;

/**
 * Items of one listing together with the size of the whole listing.
 *
 * <p>{@code total} is the {@code X-Total-Count} the server reported. A negative total means the
 * server sent none and is replaced by the item count. A result holding fewer items than its
 * total is incomplete.
 */
public record ListResult<T>(
    List<T> items,
    int total
) {
    public ListResult {
        items = items != null ? items : List.of();
        total = total >= 0 ? total : items.size();
    }

    /**
     * Result of an unpaged listing. A null body reads as no items.
     */
    public static <T> ListResult<T> of(List<T> items) {
        return new ListResult<>(items, -1);
    }

    public boolean isIncomplete() {
        return items.size() < total;
    }
}
