package com.customerapi.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a collection plus the paging metadata of the whole collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagingDto<T> {

    private List<T> collection;

    private int pageIndex;          // 1-based
    private int pageSize;
    private long totalRecords;
    private int totalPages;

    public static <T> PagingDto<T> of(List<T> collection, int pageIndex, int pageSize, long totalRecords) {
        return PagingDto.<T>builder()
                .collection(collection)
                .pageIndex(pageIndex)
                .pageSize(pageSize)
                .totalRecords(totalRecords)
                .totalPages(totalPages(totalRecords, pageSize))
                .build();
    }

    /**
     * ceil(totalRecords / pageSize); zero when there are no records.
     */
    public static int totalPages(long totalRecords, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        if (totalRecords <= 0) {
            return 0;
        }
        return (int) ((totalRecords + pageSize - 1) / pageSize);
    }
}
