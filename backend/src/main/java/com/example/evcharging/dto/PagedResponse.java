package com.example.evcharging.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One page of a larger, offset-addressed result list")
public class PagedResponse<T> {

    @Schema(description = "Total number of items")
    private int total;

    @Schema(description = "Page size actually applied")
    private int limit;

    @Schema(description = "Offset of the first item in this page")
    private int offset;

    @Schema(description = "Whether items remain after this page")
    private boolean hasMore;

    @Schema(description = "Offset to request for the next page")
    private int nextOffset;

    @Schema(description = "Items of this page")
    private List<T> items;

    public static <T> PagedResponse<T> of(List<T> all, int limit, int offset) {
        int from = Math.min(offset, all.size());
        int to = Math.min(from + limit, all.size());
        return new PagedResponse<>(all.size(), limit, offset, to < all.size(), to, List.copyOf(all.subList(from, to)));
    }
}
