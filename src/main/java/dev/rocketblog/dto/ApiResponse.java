package dev.rocketblog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Success envelope: {@code {"success": true, "data": ..., "meta": {...}}}.
 * {@code meta} is omitted for single-resource responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    @Builder.Default
    private boolean success = true;

    private T data;

    private PageMeta meta;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> withMeta(T data, PageMeta meta) {
        return ApiResponse.<T>builder()
                .data(data)
                .meta(meta)
                .build();
    }
}
