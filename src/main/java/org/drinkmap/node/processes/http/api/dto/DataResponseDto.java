package org.drinkmap.node.processes.http.api.dto;

import java.util.List;

/**
 * Envelope for list responses: {@code {"data": [...]}}.
 */
public record DataResponseDto<T>(List<T> data) {

    public static <T> DataResponseDto<T> of(final List<T> data) {
        return new DataResponseDto<>(data);
    }
}
