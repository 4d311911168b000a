package com.di.organizer.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of create and replace calls: {@code {"data": {"Priority": 2, "Production_order": "...", ...}}}.
 * Field values are loosely typed; the store normalizes them.
 */
@Data
@NoArgsConstructor
public class OrderDataRequest {

    @NotNull(message = "request body must contain 'data'")
    private Map<String, Object> data;
}
