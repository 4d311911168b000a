package com.di.organizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the batch removal call. Accepts both camelCase and snake_case
 * ({@code productionOrders} or {@code production_orders}).
 */
@Data
@NoArgsConstructor
public class BatchDeleteRequest {

    @NotNull(message = "request body must contain 'productionOrders'")
    @JsonAlias("production_orders")
    private List<String> productionOrders;
}
