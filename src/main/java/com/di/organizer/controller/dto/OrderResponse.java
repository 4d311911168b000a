package com.di.organizer.controller.dto;

import com.di.organizer.order.ProductionOrder;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response envelope of the production order API. Only the fields relevant to the call are present.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String INFO = "info";
    public static final String HEALTHY = "healthy";

    /** success, error, info (accepted but not applied) or healthy. */
    String status;
    String message;
    /** Store outcome; absent for read-only and informational responses. */
    Boolean success;
    List<ProductionOrder> data;
    Integer count;
    /** Batch removal: orders removed. */
    Integer removed;
    /** Batch removal: distinct order numbers requested. */
    Integer requested;
    /** Upload: original file name. */
    String filename;
    /** Upload: received bytes. */
    Long size;
    /** ISO-8601 instant the response was built. */
    String timestamp;

    @JsonIgnore
    public boolean isSuccessful() {
        return SUCCESS.equals(status) || HEALTHY.equals(status) || INFO.equals(status);
    }
}
