package com.myscrollr.delivery.model.dto;

import java.util.List;

/**
 * Response of the CDC webhook: the deduplicated set of users the batch resolved to.
 */
public record RouteResponse(List<String> users) {}
