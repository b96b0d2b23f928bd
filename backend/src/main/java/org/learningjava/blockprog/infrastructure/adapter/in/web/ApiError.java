package org.learningjava.blockprog.infrastructure.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        int status,
        String error,
        String code,
        String message,
        String path,
        Instant timestamp
) {}
