package com.scholary.langtag.api;

/** Returned when a scan is accepted; poll {@code /api/scans/{jobId}} for its status. */
public record AsyncJobResponse(String jobId) {}
