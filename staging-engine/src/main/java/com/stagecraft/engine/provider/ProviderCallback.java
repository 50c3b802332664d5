package com.stagecraft.engine.provider;

/**
 * A parsed webhook: which job it is about and what state it reports.
 */
public record ProviderCallback(String jobHandle, JobStatus status) {}
