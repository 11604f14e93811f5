package com.monsoonfire.notification.api;

public record ApiErrorResponse(String code, String message) {}
