package com.questrail.peripheral.api;

/**
 * Whether the platform allows this process to use the radio.
 */
public enum AuthorizationState
{
    NOT_DETERMINED,
    RESTRICTED,
    DENIED,
    ALLOWED_ALWAYS
}
