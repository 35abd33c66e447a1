package com.warden.sandbox.relay;

/**
 * Why a call through the router failed. Callers retry {@link #UNREACHABLE} and
 * {@link #TIMEOUT}; {@link #REJECTED} means the sandbox or router answered with an error.
 */
public enum RelayFailure {
    TIMEOUT,
    UNREACHABLE,
    REJECTED
}
