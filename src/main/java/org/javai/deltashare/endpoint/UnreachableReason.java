package org.javai.deltashare.endpoint;

/**
 * Which step of the liveness check failed.
 */
public enum UnreachableReason {
    DNS_RESOLUTION_FAILED,
    CONNECTION_REFUSED,
    TIMED_OUT,
    TLS_FAILURE,
    PROBE_FAILED
}
