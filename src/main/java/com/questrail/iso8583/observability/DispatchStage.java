package com.questrail.iso8583.observability;

/**
 * Point in a connection's lifecycle at which a failure occurred.
 */
public enum DispatchStage {
    ACCEPT,
    READ,
    DECODE,
    ROUTE,
    HANDLE,
    ENCODE,
    WRITE
}
