package com.questrail.iso8583.api;

/**
 * Application callback for an inbound request.
 *
 * <p>The handler receives the parsed request and mutates it in place into the
 * response, typically by changing the MTI and setting a response code. The
 * message is composed and written back once the handler returns.</p>
 */
@FunctionalInterface
public interface IsoHandler
{
    void handle(IsoMessage message);
}
