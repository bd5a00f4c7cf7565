/**
 * Public application-facing types: the {@link com.questrail.iso8583.api.IsoMessage}
 * capability set and the {@link com.questrail.iso8583.api.IsoHandler} callback.
 */
package com.questrail.iso8583.api;
