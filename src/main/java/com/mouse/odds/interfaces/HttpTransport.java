package com.mouse.odds.interfaces;

import com.mouse.odds.model.ApiResponse;
import okhttp3.Request;

import java.io.IOException;

/**
 * One physical network attempt. Any HTTP status is returned as a response; only failures
 * without a response (connect errors, timeouts) are thrown.
 */
@FunctionalInterface
public interface HttpTransport {

    ApiResponse send(Request request) throws IOException;
}
