package com.tqc.codec;

public interface TransportResponse {

    /**
     * Serial number of the request this response answers, as an unsigned 32-bit value.
     */
    long getSerialNo();

    /**
     * Concatenated body chunks of the frame.
     */
    byte[] getResponseBuf();
}
