package com.tqc.codec;

import java.io.IOException;

public interface Decoder {

    /**
     * Blocks until one complete response has been read from the underlying stream.
     *
     * @throws DecodeException if the bytes read do not form a valid frame
     * @throws IOException     if the stream itself fails
     */
    TransportResponse decode() throws IOException;
}
