package com.tqc.codec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Writes payloads in the frame layout read by {@link FrameDecoder}, splitting the
 * body into chunks of at most {@code maxChunkSize} bytes.
 */
public class FrameEncoder {

    public static final int DEFAULT_MAX_CHUNK_SIZE = 8192;

    private final int maxChunkSize;

    public FrameEncoder() {
        this(DEFAULT_MAX_CHUNK_SIZE);
    }

    public FrameEncoder(int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("Invalid maxChunkSize: " + maxChunkSize);
        }
        this.maxChunkSize = maxChunkSize;
    }

    public byte[] encode(long serialNo, byte[] body) {
        byte[] payload = body == null ? new byte[0] : body;
        int chunks = (payload.length + maxChunkSize - 1) / maxChunkSize;

        ByteBuffer buffer = ByteBuffer.allocate(
                FrameDecoder.FRAME_HEAD_LEN + FrameDecoder.LIST_SIZE_LEN
                        + chunks * FrameDecoder.DATA_LEN + payload.length);
        buffer.putInt(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN);
        buffer.putInt((int) serialNo);
        buffer.putInt(chunks);
        for (int offset = 0; offset < payload.length; offset += maxChunkSize) {
            int len = Math.min(maxChunkSize, payload.length - offset);
            buffer.putInt(len);
            buffer.put(payload, offset, len);
        }
        return buffer.array();
    }

    public void write(OutputStream out, long serialNo, byte[] body) throws IOException {
        out.write(encode(serialNo, body));
        out.flush();
    }
}
