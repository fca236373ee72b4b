package com.tqc.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Decodes RPC response frames from a broker or master connection.
 *
 * <p>Frame layout, all integers big-endian:
 * <pre>
 *   int token       always {@link #RPC_PROTOCOL_BEGIN_TOKEN}
 *   int serialNo
 *   int listSize    number of body chunks
 *   listSize x { int length; byte[length] data }
 * </pre>
 * The chunks are concatenated into one response body.
 *
 * <p>One decoder per connection. Instances are not thread-safe.
 */
public class FrameDecoder implements Decoder {

    private static final Logger log = LoggerFactory.getLogger(FrameDecoder.class);

    public static final int RPC_PROTOCOL_BEGIN_TOKEN = 0xFF7FF4FE;
    public static final int DEFAULT_MSG_SIZE = 4096;
    public static final int DEFAULT_READ_BUFFER_SIZE = 128 * 1024;

    static final int BEGIN_TOKEN_LEN = 4;
    static final int SERIAL_NO_LEN = 4;
    static final int FRAME_HEAD_LEN = BEGIN_TOKEN_LEN + SERIAL_NO_LEN;
    static final int LIST_SIZE_LEN = 4;
    static final int DATA_LEN = 4;

    private final InputStream reader;
    private final byte[] sizeBuf = new byte[DATA_LEN];
    private byte[] msg;

    public FrameDecoder(InputStream in) {
        this(in, DEFAULT_MSG_SIZE, DEFAULT_READ_BUFFER_SIZE);
    }

    public FrameDecoder(InputStream in, int defaultMsgSize, int readBufferSize) {
        if (in == null) {
            throw new IllegalArgumentException("Input stream must not be null");
        }
        if (defaultMsgSize < FRAME_HEAD_LEN + LIST_SIZE_LEN) {
            throw new IllegalArgumentException("Message buffer too small: " + defaultMsgSize);
        }
        this.reader = new BufferedInputStream(in, readBufferSize);
        this.msg = new byte[defaultMsgSize];
    }

    @Override
    public TransportResponse decode() throws IOException {
        int num = readFully(msg, 0, FRAME_HEAD_LEN);
        if (num != FRAME_HEAD_LEN) {
            throw fail(DecodeException.Reason.SHORT_HEADER,
                    "read frame header num invalid: " + num);
        }
        int token = readInt(msg, 0);
        if (token != RPC_PROTOCOL_BEGIN_TOKEN) {
            throw fail(DecodeException.Reason.TOKEN_MISMATCH,
                    "rpc protocol begin token not match: 0x" + Integer.toHexString(token));
        }

        num = readFully(msg, FRAME_HEAD_LEN, LIST_SIZE_LEN);
        if (num != LIST_SIZE_LEN) {
            throw fail(DecodeException.Reason.SHORT_LIST_SIZE,
                    "read invalid list size num: " + num);
        }
        int listSize = readInt(msg, FRAME_HEAD_LEN);
        if (listSize < 0) {
            throw fail(DecodeException.Reason.INVALID_LIST_SIZE,
                    "invalid list size: " + listSize);
        }

        // chunk data overwrites the list size field, header bytes stay in place
        int totalLen = FRAME_HEAD_LEN;
        for (int i = 0; i < listSize; i++) {
            num = readFully(sizeBuf, 0, DATA_LEN);
            if (num != DATA_LEN) {
                throw fail(DecodeException.Reason.SHORT_CHUNK_LENGTH,
                        "read invalid size of chunk " + i + ": " + num);
            }
            int s = readInt(sizeBuf, 0);
            if (s < 0 || (long) totalLen + s > Integer.MAX_VALUE - 8) {
                throw fail(DecodeException.Reason.INVALID_CHUNK_LENGTH,
                        "invalid length of chunk " + i + ": " + s);
            }
            if (totalLen + s > msg.length) {
                msg = Arrays.copyOf(msg, totalLen + s);
            }
            num = readFully(msg, totalLen, s);
            if (num != s) {
                throw fail(DecodeException.Reason.SHORT_CHUNK_BODY,
                        "read invalid data of chunk " + i + ": " + num + " of " + s);
            }
            totalLen += s;
        }

        long serialNo = Integer.toUnsignedLong(readInt(msg, BEGIN_TOKEN_LEN));
        return new FrameResponse(serialNo, Arrays.copyOfRange(msg, FRAME_HEAD_LEN, totalLen));
    }

    int getBufferCapacity() {
        return msg.length;
    }

    /**
     * Reads until {@code len} bytes arrived or the stream ended.
     *
     * @return the number of bytes actually read
     */
    private int readFully(byte[] buf, int offset, int len) throws IOException {
        int totalRead = 0;
        while (totalRead < len) {
            int read = reader.read(buf, offset + totalRead, len - totalRead);
            if (read == -1) {
                break;
            }
            totalRead += read;
        }
        return totalRead;
    }

    private static int readInt(byte[] buf, int offset) {
        return ByteBuffer.wrap(buf, offset, 4).getInt();
    }

    private static DecodeException fail(DecodeException.Reason reason, String message) {
        log.warn("Frame decode failed ({}): {}", reason, message);
        return new DecodeException(reason, "framer: " + message);
    }
}
