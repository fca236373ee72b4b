package com.tqc.codec;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.*;

public class FrameDecoderTest {

    private static byte[] frame(int token, int serialNo, byte[]... chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer head = ByteBuffer.allocate(12);
        head.putInt(token).putInt(serialNo).putInt(chunks.length);
        out.write(head.array(), 0, 12);
        for (byte[] chunk : chunks) {
            out.write(ByteBuffer.allocate(4).putInt(chunk.length).array(), 0, 4);
            out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static DecodeException expectFailure(byte[] bytes) throws IOException {
        FrameDecoder decoder = new FrameDecoder(new ByteArrayInputStream(bytes));
        try {
            decoder.decode();
            fail("Expected DecodeException");
            return null;
        } catch (DecodeException e) {
            return e;
        }
    }

    @Test
    public void testDecode_concatenatesChunks() throws IOException {
        byte[] bytes = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 42, ascii("abc"), ascii("de"));
        assertEquals((byte) 0xFF, bytes[0]);
        assertEquals((byte) 0x7F, bytes[1]);
        assertEquals((byte) 0xF4, bytes[2]);
        assertEquals((byte) 0xFE, bytes[3]);

        TransportResponse response = new FrameDecoder(new ByteArrayInputStream(bytes)).decode();

        assertEquals(42, response.getSerialNo());
        assertEquals("abcde", new String(response.getResponseBuf(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testDecode_noChunksGivesEmptyBody() throws IOException {
        byte[] bytes = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 7);
        TransportResponse response = new FrameDecoder(new ByteArrayInputStream(bytes)).decode();
        assertEquals(7, response.getSerialNo());
        assertEquals(0, response.getResponseBuf().length);
    }

    @Test
    public void testDecode_serialNoIsUnsigned() throws IOException {
        byte[] bytes = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 0xFFFFFFFF, ascii("x"));
        TransportResponse response = new FrameDecoder(new ByteArrayInputStream(bytes)).decode();
        assertEquals(4294967295L, response.getSerialNo());
    }

    @Test
    public void testDecode_consecutiveFramesOnOneStream() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 1, ascii("first")));
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 2, ascii("sec"), ascii("ond")));
        FrameDecoder decoder = new FrameDecoder(new ByteArrayInputStream(out.toByteArray()));

        TransportResponse first = decoder.decode();
        TransportResponse second = decoder.decode();

        assertEquals(1, first.getSerialNo());
        assertEquals("first", new String(first.getResponseBuf(), StandardCharsets.US_ASCII));
        assertEquals(2, second.getSerialNo());
        assertEquals("second", new String(second.getResponseBuf(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testDecode_growsBufferToFitLargeFrame() throws IOException {
        byte[] big1 = new byte[20];
        byte[] big2 = new byte[30];
        Arrays.fill(big1, (byte) 1);
        Arrays.fill(big2, (byte) 2);
        byte[] bytes = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 9, big1, big2);
        FrameDecoder decoder = new FrameDecoder(new ByteArrayInputStream(bytes), 16, 64);

        TransportResponse response = decoder.decode();

        byte[] body = response.getResponseBuf();
        assertEquals(50, body.length);
        assertEquals(1, body[0]);
        assertEquals(1, body[19]);
        assertEquals(2, body[20]);
        assertEquals(2, body[49]);
        assertEquals(8 + 50, decoder.getBufferCapacity());
    }

    @Test
    public void testDecode_bufferNotShrunkForSmallerFrames() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 1, new byte[100]));
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 2, ascii("ab")));
        FrameDecoder decoder = new FrameDecoder(new ByteArrayInputStream(out.toByteArray()), 16, 64);

        decoder.decode();
        int capacity = decoder.getBufferCapacity();
        TransportResponse second = decoder.decode();

        assertEquals(capacity, decoder.getBufferCapacity());
        assertEquals("ab", new String(second.getResponseBuf(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testDecode_bodyIsIndependentOfScratchBuffer() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 1, ascii("keep")));
        out.write(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 2, ascii("over")));
        FrameDecoder decoder = new FrameDecoder(new ByteArrayInputStream(out.toByteArray()));

        TransportResponse first = decoder.decode();
        decoder.decode();

        assertEquals("keep", new String(first.getResponseBuf(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testDecode_handlesTrickledReads() throws IOException {
        byte[] bytes = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 5, ascii("slow"), ascii("read"));
        InputStream oneByteAtATime = new ByteArrayInputStream(bytes) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                return super.read(b, off, Math.min(len, 1));
            }
        };
        TransportResponse response = new FrameDecoder(oneByteAtATime, 4096, 1).decode();
        assertEquals("slowread", new String(response.getResponseBuf(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testDecode_tokenMismatch() throws IOException {
        DecodeException e = expectFailure(frame(0x12345678, 42, ascii("abc")));
        assertEquals(DecodeException.Reason.TOKEN_MISMATCH, e.getReason());
    }

    @Test
    public void testDecode_emptyStreamIsShortHeader() throws IOException {
        DecodeException e = expectFailure(new byte[0]);
        assertEquals(DecodeException.Reason.SHORT_HEADER, e.getReason());
    }

    @Test
    public void testDecode_truncatedHeader() throws IOException {
        byte[] bytes = Arrays.copyOf(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 42), 6);
        assertEquals(DecodeException.Reason.SHORT_HEADER, expectFailure(bytes).getReason());
    }

    @Test
    public void testDecode_truncatedListSize() throws IOException {
        byte[] bytes = Arrays.copyOf(frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 42), 10);
        assertEquals(DecodeException.Reason.SHORT_LIST_SIZE, expectFailure(bytes).getReason());
    }

    @Test
    public void testDecode_truncatedChunkLength() throws IOException {
        byte[] full = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 42, ascii("abc"), ascii("de"));
        // header(12) + len(4) + "abc"(3) + 2 bytes of the second length
        byte[] bytes = Arrays.copyOf(full, 21);
        assertEquals(DecodeException.Reason.SHORT_CHUNK_LENGTH, expectFailure(bytes).getReason());
    }

    @Test
    public void testDecode_truncatedMidChunk() throws IOException {
        byte[] full = frame(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN, 42, ascii("abc"), ascii("de"));
        byte[] bytes = Arrays.copyOf(full, full.length - 1);
        DecodeException e = expectFailure(bytes);
        assertEquals(DecodeException.Reason.SHORT_CHUNK_BODY, e.getReason());
        assertTrue(e.getMessage().startsWith("framer:"));
    }

    @Test
    public void testDecode_negativeChunkLength() throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(16);
        buf.putInt(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN).putInt(1).putInt(1).putInt(-5);
        assertEquals(DecodeException.Reason.INVALID_CHUNK_LENGTH, expectFailure(buf.array()).getReason());
    }

    @Test
    public void testDecode_negativeListSize() throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(12);
        buf.putInt(FrameDecoder.RPC_PROTOCOL_BEGIN_TOKEN).putInt(1).putInt(-1);
        assertEquals(DecodeException.Reason.INVALID_LIST_SIZE, expectFailure(buf.array()).getReason());
    }

    @Test
    public void testDecode_streamErrorPropagates() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                throw new IOException("connection reset");
            }
        };
        try {
            new FrameDecoder(broken).decode();
            fail("Expected IOException");
        } catch (DecodeException e) {
            fail("Stream failure must not be reported as a decode failure");
        } catch (IOException e) {
            assertEquals("connection reset", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_rejectsTinyBuffer() {
        new FrameDecoder(new ByteArrayInputStream(new byte[0]), 8, 64);
    }
}
