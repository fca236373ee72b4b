package com.tqc.codec;

public final class FrameResponse implements TransportResponse {

    private final long serialNo;
    private final byte[] responseBuf;

    public FrameResponse(long serialNo, byte[] responseBuf) {
        this.serialNo = serialNo;
        this.responseBuf = responseBuf;
    }

    @Override
    public long getSerialNo() {
        return serialNo;
    }

    @Override
    public byte[] getResponseBuf() {
        return responseBuf;
    }

    @Override
    public String toString() {
        return "FrameResponse{serialNo=" + serialNo + ", length=" + responseBuf.length + "}";
    }
}
