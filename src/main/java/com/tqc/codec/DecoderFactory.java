package com.tqc.codec;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.tqc.config.TqcConfig;

import java.io.InputStream;

@Singleton
public class DecoderFactory {

    private final TqcConfig config;

    @Inject
    public DecoderFactory(TqcConfig config) {
        this.config = config;
    }

    public Decoder create(InputStream in) {
        return new FrameDecoder(in, config.getDefaultMsgSize(), config.getReadBufferSize());
    }

    public FrameEncoder encoder() {
        return new FrameEncoder(config.getMaxChunkSize());
    }
}
