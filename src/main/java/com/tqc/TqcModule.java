package com.tqc;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.tqc.cache.RemoteDataCache;
import com.tqc.codec.DecoderFactory;
import com.tqc.config.TqcConfig;
import com.tqc.coordination.LeaseExpiryMonitor;

public class TqcModule extends AbstractModule {

    private final TqcConfig config;

    public TqcModule(TqcConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(TqcConfig.class).toInstance(config);
        bind(RemoteDataCache.class).in(Singleton.class);
        bind(DecoderFactory.class).in(Singleton.class);
        bind(LeaseExpiryMonitor.class).in(Singleton.class);
    }
}
