package com.xinyue.hft.core;

import com.lmax.disruptor.EventFactory;
import com.xinyue.hft.common.CoreEvent;

public final class CoreEventFactory implements EventFactory<CoreEvent> {
    @Override
    public CoreEvent newInstance() {
        return new CoreEvent();
    }
}
