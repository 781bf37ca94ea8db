package com.flapmyport.core.spi;

import java.io.Closeable;

public interface ProtocolDriver extends Closeable {
    void start() throws Exception;
    void setListener(TrapListener listener);
}
