package com.flapmyport.core.spi;

import com.flapmyport.core.model.TrapNotification;

@FunctionalInterface
public interface TrapListener {
    void onTrap(TrapNotification trap);
}
