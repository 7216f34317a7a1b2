package com.lpradar.monitor;

@FunctionalInterface
public interface PoolListener {

    void onSwap(SwapEvent event);
}
