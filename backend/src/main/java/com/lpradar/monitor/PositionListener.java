package com.lpradar.monitor;

public interface PositionListener {

    void onSwap(PositionSwapEvent event);

    /**
     * Called after {@link #onSwap} when the in-range status differs from the one last emitted.
     * Not called for the first swap a listener sees.
     */
    default void onRangeChange(PositionSwapEvent event) {
    }
}
