package com.lpradar.monitor.notify;

import com.lpradar.domain.Pool;
import com.lpradar.monitor.PositionSwapEvent;
import com.lpradar.monitor.SwapEvent;
import com.lpradar.monitor.alert.TriggeredAlert;
import com.lpradar.pricing.PriceMath;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text rendering of monitoring notifications.
 */
@Component
public class MessageFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public MessageFormatter(Clock monitorClock) {
        this.clock = monitorClock;
    }

    public String swapMessage(SwapEvent event) {
        return event.price().format() + " " + event.pairLabel() + " " + LocalTime.now(clock).format(TIME)
                + "\nTick: " + event.tick()
                + "\nLast Swap: " + plain(event.volume()) + " " + event.volumeSymbol();
    }

    public String alertMessage(TriggeredAlert triggered, Pool pool) {
        return "Price Alert!"
                + "\nPool: " + pool.pairLabel()
                + "\nPrice " + triggered.direction().text() + " "
                + triggered.alert().getTargetPrice().setScale(PriceMath.DISPLAY_DECIMALS, RoundingMode.HALF_UP).toPlainString() + "."
                + "\nCurrent Price: " + triggered.currentPrice().format();
    }

    public String positionMessage(PositionSwapEvent event) {
        SwapEvent swap = event.swap();
        return (event.inRange() ? "In range " : "Out of range ") + swap.price().format() + " " + swap.pairLabel()
                + "\nRange: " + event.lowerPrice().format() + " - " + event.upperPrice().format()
                + "\nTick: " + swap.tick() + " [" + event.tickLower() + ", " + event.tickUpper() + ")"
                + "\n#" + event.tokenId() + " " + LocalTime.now(clock).format(TIME);
    }

    public String rangeMessage(PositionSwapEvent event) {
        String headline = event.inRange() ? "Position Back in Range" : "Position Out of Range";
        return headline
                + "\n#" + event.tokenId() + " " + event.swap().pairLabel()
                + "\nPrice: " + event.swap().price().format()
                + "\nRange: " + event.lowerPrice().format() + " - " + event.upperPrice().format();
    }

    private static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }
}
