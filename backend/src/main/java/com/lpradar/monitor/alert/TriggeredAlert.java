package com.lpradar.monitor.alert;

import com.lpradar.pricing.Price;

public record TriggeredAlert(PriceAlert alert, CrossDirection direction, Price previousPrice, Price currentPrice) {
}
