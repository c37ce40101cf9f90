package com.safepocket.forecast.forecast;

import java.time.LocalDate;

public record BalancePoint(LocalDate date, double balance) {
}
