package com.safepocket.forecast.operation;

import com.safepocket.forecast.model.ForecastDomainException;
import java.time.LocalDate;

public class InvalidIterationException extends ForecastDomainException {

    public InvalidIterationException(LocalDate iterationDate, String target) {
        super(iterationDate + " is not an iteration start of " + target);
    }
}
