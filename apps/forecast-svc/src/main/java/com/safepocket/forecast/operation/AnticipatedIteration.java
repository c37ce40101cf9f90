package com.safepocket.forecast.operation;

import com.safepocket.forecast.calendar.DateSpan;
import com.safepocket.forecast.model.HistoricOperation;

/**
 * A future iteration already paid by an operation dated inside its early window.
 */
public record AnticipatedIteration(DateSpan iteration, HistoricOperation operation) {
}
