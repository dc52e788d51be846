package com.tradegate.calendar;

import java.time.Instant;
import java.time.LocalTime;
import org.springframework.stereotype.Component;

/**
 * Decides whether an absolute instant falls inside a {@link TimeWindow}.
 *
 * <p>The instant is converted with the window zone's own rules, so "08:00 Europe/London"
 * means 08:00 on the wall clock whether London is on GMT or BST that day, including the
 * day of the clock change. Stateless and safe for concurrent use.
 */
@Component
public class TimeWindowEvaluator {

    public boolean contains(Instant instant, TimeWindow window) {
        LocalTime localTime = instant.atZone(window.getZone()).toLocalTime();
        return !localTime.isBefore(window.getStart()) && localTime.isBefore(window.getEnd());
    }
}
