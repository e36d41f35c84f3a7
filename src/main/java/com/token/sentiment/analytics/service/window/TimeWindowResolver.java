package com.token.sentiment.analytics.service.window;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.model.dto.SplitWindow;
import com.token.sentiment.analytics.model.dto.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns a "days back" parameter into concrete windows ending now.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimeWindowResolver {

    private final Clock clock;

    public TimeWindow resolve(int daysBack) {
        Guards.requirePositive("days_back", daysBack);
        Instant end = clock.instant();
        TimeWindow w = new TimeWindow(end.minus(Duration.ofDays(daysBack)), end);
        log.debug("resolve({}): {} .. {}", daysBack, w.start(), w.end());
        return w;
    }

    /**
     * Two adjacent halves of the window; the split point is {@code end - daysBack / 2} whole days,
     * so an odd window gives the extra day to the first half.
     */
    public SplitWindow split(int daysBack) {
        TimeWindow whole = resolve(daysBack);
        Instant mid = whole.end().minus(Duration.ofDays(daysBack / 2));
        return new SplitWindow(new TimeWindow(whole.start(), mid), new TimeWindow(mid, whole.end()));
    }
}
