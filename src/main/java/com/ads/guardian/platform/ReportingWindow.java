package com.ads.guardian.platform;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class ReportingWindow {

    private LocalDateTime from;
    private LocalDateTime to;

    /**
     * Window from the start of the tick's day up to the tick itself.
     */
    public static ReportingWindow dayUntil(LocalDateTime tickTime) {
        return new ReportingWindow(tickTime.toLocalDate().atStartOfDay(), tickTime);
    }
}
