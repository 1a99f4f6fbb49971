package com.ads.guardian.action;

import com.ads.guardian.platform.StatusUpdateAck;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyOutcome {

    private StatusChangeIntent intent;
    private ApplyStatus status;
    private int attempts;
    private StatusUpdateAck ack;
    private String failureMessage;

    public boolean isFailed() {
        return status == ApplyStatus.FAILED;
    }

    public static ApplyOutcome failed(StatusChangeIntent intent, int attempts, String message) {
        return ApplyOutcome.builder()
                .intent(intent)
                .status(ApplyStatus.FAILED)
                .attempts(attempts)
                .failureMessage(message)
                .build();
    }
}
