package com.ads.guardian.platform;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateAck {

    private String entityId;
    private PlatformStatus status;
    private String idempotencyKey;

    // true when the platform had already applied this key
    private boolean duplicate;

    private LocalDateTime acknowledgedAt;
}
